package com.example.filmarchive.infrastructure.status;

import com.example.filmarchive.domain.model.StatusUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingStatusSink implements StatusSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingStatusSink.class);

    private final ObjectMapper objectMapper;

    public LoggingStatusSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(StatusUpdate update) {
        try {
            String json = objectMapper.writeValueAsString(update);
            if (update.getError() != null) {
                log.warn("PIPELINE_STATUS_UPDATE {}", json);
            } else {
                log.info("PIPELINE_STATUS_UPDATE {}", json);
            }
        } catch (JsonProcessingException e) {
            log.warn("PIPELINE_STATUS_SERIALIZE_FAILED stage={} file={} reason={}",
                    update.getStage(), update.getFile(), e.getOriginalMessage());
        }
    }
}
