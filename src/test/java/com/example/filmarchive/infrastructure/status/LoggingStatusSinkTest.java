package com.example.filmarchive.infrastructure.status;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.filmarchive.domain.enumtype.PipelineStage;
import com.example.filmarchive.domain.model.StatusUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class LoggingStatusSinkTest {

    @Test
    void updateShouldSerializeStageAsLowercaseValue() throws JsonProcessingException {
        ObjectMapper objectMapper = new ObjectMapper();
        StatusUpdate update = new StatusUpdate(PipelineStage.ENHANCING, 40, "image_240210_143215.tif", null);

        String json = objectMapper.writeValueAsString(update);

        assertEquals("{\"stage\":\"enhancing\",\"progress\":40,\"file\":\"image_240210_143215.tif\"}", json);
        assertFalse(json.contains("error"));
        assertDoesNotThrow(() -> new LoggingStatusSink(objectMapper).publish(update));
    }

    @Test
    void serializationFailureShouldNotEscape() throws JsonProcessingException {
        ObjectMapper objectMapper = mock(ObjectMapper.class);
        when(objectMapper.writeValueAsString(any())).thenThrow(new JsonMappingException(null, "boom"));
        LoggingStatusSink sink = new LoggingStatusSink(objectMapper);

        assertDoesNotThrow(() -> sink.publish(new StatusUpdate(PipelineStage.ERROR, 0, "a.tif", "corrupt")));
    }
}
