package com.example.filmarchive.infrastructure.persistence;

import com.example.filmarchive.common.exception.PipelineException;
import com.example.filmarchive.domain.model.EnhancementParams;
import com.example.filmarchive.domain.model.EnhancementResult;
import com.example.filmarchive.domain.model.TagInfo;
import com.example.filmarchive.infrastructure.persistence.entity.ImageRecordEntity;
import com.example.filmarchive.infrastructure.persistence.entity.ImageTagEntity;
import com.example.filmarchive.infrastructure.persistence.mapper.ImageRecordMapper;
import com.example.filmarchive.infrastructure.persistence.mapper.ImageTagMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class MybatisImageRepository implements ImageRepository {

    private static final Logger log = LoggerFactory.getLogger(MybatisImageRepository.class);

    static final String STATUS_COMPLETE = "complete";
    static final String SOURCE_AI = "ai";

    private final ImageRecordMapper imageRecordMapper;
    private final ImageTagMapper imageTagMapper;
    private final Clock clock;

    public MybatisImageRepository(ImageRecordMapper imageRecordMapper,
                                  ImageTagMapper imageTagMapper,
                                  Clock clock) {
        this.imageRecordMapper = imageRecordMapper;
        this.imageTagMapper = imageTagMapper;
        this.clock = clock;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Long upsert(Path originalPath, Path archivedPath, Path enhancedPath, EnhancementResult result) {
        LocalDateTime now = LocalDateTime.now(clock);
        EnhancementParams params = result.getParams();

        ImageRecordEntity entity = new ImageRecordEntity();
        entity.setFilename(enhancedPath.getFileName().toString());
        entity.setOriginalPath(originalPath == null ? null : originalPath.toString());
        entity.setArchivedPath(archivedPath == null ? null : archivedPath.toString());
        entity.setEnhancedPath(enhancedPath.toString());
        entity.setWidth(result.getOriginalWidth());
        entity.setHeight(result.getOriginalHeight());
        entity.setFileSize(sizeOf(enhancedPath));
        entity.setStatus(STATUS_COMPLETE);
        if (params != null) {
            entity.setHistogramClip(params.getHistogramClip());
            entity.setClaheClip(params.getClaheClipLimit());
            entity.setPreset(params.getPreset() == null ? null : params.getPreset().getValue());
        }
        entity.setFaceDetected(result.isFacesDetected());
        entity.setQualityScore(result.getQualityScore());
        entity.setProcessedAt(now);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        imageRecordMapper.upsert(entity);

        ImageRecordEntity stored = imageRecordMapper.selectByFilename(entity.getFilename());
        if (stored == null) {
            throw new PipelineException("PERSIST_FAILED", "Image record missing after upsert: " + entity.getFilename());
        }
        log.debug("IMAGE_RECORD_UPSERT id={} filename={}", stored.getId(), stored.getFilename());
        return stored.getId();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean delete(String filename) {
        ImageRecordEntity existing = imageRecordMapper.selectByFilename(filename);
        if (existing == null) {
            log.warn("IMAGE_RECORD_DELETE_MISS filename={}", filename);
            return false;
        }
        imageTagMapper.deleteByImageId(existing.getId());
        imageRecordMapper.deleteById(existing.getId());
        log.info("IMAGE_RECORD_DELETED id={} filename={}", existing.getId(), filename);
        return true;
    }

    @Override
    public boolean hasAiTags(String filename) {
        ImageRecordEntity existing = imageRecordMapper.selectByFilename(filename);
        return existing != null && imageTagMapper.countByImageAndSource(existing.getId(), SOURCE_AI) > 0;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void saveAiTags(String filename, List<TagInfo> tags) {
        if (tags == null || tags.isEmpty()) {
            return;
        }
        ImageRecordEntity existing = imageRecordMapper.selectByFilename(filename);
        if (existing == null) {
            throw new PipelineException("PERSIST_FAILED", "No image record for tags: " + filename);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        for (TagInfo tag : tags) {
            ImageTagEntity entity = new ImageTagEntity();
            entity.setImageId(existing.getId());
            entity.setTag(tag.getLabel());
            entity.setSource(SOURCE_AI);
            entity.setConfidence(tag.getConfidence());
            entity.setCategory(tag.getCategory() == null ? "general" : tag.getCategory());
            entity.setCreatedAt(now);
            imageTagMapper.insert(entity);
        }
        log.info("IMAGE_TAGS_SAVED filename={} count={}", filename, tags.size());
    }

    private static Long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            log.debug("IMAGE_SIZE_UNKNOWN path={} reason={}", path, e.getMessage());
            return null;
        }
    }
}
