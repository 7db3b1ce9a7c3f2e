package com.example.filmarchive.infrastructure.persistence;

import com.example.filmarchive.domain.model.EnhancementResult;
import com.example.filmarchive.domain.model.TagInfo;
import java.nio.file.Path;
import java.util.List;

/**
 * Catalogue of processed frames, keyed by the enhanced file name.
 */
public interface ImageRepository {

    Long upsert(Path originalPath, Path archivedPath, Path enhancedPath, EnhancementResult result);

    /**
     * Removes the record and its tags. Returns false when no record matched.
     */
    boolean delete(String filename);

    boolean hasAiTags(String filename);

    void saveAiTags(String filename, List<TagInfo> tags);
}
