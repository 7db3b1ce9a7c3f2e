package com.example.filmarchive.infrastructure.image;

import com.example.filmarchive.domain.model.TagInfo;
import java.nio.file.Path;
import java.util.List;

public interface ImageTagger {

    boolean isAvailable();

    /**
     * Tags for an enhanced image, already filtered by the configured confidence threshold.
     * Returns an empty list when the image cannot be analysed.
     */
    List<TagInfo> generateTags(Path enhancedPath);
}
