package com.example.filmarchive.infrastructure.image;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

public interface CaptureTimeReader {

    /**
     * Capture time embedded in the file's metadata, if any field parses.
     */
    Optional<LocalDateTime> readCaptureTime(Path path);
}
