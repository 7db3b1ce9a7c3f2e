package com.example.filmarchive.domain.model;

import java.nio.file.Path;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WatchedFile {

    private Path path;

    private long lastSize;

    /**
     * Epoch millis of the last observed size change, or of first sight.
     */
    private long lastChangeMillis;
}
