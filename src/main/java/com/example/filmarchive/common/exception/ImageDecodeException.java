package com.example.filmarchive.common.exception;

import java.nio.file.Path;

public class ImageDecodeException extends PipelineException {

    private final Path path;

    public ImageDecodeException(Path path, String message) {
        super("IMAGE_DECODE_FAILED", message);
        this.path = path;
    }

    public ImageDecodeException(Path path, String message, Throwable cause) {
        super("IMAGE_DECODE_FAILED", message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
