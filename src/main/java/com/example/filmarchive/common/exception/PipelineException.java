package com.example.filmarchive.common.exception;

/**
 * Base failure of a single pipeline operation. The code identifies the failure class
 * in logs and in the error log kept by the pipeline statistics.
 */
public class PipelineException extends RuntimeException {

    private final String code;

    public PipelineException(String code, String message) {
        super(message);
        this.code = code;
    }

    public PipelineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
