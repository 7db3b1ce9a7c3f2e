package com.example.filmarchive.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OutputFormat {

    JPEG("jpg", ".jpg", true),
    PNG_ARCHIVE("png", "_archive.png", false),
    TIFF_16BIT("tiff", "_16bit.tif", false),
    JPEG_XL("jxl", ".jxl", false);

    private final String value;
    private final String suffix;
    private final boolean mandatory;

    OutputFormat(String value, String suffix, boolean mandatory) {
        this.value = value;
        this.suffix = suffix;
        this.mandatory = mandatory;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getSuffix() {
        return suffix;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    public String fileName(String stem) {
        return stem + suffix;
    }
}
