package com.example.filmarchive.infrastructure.image;

import java.nio.file.Path;

public interface PerceptualHasher {

    int bitLength();

    /**
     * Lowercase hex fingerprint of the image, {@code bitLength() / 4} characters long.
     *
     * @throws com.example.filmarchive.common.exception.ImageDecodeException when the file cannot be decoded
     */
    String hash(Path path);
}
