package com.example.filmarchive.infrastructure.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExifCaptureTimeReaderTest {

    @TempDir
    Path dir;

    @Test
    void shouldParseExifTimestamp() {
        assertEquals(Optional.of(LocalDateTime.of(2024, 2, 10, 14, 32, 15)),
                ExifCaptureTimeReader.parseExifDate("2024:02:10 14:32:15"));
        assertEquals(Optional.of(LocalDateTime.of(2024, 2, 10, 14, 32, 15)),
                ExifCaptureTimeReader.parseExifDate(" 2024:02:10 14:32:15 "));
    }

    @Test
    void shouldRejectBlankOrMalformedTimestamp() {
        assertFalse(ExifCaptureTimeReader.parseExifDate(null).isPresent());
        assertFalse(ExifCaptureTimeReader.parseExifDate("   ").isPresent());
        assertFalse(ExifCaptureTimeReader.parseExifDate("0000:00:00 00:00:00").isPresent());
        assertFalse(ExifCaptureTimeReader.parseExifDate("2024-02-10T14:32:15").isPresent());
    }

    @Test
    void unreadableFileShouldHaveNoCaptureTime() throws IOException {
        Path notAnImage = Files.write(dir.resolve("scan.tif"), "not a tiff".getBytes());

        assertFalse(new ExifCaptureTimeReader().readCaptureTime(notAnImage).isPresent());
    }
}
