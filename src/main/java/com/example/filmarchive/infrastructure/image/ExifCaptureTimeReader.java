package com.example.filmarchive.infrastructure.image;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the capture time from EXIF, trying DateTimeOriginal, then DateTimeDigitized,
 * then the IFD0 DateTime.
 */
@Component
public class ExifCaptureTimeReader implements CaptureTimeReader {

    private static final Logger log = LoggerFactory.getLogger(ExifCaptureTimeReader.class);
    private static final DateTimeFormatter EXIF_FORMAT = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    @Override
    public Optional<LocalDateTime> readCaptureTime(Path path) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(path.toFile());
        } catch (ImageProcessingException | IOException e) {
            log.debug("EXIF_READ_FAILED file={} reason={}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }
        ExifSubIFDDirectory subIfd = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);

        Optional<LocalDateTime> parsed = parseTag(subIfd, ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
        if (!parsed.isPresent()) {
            parsed = parseTag(subIfd, ExifSubIFDDirectory.TAG_DATETIME_DIGITIZED);
        }
        if (!parsed.isPresent()) {
            parsed = parseTag(ifd0, ExifIFD0Directory.TAG_DATETIME);
        }
        return parsed;
    }

    static Optional<LocalDateTime> parseExifDate(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(raw.trim(), EXIF_FORMAT));
        } catch (DateTimeParseException e) {
            log.debug("EXIF_DATE_UNPARSABLE value={}", raw);
            return Optional.empty();
        }
    }

    private static Optional<LocalDateTime> parseTag(Directory directory, int tag) {
        if (directory == null || !directory.containsTag(tag)) {
            return Optional.empty();
        }
        return parseExifDate(directory.getString(tag));
    }
}
