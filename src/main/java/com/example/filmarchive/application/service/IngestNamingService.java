package com.example.filmarchive.application.service;

import com.example.filmarchive.common.config.AppPipelineProperties;
import com.example.filmarchive.common.exception.PipelineException;
import com.example.filmarchive.common.exception.TransientIoException;
import com.example.filmarchive.common.util.ImageFileTypes;
import com.example.filmarchive.infrastructure.image.CaptureTimeReader;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Renames incoming scans to {@code image_yyMMdd_HHmmss[_NN].<ext>} and moves them into the
 * archive directory. Scanners restart their own numbering per batch, so the capture time is
 * the only stable identity a frame has.
 */
@Service
public class IngestNamingService {

    private static final Logger log = LoggerFactory.getLogger(IngestNamingService.class);

    static final String NAME_PREFIX = "image_";
    static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyMMdd_HHmmss");
    private static final int MAX_SUFFIX = 9999;

    private final CaptureTimeReader captureTimeReader;
    private final AppPipelineProperties appPipelineProperties;
    private final ZoneId fileTimeZone;

    public IngestNamingService(CaptureTimeReader captureTimeReader,
                               AppPipelineProperties appPipelineProperties) {
        this(captureTimeReader, appPipelineProperties, ZoneId.systemDefault());
    }

    IngestNamingService(CaptureTimeReader captureTimeReader,
                        AppPipelineProperties appPipelineProperties,
                        ZoneId fileTimeZone) {
        this.captureTimeReader = captureTimeReader;
        this.appPipelineProperties = appPipelineProperties;
        this.fileTimeZone = fileTimeZone;
    }

    public Path ingest(Path source) {
        return ingest(source, appPipelineProperties.archivedDirectory());
    }

    public synchronized Path ingest(Path source, Path destinationDir) {
        if (!Files.isRegularFile(source)) {
            throw new TransientIoException("Source vanished before ingest: " + source);
        }
        LocalDateTime captured = captureTime(source);
        String extension = ImageFileTypes.extension(source.getFileName().toString());
        try {
            Files.createDirectories(destinationDir);
        } catch (IOException e) {
            throw new TransientIoException("Cannot create archive directory " + destinationDir, e);
        }
        Path destination = reserve(destinationDir, baseName(captured), extension);
        relocate(source, destination);
        log.info("INGEST_DONE source={} archived={} captured={}",
                source.getFileName(), destination.getFileName(), captured);
        return destination;
    }

    LocalDateTime captureTime(Path source) {
        Optional<LocalDateTime> exif = captureTimeReader.readCaptureTime(source);
        if (exif.isPresent()) {
            return exif.get();
        }
        try {
            return LocalDateTime.ofInstant(Files.getLastModifiedTime(source).toInstant(), fileTimeZone);
        } catch (IOException e) {
            throw new TransientIoException("Cannot read modification time of " + source, e);
        }
    }

    static String baseName(LocalDateTime captured) {
        return NAME_PREFIX + NAME_FORMAT.format(captured);
    }

    /**
     * Finds the first free stem and claims it by creating an empty placeholder file.
     * A stem is taken when any file in the directory carries it, whatever its extension.
     */
    Path reserve(Path dir, String base, String extension) {
        String suffix = extension == null ? "" : "." + extension;
        for (int counter = 0; counter <= MAX_SUFFIX; counter++) {
            String stem = counter == 0 ? base : base + String.format("_%02d", counter);
            if (stemTaken(dir, stem)) {
                continue;
            }
            Path candidate = dir.resolve(stem + suffix);
            try {
                Files.createFile(candidate);
                return candidate;
            } catch (FileAlreadyExistsException e) {
                log.debug("INGEST_NAME_RACE candidate={}", candidate.getFileName());
            } catch (IOException e) {
                throw new TransientIoException("Cannot reserve " + candidate, e);
            }
        }
        throw new PipelineException("INGEST_NAME_EXHAUSTED", "No free name for " + base + " in " + dir);
    }

    private static boolean stemTaken(Path dir, String stem) {
        if (Files.exists(dir.resolve(stem))) {
            return true;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, stem + ".*")) {
            return stream.iterator().hasNext();
        } catch (IOException e) {
            throw new TransientIoException("Cannot list " + dir, e);
        }
    }

    private static void relocate(Path source, Path destination) {
        try {
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
            return;
        } catch (NoSuchFileException e) {
            releaseReservation(destination);
            throw new TransientIoException("Source vanished during ingest: " + source, e);
        } catch (IOException e) {
            log.info("INGEST_MOVE_FALLBACK source={} reason={}", source.getFileName(), e.getMessage());
        }
        try {
            Files.copy(source, destination, StandardCopyOption.REPLACE_EXISTING);
            Files.delete(source);
        } catch (NoSuchFileException e) {
            releaseReservation(destination);
            throw new TransientIoException("Source vanished during ingest: " + source, e);
        } catch (IOException e) {
            releaseReservation(destination);
            throw new PipelineException("INGEST_FAILED", "Cannot relocate " + source + " to " + destination, e);
        }
    }

    private static void releaseReservation(Path destination) {
        try {
            Files.deleteIfExists(destination);
        } catch (IOException e) {
            log.warn("INGEST_RESERVATION_LEAK path={} reason={}", destination, e.getMessage());
        }
    }
}
