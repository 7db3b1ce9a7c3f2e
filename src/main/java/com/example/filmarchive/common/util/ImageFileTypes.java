package com.example.filmarchive.common.util;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

public final class ImageFileTypes {

    public static final Set<String> SCAN_EXTENSIONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "tif", "tiff", "jpg", "jpeg"
    )));

    private ImageFileTypes() {
    }

    public static boolean isScanFile(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }
        String ext = extension(path.getFileName().toString());
        return ext != null && SCAN_EXTENSIONS.contains(ext.toLowerCase(Locale.ROOT));
    }

    public static String extension(String filename) {
        if (filename == null) {
            return null;
        }
        int dotIdx = filename.lastIndexOf('.');
        if (dotIdx <= 0 || dotIdx >= filename.length() - 1) {
            return null;
        }
        return filename.substring(dotIdx + 1);
    }

    public static String stem(String filename) {
        if (filename == null) {
            return null;
        }
        int dotIdx = filename.lastIndexOf('.');
        return dotIdx <= 0 ? filename : filename.substring(0, dotIdx);
    }
}
