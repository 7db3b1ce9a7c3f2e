package com.example.filmarchive.infrastructure.image;

import com.example.filmarchive.common.config.AppEnhanceProperties;
import com.example.filmarchive.domain.model.FaceRegion;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.RectVector;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_objdetect.CascadeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Haar cascade frontal face detector. The cascade is loaded once; when the configured
 * file is missing or unreadable the detector reports itself unavailable.
 */
@Component
public class CascadeFaceDetector implements FaceDetector {

    private static final Logger log = LoggerFactory.getLogger(CascadeFaceDetector.class);

    static final int MAX_DIMENSION = 8000;
    private static final double SCALE_FACTOR = 1.1D;
    private static final int MIN_NEIGHBORS = 5;
    private static final int MIN_FACE_SIZE = 30;

    private final CascadeClassifier classifier;

    public CascadeFaceDetector(AppEnhanceProperties appEnhanceProperties) {
        this.classifier = appEnhanceProperties.isFaceDetection()
                ? load(appEnhanceProperties.getFaceCascadePath())
                : null;
    }

    @Override
    public boolean isAvailable() {
        return classifier != null;
    }

    @Override
    public List<FaceRegion> detect(Mat bgr) {
        if (classifier == null || bgr == null || bgr.empty()) {
            return Collections.emptyList();
        }
        if (bgr.rows() > MAX_DIMENSION || bgr.cols() > MAX_DIMENSION) {
            log.warn("FACE_DETECT_SKIPPED reason=too_large width={} height={}", bgr.cols(), bgr.rows());
            return Collections.emptyList();
        }
        Mat gray = new Mat();
        RectVector found = new RectVector();
        try {
            opencv_imgproc.cvtColor(bgr, gray, opencv_imgproc.COLOR_BGR2GRAY);
            // CascadeClassifier keeps scratch buffers per instance
            synchronized (classifier) {
                classifier.detectMultiScale(gray, found, SCALE_FACTOR, MIN_NEIGHBORS, 0,
                        new Size(MIN_FACE_SIZE, MIN_FACE_SIZE), new Size());
            }
            List<FaceRegion> faces = new ArrayList<>((int) found.size());
            for (long i = 0; i < found.size(); i++) {
                Rect r = found.get(i);
                faces.add(new FaceRegion(r.x(), r.y(), r.width(), r.height()));
            }
            return faces;
        } catch (RuntimeException e) {
            log.warn("FACE_DETECT_FAILED reason={}", e.getMessage());
            return Collections.emptyList();
        } finally {
            gray.release();
            found.close();
        }
    }

    private static CascadeClassifier load(String cascadePath) {
        if (cascadePath == null || cascadePath.trim().isEmpty()) {
            log.info("FACE_DETECT_DISABLED reason=no_cascade_path");
            return null;
        }
        Path path = Paths.get(cascadePath.trim());
        if (!Files.isRegularFile(path)) {
            log.info("FACE_DETECT_DISABLED reason=cascade_missing path={}", path);
            return null;
        }
        try {
            CascadeClassifier loaded = new CascadeClassifier(path.toString());
            if (loaded.empty()) {
                log.warn("FACE_DETECT_DISABLED reason=cascade_unreadable path={}", path);
                loaded.close();
                return null;
            }
            log.info("FACE_DETECT_READY cascade={}", path);
            return loaded;
        } catch (RuntimeException e) {
            log.warn("FACE_DETECT_DISABLED reason=cascade_load_failed path={} msg={}", path, e.getMessage());
            return null;
        }
    }
}
