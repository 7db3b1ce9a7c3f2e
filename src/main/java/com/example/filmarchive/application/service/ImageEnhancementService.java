package com.example.filmarchive.application.service;

import com.example.filmarchive.common.config.AppEnhanceProperties;
import com.example.filmarchive.common.exception.PipelineException;
import com.example.filmarchive.domain.enumtype.EnhancementPreset;
import com.example.filmarchive.domain.enumtype.OutputFormat;
import com.example.filmarchive.domain.model.EnhancementParams;
import com.example.filmarchive.domain.model.EnhancementResult;
import com.example.filmarchive.domain.model.FaceRegion;
import com.example.filmarchive.infrastructure.image.FaceDetector;
import com.example.filmarchive.infrastructure.image.ImageCodec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.FloatBuffer;
import java.nio.ShortBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_imgproc.CLAHE;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Enhancement of scanned slides and negatives.
 * <p>
 * Every frame goes through the same fixed stages:
 * <ol>
 *   <li>bit-depth normalisation to 8-bit BGR, with a 0.1/99.9 percentile stretch for 16-bit scans</li>
 *   <li>auto-levels on the luma histogram to remove the grey haze of faded film</li>
 *   <li>CLAHE on the L channel of Lab, tile grid sized from the resolution</li>
 *   <li>optional softening of detected faces, blended in through a feathered mask</li>
 * </ol>
 * In auto-quality mode the stages run once per preset and the best scoring output wins.
 */
@Service
public class ImageEnhancementService {

    private static final Logger log = LoggerFactory.getLogger(ImageEnhancementService.class);

    static final double LOW_PERCENTILE = 0.1D;
    static final double HIGH_PERCENTILE = 99.9D;
    static final int GRID_PIXELS_PER_TILE = 450;
    static final int MIN_GRID = 4;
    static final int MAX_GRID = 16;
    static final int FIXED_GRID = 8;
    static final double FACE_MARGIN = 0.3D;
    static final int FACE_MASK_BLUR = 51;

    private final ImageCodec imageCodec;
    private final FaceDetector faceDetector;
    private final AppEnhanceProperties appEnhanceProperties;
    private final Set<OutputFormat> writableFormats;

    public ImageEnhancementService(ImageCodec imageCodec,
                                   FaceDetector faceDetector,
                                   AppEnhanceProperties appEnhanceProperties) {
        this.imageCodec = imageCodec;
        this.faceDetector = faceDetector;
        this.appEnhanceProperties = appEnhanceProperties;
        this.writableFormats = resolveFormats(imageCodec, appEnhanceProperties);
    }

    public Set<OutputFormat> getWritableFormats() {
        return Collections.unmodifiableSet(writableFormats);
    }

    /**
     * Enhances with the configured mode: a fixed preset when one is configured, else
     * auto-quality when enabled, else the configured histogram clip and contrast limit.
     */
    public EnhancementResult enhance(Path source) {
        EnhancementPreset configured = appEnhanceProperties.getPreset();
        if (configured != null) {
            return enhance(source, configured);
        }
        Mat raw = imageCodec.read(source);
        try {
            return enhance(raw);
        } finally {
            raw.release();
        }
    }

    public EnhancementResult enhance(Path source, EnhancementPreset preset) {
        Mat raw = imageCodec.read(source);
        try {
            return enhance(raw, preset);
        } finally {
            raw.release();
        }
    }

    EnhancementResult enhance(Mat raw, EnhancementPreset preset) {
        Mat bgr = normalize(raw);
        try {
            return run(bgr, raw.cols(), raw.rows(), preset.getHistogramClip(), preset.getClaheClipLimit(), preset);
        } finally {
            bgr.release();
        }
    }

    EnhancementResult enhance(Mat raw) {
        Mat bgr = normalize(raw);
        try {
            if (appEnhanceProperties.isAutoQuality()) {
                return enhanceAuto(bgr, raw.cols(), raw.rows());
            }
            return run(bgr, raw.cols(), raw.rows(),
                    appEnhanceProperties.getHistogramClip(), appEnhanceProperties.getClaheClipLimit(), null);
        } finally {
            bgr.release();
        }
    }

    /**
     * Runs every preset in declaration order and keeps the highest score; the first
     * evaluated preset wins a tie.
     */
    EnhancementResult enhanceAuto(Mat bgr, int width, int height) {
        EnhancementResult best = null;
        for (EnhancementPreset preset : EnhancementPreset.values()) {
            EnhancementResult candidate = run(bgr, width, height,
                    preset.getHistogramClip(), preset.getClaheClipLimit(), preset);
            log.debug("ENHANCE_PRESET_SCORED preset={} score={}", preset.getValue(), candidate.getQualityScore());
            if (best == null || candidate.getQualityScore() > best.getQualityScore()) {
                if (best != null) {
                    best.getEnhanced().release();
                }
                best = candidate;
            } else {
                candidate.getEnhanced().release();
            }
        }
        return best;
    }

    private EnhancementResult run(Mat bgr, int width, int height,
                                  double histogramClip, double claheClip, EnhancementPreset preset) {
        int[] grid = tileGrid(bgr.cols(), bgr.rows(), appEnhanceProperties.isAdaptiveGrid());
        Mat levelled = autoLevels(bgr, histogramClip);
        Mat contrasted = applyClahe(levelled, claheClip, grid);
        boolean facesFound = false;
        try {
            if (appEnhanceProperties.isFaceDetection() && faceDetector.isAvailable()) {
                List<FaceRegion> faces = faceDetector.detect(contrasted);
                if (!faces.isEmpty()) {
                    facesFound = true;
                    Mat gentle = applyClahe(levelled, claheClip * 0.5D, grid);
                    try {
                        Mat blended = blendFaces(gentle, contrasted, faces);
                        contrasted.release();
                        contrasted = blended;
                    } finally {
                        gentle.release();
                    }
                }
            }
        } finally {
            levelled.release();
        }
        double score = QualityScorer.measure(contrasted);
        EnhancementParams params = new EnhancementParams(histogramClip, claheClip, grid[0], grid[1], preset);
        return new EnhancementResult(contrasted, width, height, params, facesFound, score);
    }

    public Map<OutputFormat, Path> save(EnhancementResult result, Path outputDir, String stem) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new PipelineException("OUTPUT_WRITE_FAILED", "Cannot create output directory " + outputDir, e);
        }
        Map<OutputFormat, Path> saved = new EnumMap<>(OutputFormat.class);
        Mat enhanced = result.getEnhanced();
        for (OutputFormat format : writableFormats) {
            Path target = outputDir.resolve(format.fileName(stem));
            boolean ok;
            switch (format) {
                case JPEG:
                    ok = imageCodec.write(target, enhanced,
                            opencv_imgcodecs.IMWRITE_JPEG_QUALITY, appEnhanceProperties.getJpegQuality());
                    break;
                case TIFF_16BIT:
                    Mat wide = new Mat();
                    try {
                        enhanced.convertTo(wide, opencv_core.CV_16U, 256.0D, 0.0D);
                        ok = imageCodec.write(target, wide);
                    } finally {
                        wide.release();
                    }
                    break;
                default:
                    ok = imageCodec.write(target, enhanced);
                    break;
            }
            if (ok) {
                saved.put(format, target);
            } else if (format.isMandatory()) {
                throw new PipelineException("OUTPUT_WRITE_FAILED", "Cannot write " + target);
            } else {
                log.warn("ENHANCE_OPTIONAL_OUTPUT_FAILED format={} file={}", format.getValue(), target.getFileName());
            }
        }
        return saved;
    }

    static Mat normalize(Mat raw) {
        Mat eight;
        if (raw.depth() == opencv_core.CV_16U) {
            eight = stretch16(raw);
        } else if (raw.depth() == opencv_core.CV_8U) {
            eight = raw.clone();
        } else {
            eight = new Mat();
            raw.convertTo(eight, opencv_core.CV_8U);
        }
        int channels = eight.channels();
        if (channels == 3) {
            return eight;
        }
        Mat bgr = new Mat();
        if (channels == 1) {
            opencv_imgproc.cvtColor(eight, bgr, opencv_imgproc.COLOR_GRAY2BGR);
        } else {
            opencv_imgproc.cvtColor(eight, bgr, opencv_imgproc.COLOR_BGRA2BGR);
        }
        eight.release();
        return bgr;
    }

    /**
     * Linear stretch of a 16-bit frame so the 0.1 and 99.9 percentiles of all samples,
     * every channel pooled, land on 0 and 255.
     */
    static Mat stretch16(Mat raw) {
        Mat source = raw.isContinuous() ? raw : raw.clone();
        try {
            ShortBuffer buffer = source.createBuffer();
            long[] hist = new long[65536];
            long total = 0;
            while (buffer.hasRemaining()) {
                hist[buffer.get() & 0xFFFF]++;
                total++;
            }
            double low = percentile(hist, total, LOW_PERCENTILE);
            double high = percentile(hist, total, HIGH_PERCENTILE);
            Mat out = new Mat();
            if (high > low) {
                double alpha = 255.0D / (high - low);
                source.convertTo(out, opencv_core.CV_8U, alpha, -low * alpha);
            } else {
                // flat frame: plain high-byte truncation
                source.convertTo(out, opencv_core.CV_8U, 1.0D / 257.0D, 0.0D);
            }
            return out;
        } finally {
            if (source != raw) {
                source.release();
            }
        }
    }

    static double percentile(long[] hist, long total, double percent) {
        if (total <= 0) {
            return 0.0D;
        }
        double rank = percent / 100.0D * (total - 1);
        long lowerRank = (long) Math.floor(rank);
        long upperRank = (long) Math.ceil(rank);
        int lowerValue = valueAtRank(hist, lowerRank);
        int upperValue = lowerRank == upperRank ? lowerValue : valueAtRank(hist, upperRank);
        return lowerValue + (upperValue - lowerValue) * (rank - lowerRank);
    }

    private static int valueAtRank(long[] hist, long rank) {
        long seen = 0;
        for (int v = 0; v < hist.length; v++) {
            seen += hist[v];
            if (seen > rank) {
                return v;
            }
        }
        return hist.length - 1;
    }

    /**
     * Clips {@code histogramClip} percent of pixels off each end of the luma histogram and
     * stretches the remaining range over 0..255 on every channel.
     */
    static Mat autoLevels(Mat bgr, double histogramClip) {
        Mat gray = new Mat();
        long[] hist;
        try {
            opencv_imgproc.cvtColor(bgr, gray, opencv_imgproc.COLOR_BGR2GRAY);
            hist = histogram8(gray);
        } finally {
            gray.release();
        }
        long total = 0;
        long[] cdf = new long[hist.length];
        for (int i = 0; i < hist.length; i++) {
            total += hist[i];
            cdf[i] = total;
        }
        long clip = (long) (total * histogramClip / 100.0D);
        int black = firstAtLeast(cdf, clip);
        int white = firstAtLeast(cdf, total - clip);
        Mat out = new Mat();
        if (white <= black) {
            bgr.copyTo(out);
            return out;
        }
        double alpha = 255.0D / (white - black);
        bgr.convertTo(out, -1, alpha, -alpha * black);
        return out;
    }

    private static int firstAtLeast(long[] cdf, long target) {
        for (int i = 0; i < cdf.length; i++) {
            if (cdf[i] >= target) {
                return i;
            }
        }
        return cdf.length;
    }

    static Mat applyClahe(Mat bgr, double clipLimit, int[] grid) {
        Mat lab = new Mat();
        MatVector planes = new MatVector();
        Mat lightness = new Mat();
        CLAHE clahe = opencv_imgproc.createCLAHE(clipLimit, new Size(grid[0], grid[1]));
        try {
            opencv_imgproc.cvtColor(bgr, lab, opencv_imgproc.COLOR_BGR2Lab);
            opencv_core.split(lab, planes);
            clahe.apply(planes.get(0), lightness);
            planes.put(0, lightness);
            opencv_core.merge(planes, lab);
            Mat out = new Mat();
            opencv_imgproc.cvtColor(lab, out, opencv_imgproc.COLOR_Lab2BGR);
            return out;
        } finally {
            lab.release();
            lightness.release();
            planes.close();
            clahe.close();
        }
    }

    // {width, height}
    static int[] tileGrid(int width, int height, boolean adaptive) {
        if (!adaptive) {
            return new int[]{FIXED_GRID, FIXED_GRID};
        }
        return new int[]{clampGrid(width / GRID_PIXELS_PER_TILE), clampGrid(height / GRID_PIXELS_PER_TILE)};
    }

    private static int clampGrid(int tiles) {
        return Math.max(MIN_GRID, Math.min(MAX_GRID, tiles));
    }

    static Mat blendFaces(Mat gentle, Mat full, List<FaceRegion> faces) {
        int rows = full.rows();
        int cols = full.cols();
        Mat mask = new Mat(rows, cols, opencv_core.CV_32FC1, Scalar.all(0.0D));
        Mat gentleC = gentle.isContinuous() ? gentle : gentle.clone();
        Mat fullC = full.isContinuous() ? full : full.clone();
        try {
            for (FaceRegion face : faces) {
                int margin = (int) (Math.max(face.getWidth(), face.getHeight()) * FACE_MARGIN);
                int x1 = Math.max(0, face.getX() - margin);
                int y1 = Math.max(0, face.getY() - margin);
                int x2 = Math.min(cols, face.getX() + face.getWidth() + margin);
                int y2 = Math.min(rows, face.getY() + face.getHeight() + margin);
                opencv_imgproc.ellipse(mask,
                        new Point((x1 + x2) / 2, (y1 + y2) / 2),
                        new Size((x2 - x1) / 2, (y2 - y1) / 2),
                        0.0D, 0.0D, 360.0D, Scalar.all(1.0D), -1, opencv_imgproc.LINE_8, 0);
            }
            opencv_imgproc.GaussianBlur(mask, mask, new Size(FACE_MASK_BLUR, FACE_MASK_BLUR), 0.0D);

            FloatBuffer weights = mask.createBuffer();
            ByteBuffer soft = gentleC.createBuffer();
            ByteBuffer hard = fullC.createBuffer();
            Mat out = new Mat(rows, cols, opencv_core.CV_8UC3);
            ByteBuffer target = out.createBuffer();
            int pixels = rows * cols;
            for (int p = 0; p < pixels; p++) {
                float w = weights.get(p);
                int base = p * 3;
                for (int c = 0; c < 3; c++) {
                    int g = soft.get(base + c) & 0xFF;
                    int f = hard.get(base + c) & 0xFF;
                    target.put(base + c, (byte) (int) (g * w + f * (1.0F - w)));
                }
            }
            return out;
        } finally {
            mask.release();
            if (gentleC != gentle) {
                gentleC.release();
            }
            if (fullC != full) {
                fullC.release();
            }
        }
    }

    static long[] histogram8(Mat gray) {
        Mat source = gray.isContinuous() ? gray : gray.clone();
        try {
            ByteBuffer buffer = source.createBuffer();
            long[] hist = new long[256];
            while (buffer.hasRemaining()) {
                hist[buffer.get() & 0xFF]++;
            }
            return hist;
        } finally {
            if (source != gray) {
                source.release();
            }
        }
    }

    private static Set<OutputFormat> resolveFormats(ImageCodec codec, AppEnhanceProperties props) {
        Set<OutputFormat> formats = EnumSet.of(OutputFormat.JPEG);
        addIfWritable(formats, codec, OutputFormat.PNG_ARCHIVE, props.isEnablePngArchive(), ".png");
        addIfWritable(formats, codec, OutputFormat.TIFF_16BIT, props.isEnableTiffArchive(), ".tif");
        addIfWritable(formats, codec, OutputFormat.JPEG_XL, props.isEnableJpegXl(), ".jxl");
        log.info("ENHANCE_OUTPUT_FORMATS formats={}", formats);
        return formats;
    }

    private static void addIfWritable(Set<OutputFormat> formats, ImageCodec codec, OutputFormat format,
                                      boolean enabled, String encoderSuffix) {
        if (!enabled) {
            return;
        }
        if (codec.canWrite(encoderSuffix)) {
            formats.add(format);
        } else {
            log.info("ENHANCE_ENCODER_UNAVAILABLE format={}", format.getValue());
        }
    }
}
