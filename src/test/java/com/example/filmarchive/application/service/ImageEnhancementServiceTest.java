package com.example.filmarchive.application.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.filmarchive.common.config.AppEnhanceProperties;
import com.example.filmarchive.common.exception.PipelineException;
import com.example.filmarchive.domain.enumtype.EnhancementPreset;
import com.example.filmarchive.domain.enumtype.OutputFormat;
import com.example.filmarchive.domain.model.EnhancementParams;
import com.example.filmarchive.domain.model.EnhancementResult;
import com.example.filmarchive.domain.model.FaceRegion;
import com.example.filmarchive.infrastructure.image.FaceDetector;
import com.example.filmarchive.infrastructure.image.ImageCodec;
import java.nio.ByteBuffer;
import java.nio.ShortBuffer;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;
import java.util.Random;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageEnhancementServiceTest {

    @TempDir
    Path outputDir;

    private ImageCodec imageCodec;
    private FaceDetector faceDetector;
    private AppEnhanceProperties properties;
    private ImageEnhancementService service;

    @BeforeEach
    void setUp() {
        imageCodec = mock(ImageCodec.class);
        faceDetector = mock(FaceDetector.class);
        when(faceDetector.isAvailable()).thenReturn(false);
        properties = new AppEnhanceProperties();
        service = new ImageEnhancementService(imageCodec, faceDetector, properties);
    }

    @Test
    void tileGridShouldScaleWithFrameSize() {
        assertArrayEquals(new int[]{8, 5}, ImageEnhancementService.tileGrid(3600, 2400, true));
        assertArrayEquals(new int[]{4, 4}, ImageEnhancementService.tileGrid(1000, 800, true));
        assertArrayEquals(new int[]{16, 16}, ImageEnhancementService.tileGrid(9000, 9000, true));
        assertArrayEquals(new int[]{8, 8}, ImageEnhancementService.tileGrid(9000, 9000, false));
    }

    @Test
    void percentileShouldInterpolateBetweenRanks() {
        long[] hist = new long[256];
        for (int v = 0; v < 100; v++) {
            hist[v] = 1;
        }

        assertEquals(49.5D, ImageEnhancementService.percentile(hist, 100, 50.0D), 1e-9);
        assertEquals(0.0D, ImageEnhancementService.percentile(hist, 100, 0.0D), 1e-9);
        assertEquals(99.0D, ImageEnhancementService.percentile(hist, 100, 100.0D), 1e-9);
        assertEquals(0.0D, ImageEnhancementService.percentile(new long[4], 0, 50.0D), 1e-9);
    }

    @Test
    void autoLevelsShouldStretchClippedRangeToFullScale() {
        Mat bgr = new Mat(10, 101, opencv_core.CV_8UC3);
        ByteBuffer buffer = bgr.createBuffer();
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 101; x++) {
                int base = (y * 101 + x) * 3;
                byte value = (byte) (50 + x);
                buffer.put(base, value);
                buffer.put(base + 1, value);
                buffer.put(base + 2, value);
            }
        }
        Mat levelled = ImageEnhancementService.autoLevels(bgr, 0.5D);
        Mat gray = new Mat();
        try {
            opencv_imgproc.cvtColor(levelled, gray, opencv_imgproc.COLOR_BGR2GRAY);
            long[] hist = ImageEnhancementService.histogram8(gray);
            assertEquals(0, QualityScorer.minLevel(hist));
            assertEquals(255, QualityScorer.maxLevel(hist));
        } finally {
            bgr.release();
            levelled.release();
            gray.release();
        }
    }

    @Test
    void sixteenBitScanShouldEnhanceAtFullResolution() {
        Path source = Paths.get("analysed", "image_240210_143215.tif");
        when(imageCodec.read(source)).thenReturn(sixteenBitFrame(2400, 3600));

        EnhancementResult result = service.enhance(source);
        try {
            assertEquals(3600, result.getOriginalWidth());
            assertEquals(2400, result.getOriginalHeight());
            assertEquals(3600, result.getEnhanced().cols());
            assertEquals(2400, result.getEnhanced().rows());
            assertEquals(opencv_core.CV_8UC3, result.getEnhanced().type());
            assertTrue(result.getQualityScore() >= 0.0D && result.getQualityScore() <= 100.0D);
            assertNotNull(result.getParams().getPreset());
            assertEquals(8, result.getParams().getTileGridWidth());
            assertEquals(5, result.getParams().getTileGridHeight());
        } finally {
            result.getEnhanced().release();
        }
    }

    @Test
    void autoQualityShouldKeepFirstPresetOnTie() {
        Mat flat = new Mat(64, 64, opencv_core.CV_8UC3, Scalar.all(128.0D));
        try {
            EnhancementResult result = service.enhanceAuto(flat, 64, 64);
            assertEquals(EnhancementPreset.GENTLE, result.getParams().getPreset());
            assertEquals(0.0D, result.getQualityScore(), 1e-9);
            result.getEnhanced().release();
        } finally {
            flat.release();
        }
    }

    @Test
    void autoQualityShouldReturnHighestScoringPreset() {
        Mat textured = texturedFrame(240, 320);
        try {
            EnhancementPreset expected = null;
            double bestScore = -1.0D;
            for (EnhancementPreset preset : EnhancementPreset.values()) {
                EnhancementResult single = service.enhance(textured, preset);
                if (single.getQualityScore() > bestScore) {
                    bestScore = single.getQualityScore();
                    expected = preset;
                }
                single.getEnhanced().release();
            }

            EnhancementResult result = service.enhanceAuto(textured, 320, 240);

            assertEquals(expected, result.getParams().getPreset());
            assertEquals(bestScore, result.getQualityScore(), 1e-9);
            result.getEnhanced().release();
        } finally {
            textured.release();
        }
    }

    @Test
    void configuredPresetShouldOverrideAutoQuality() {
        properties.setPreset(EnhancementPreset.AGGRESSIVE);
        Path source = Paths.get("analysed", "image_240210_143215.jpg");
        when(imageCodec.read(source)).thenReturn(texturedFrame(120, 160));

        EnhancementResult result = service.enhance(source);
        try {
            assertEquals(EnhancementPreset.AGGRESSIVE, result.getParams().getPreset());
            assertEquals(0.7D, result.getParams().getHistogramClip(), 1e-9);
            assertEquals(2.0D, result.getParams().getClaheClipLimit(), 1e-9);
        } finally {
            result.getEnhanced().release();
        }
    }

    @Test
    void configuredModeShouldUseConfiguredParameters() {
        properties.setAutoQuality(false);
        properties.setHistogramClip(1.0D);
        properties.setClaheClipLimit(2.5D);
        Mat raw = new Mat(100, 100, opencv_core.CV_8UC1, Scalar.all(90.0D));
        try {
            EnhancementResult result = service.enhance(raw);
            EnhancementParams params = result.getParams();
            assertEquals(1.0D, params.getHistogramClip(), 1e-9);
            assertEquals(2.5D, params.getClaheClipLimit(), 1e-9);
            assertNull(params.getPreset());
            assertEquals(3, result.getEnhanced().channels());
            result.getEnhanced().release();
        } finally {
            raw.release();
        }
    }

    @Test
    void facesShouldGetGentlePixels() {
        Mat gentle = new Mat(400, 400, opencv_core.CV_8UC3, Scalar.all(0.0D));
        Mat full = new Mat(400, 400, opencv_core.CV_8UC3, Scalar.all(200.0D));
        Mat blended = ImageEnhancementService.blendFaces(gentle, full,
                Collections.singletonList(new FaceRegion(150, 150, 100, 100)));
        try {
            ByteBuffer pixels = blended.createBuffer();
            int center = (200 * 400 + 200) * 3;
            assertTrue((pixels.get(center) & 0xFF) < 5);
            assertEquals(200, pixels.get(0) & 0xFF);
        } finally {
            gentle.release();
            full.release();
            blended.release();
        }
    }

    @Test
    void saveShouldWriteJpegUnderCanonicalStem() {
        Mat enhanced = new Mat(8, 8, opencv_core.CV_8UC3, Scalar.all(10.0D));
        when(imageCodec.write(any(Path.class), any(Mat.class), anyInt(), anyInt())).thenReturn(true);
        EnhancementResult result = new EnhancementResult(enhanced, 8, 8, null, false, 50.0D);
        try {
            Map<OutputFormat, Path> saved = service.save(result, outputDir, "image_240210_143215");

            Path jpeg = outputDir.resolve("image_240210_143215.jpg");
            assertEquals(Collections.singletonMap(OutputFormat.JPEG, jpeg), saved);
            verify(imageCodec).write(eq(jpeg), same(enhanced), eq(opencv_imgcodecs.IMWRITE_JPEG_QUALITY), eq(95));
        } finally {
            enhanced.release();
        }
    }

    @Test
    void failedJpegWriteShouldFailTheFile() {
        Mat enhanced = new Mat(8, 8, opencv_core.CV_8UC3, Scalar.all(10.0D));
        when(imageCodec.write(any(Path.class), any(Mat.class), anyInt(), anyInt())).thenReturn(false);
        EnhancementResult result = new EnhancementResult(enhanced, 8, 8, null, false, 50.0D);
        try {
            PipelineException error = assertThrows(PipelineException.class,
                    () -> service.save(result, outputDir, "image_240210_143215"));
            assertEquals("OUTPUT_WRITE_FAILED", error.getCode());
        } finally {
            enhanced.release();
        }
    }

    @Test
    void optionalFormatsShouldDependOnEncoderAvailability() {
        AppEnhanceProperties withArchives = new AppEnhanceProperties();
        withArchives.setEnablePngArchive(true);
        withArchives.setEnableJpegXl(true);
        when(imageCodec.canWrite(".png")).thenReturn(true);
        when(imageCodec.canWrite(".jxl")).thenReturn(false);

        ImageEnhancementService archiving = new ImageEnhancementService(imageCodec, faceDetector, withArchives);

        assertTrue(archiving.getWritableFormats().contains(OutputFormat.JPEG));
        assertTrue(archiving.getWritableFormats().contains(OutputFormat.PNG_ARCHIVE));
        assertEquals(2, archiving.getWritableFormats().size());
    }

    private static Mat texturedFrame(int rows, int cols) {
        Mat mat = new Mat(rows, cols, opencv_core.CV_8UC3);
        ByteBuffer buffer = mat.createBuffer();
        Random random = new Random(7L);
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int base = (y * cols + x) * 3;
                int level = 70 + (x * 90 / cols) + ((x / 8 + y / 8) % 2 == 0 ? 15 : 0) + random.nextInt(20);
                buffer.put(base, (byte) level);
                buffer.put(base + 1, (byte) (level + 5));
                buffer.put(base + 2, (byte) (level + 10));
            }
        }
        return mat;
    }

    private static Mat sixteenBitFrame(int rows, int cols) {
        Mat mat = new Mat(rows, cols, opencv_core.CV_16UC3);
        ShortBuffer buffer = mat.createBuffer();
        Random random = new Random(42L);
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int base = (y * cols + x) * 3;
                int level = 6000 + (x * 40000 / cols) + random.nextInt(2000);
                buffer.put(base, (short) level);
                buffer.put(base + 1, (short) (level + 1500));
                buffer.put(base + 2, (short) (level + 3000));
            }
        }
        return mat;
    }
}
