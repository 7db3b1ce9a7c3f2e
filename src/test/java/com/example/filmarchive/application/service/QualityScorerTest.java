package com.example.filmarchive.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.junit.jupiter.api.Test;

class QualityScorerTest {

    @Test
    void scoreShouldGrowWithSharpnessUntilSaturation() {
        double previous = -1.0D;
        for (double variance = 0.0D; variance <= 10000.0D; variance += 500.0D) {
            double score = QualityScorer.score(variance, 55.0D, 0, 255);
            assertTrue(score >= previous, "score dropped at variance " + variance);
            previous = score;
        }
        assertEquals(QualityScorer.score(10000.0D, 55.0D, 0, 255), QualityScorer.score(50000.0D, 55.0D, 0, 255), 1e-9);
    }

    @Test
    void scoreShouldStayWithinBounds() {
        assertEquals(100.0D, QualityScorer.score(1e9, 55.0D, 0, 255), 1e-9);
        assertEquals(0.0D, QualityScorer.score(0.0D, 0.0D, 128, 128), 1e-9);
        double wild = QualityScorer.score(1e9, 500.0D, 0, 255);
        assertTrue(wild >= 0.0D && wild <= 100.0D);
    }

    @Test
    void contrastShouldPeakAtTarget() {
        assertEquals(100.0D, QualityScorer.contrastScore(QualityScorer.TARGET_STD), 1e-9);
        assertTrue(QualityScorer.contrastScore(30.0D) < 100.0D);
        assertEquals(0.0D, QualityScorer.contrastScore(200.0D), 1e-9);
    }

    @Test
    void histogramHelpersShouldReadLevels() {
        long[] hist = new long[256];
        hist[10] = 5;
        hist[250] = 5;

        assertEquals(10, QualityScorer.minLevel(hist));
        assertEquals(250, QualityScorer.maxLevel(hist));
        assertEquals(120.0D, QualityScorer.histogramStd(hist), 1e-9);
    }

    @Test
    void measureShouldPreferSharpFrame() {
        Mat sharp = checkerboard(256, 16);
        Mat soft = new Mat();
        opencv_imgproc.GaussianBlur(sharp, soft, new Size(15, 15), 0.0D);
        try {
            assertTrue(QualityScorer.measure(sharp) > QualityScorer.measure(soft));
        } finally {
            sharp.release();
            soft.release();
        }
    }

    @Test
    void flatFrameShouldScoreZero() {
        Mat flat = new Mat(64, 64, opencv_core.CV_8UC3, Scalar.all(128.0D));
        try {
            assertEquals(0.0D, QualityScorer.measure(flat), 1e-9);
        } finally {
            flat.release();
        }
    }

    private static Mat checkerboard(int side, int cell) {
        Mat mat = new Mat(side, side, opencv_core.CV_8UC3);
        ByteBuffer buffer = mat.createBuffer();
        for (int y = 0; y < side; y++) {
            for (int x = 0; x < side; x++) {
                byte value = ((x / cell + y / cell) % 2 == 0) ? (byte) 20 : (byte) 235;
                int base = (y * side + x) * 3;
                buffer.put(base, value);
                buffer.put(base + 1, value);
                buffer.put(base + 2, value);
            }
        }
        return mat;
    }
}
