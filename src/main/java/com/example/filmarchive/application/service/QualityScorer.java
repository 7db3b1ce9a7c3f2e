package com.example.filmarchive.application.service;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Scores an enhanced frame in [0, 100]: 40% sharpness, 30% contrast, 30% tonal range.
 */
public final class QualityScorer {

    static final double SHARPNESS_WEIGHT = 0.4D;
    static final double CONTRAST_WEIGHT = 0.3D;
    static final double RANGE_WEIGHT = 0.3D;
    /** Luma standard deviation that earns full contrast marks. */
    static final double TARGET_STD = 55.0D;

    private QualityScorer() {
    }

    public static double measure(Mat bgr) {
        Mat gray = new Mat();
        Mat lap = new Mat();
        Mat mean = new Mat();
        Mat std = new Mat();
        try {
            if (bgr.channels() == 1) {
                bgr.copyTo(gray);
            } else {
                opencv_imgproc.cvtColor(bgr, gray, opencv_imgproc.COLOR_BGR2GRAY);
            }
            opencv_imgproc.Laplacian(gray, lap, opencv_core.CV_64F);
            opencv_core.meanStdDev(lap, mean, std);
            DoubleIndexer stdIdx = std.createIndexer();
            double lapStd = stdIdx.get(0);

            long[] hist = ImageEnhancementService.histogram8(gray);
            return score(lapStd * lapStd, histogramStd(hist), minLevel(hist), maxLevel(hist));
        } finally {
            gray.release();
            lap.release();
            mean.release();
            std.release();
        }
    }

    public static double score(double laplacianVariance, double lumaStd, int minLevel, int maxLevel) {
        double sharpness = sharpnessScore(laplacianVariance);
        double contrast = contrastScore(lumaStd);
        double range = rangeScore(minLevel, maxLevel);
        return clamp(SHARPNESS_WEIGHT * sharpness + CONTRAST_WEIGHT * contrast + RANGE_WEIGHT * range);
    }

    static double sharpnessScore(double laplacianVariance) {
        return Math.min(100.0D, Math.max(0.0D, laplacianVariance / 100.0D));
    }

    static double contrastScore(double lumaStd) {
        return clamp(100.0D * (1.0D - Math.abs(lumaStd - TARGET_STD) / TARGET_STD));
    }

    static double rangeScore(int minLevel, int maxLevel) {
        return clamp((maxLevel - minLevel) / 255.0D * 100.0D);
    }

    static double histogramStd(long[] hist) {
        long n = 0;
        double sum = 0.0D;
        for (int v = 0; v < hist.length; v++) {
            n += hist[v];
            sum += (double) v * hist[v];
        }
        if (n == 0) {
            return 0.0D;
        }
        double mean = sum / n;
        double sq = 0.0D;
        for (int v = 0; v < hist.length; v++) {
            double d = v - mean;
            sq += d * d * hist[v];
        }
        return Math.sqrt(sq / n);
    }

    static int minLevel(long[] hist) {
        for (int v = 0; v < hist.length; v++) {
            if (hist[v] > 0) {
                return v;
            }
        }
        return 0;
    }

    static int maxLevel(long[] hist) {
        for (int v = hist.length - 1; v >= 0; v--) {
            if (hist[v] > 0) {
                return v;
            }
        }
        return 0;
    }

    private static double clamp(double value) {
        return Math.max(0.0D, Math.min(100.0D, value));
    }
}
