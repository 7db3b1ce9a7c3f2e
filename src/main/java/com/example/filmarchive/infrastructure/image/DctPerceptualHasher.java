package com.example.filmarchive.infrastructure.image;

import com.example.filmarchive.common.util.HashUtil;
import java.nio.file.Path;
import java.util.Arrays;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Component;

/**
 * DCT perceptual hash: the luma plane is shrunk to 64x64, transformed, and the top-left
 * 16x16 low-frequency block is thresholded against its median.
 */
@Component
public class DctPerceptualHasher implements PerceptualHasher {

    static final int HASH_SIZE = 16;
    static final int HIGH_FREQ_FACTOR = 4;

    private final ImageCodec imageCodec;

    public DctPerceptualHasher(ImageCodec imageCodec) {
        this.imageCodec = imageCodec;
    }

    @Override
    public int bitLength() {
        return HASH_SIZE * HASH_SIZE;
    }

    @Override
    public String hash(Path path) {
        Mat gray = imageCodec.readGray(path);
        try {
            return hash(gray);
        } finally {
            gray.release();
        }
    }

    String hash(Mat gray) {
        int side = HASH_SIZE * HIGH_FREQ_FACTOR;
        Mat small = new Mat();
        Mat pixels = new Mat();
        Mat freq = new Mat();
        try {
            opencv_imgproc.resize(gray, small, new Size(side, side), 0, 0, opencv_imgproc.INTER_AREA);
            small.convertTo(pixels, opencv_core.CV_32F);
            opencv_core.dct(pixels, freq);

            float[] low = new float[HASH_SIZE * HASH_SIZE];
            FloatIndexer idx = freq.createIndexer();
            try {
                for (int y = 0; y < HASH_SIZE; y++) {
                    for (int x = 0; x < HASH_SIZE; x++) {
                        low[y * HASH_SIZE + x] = idx.get(y, x);
                    }
                }
            } finally {
                idx.release();
            }
            double median = median(low);
            boolean[] bits = new boolean[low.length];
            for (int i = 0; i < low.length; i++) {
                bits[i] = low[i] > median;
            }
            return HashUtil.bitsToHex(bits);
        } finally {
            small.release();
            pixels.release();
            freq.release();
        }
    }

    static double median(float[] values) {
        float[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + (double) sorted[mid]) / 2.0D;
        }
        return sorted[mid];
    }
}
