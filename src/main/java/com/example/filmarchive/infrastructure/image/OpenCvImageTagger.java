package com.example.filmarchive.infrastructure.image;

import com.example.filmarchive.common.config.AppTaggingProperties;
import com.example.filmarchive.common.exception.ImageDecodeException;
import com.example.filmarchive.domain.model.TagInfo;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Heuristic tagger over colour, exposure, lighting and framing statistics.
 */
@Component
public class OpenCvImageTagger implements ImageTagger {

    private static final Logger log = LoggerFactory.getLogger(OpenCvImageTagger.class);

    private final ImageCodec imageCodec;
    private final AppTaggingProperties appTaggingProperties;

    public OpenCvImageTagger(ImageCodec imageCodec, AppTaggingProperties appTaggingProperties) {
        this.imageCodec = imageCodec;
        this.appTaggingProperties = appTaggingProperties;
    }

    @Override
    public boolean isAvailable() {
        return appTaggingProperties.isEnabled();
    }

    @Override
    public List<TagInfo> generateTags(Path enhancedPath) {
        Mat img;
        try {
            img = imageCodec.read(enhancedPath);
        } catch (ImageDecodeException e) {
            log.warn("TAGGING_DECODE_FAILED file={} reason={}", enhancedPath.getFileName(), e.getMessage());
            return Collections.emptyList();
        }
        Mat hsv = new Mat();
        Mat lab = new Mat();
        Mat gray = new Mat();
        Mat lap = new Mat();
        Mat edges = new Mat();
        try {
            opencv_imgproc.cvtColor(img, hsv, opencv_imgproc.COLOR_BGR2HSV);
            opencv_imgproc.cvtColor(img, lab, opencv_imgproc.COLOR_BGR2Lab);
            opencv_imgproc.cvtColor(img, gray, opencv_imgproc.COLOR_BGR2GRAY);
            opencv_imgproc.Laplacian(gray, lap, opencv_core.CV_64F);
            opencv_imgproc.Canny(gray, edges, 50, 150);

            Scalar hsvMean = opencv_core.mean(hsv);
            double[] labStats = meanAndStd(lab, 2);
            double[] lStats = meanAndStd(lab, 0);
            double[] grayStats = meanAndStd(gray, 0);
            double lapStd = meanAndStd(lap, 0)[1];

            List<TagInfo> tags = new ArrayList<>();
            tags.addAll(colorTags(hsvMean.get(0), hsvMean.get(1), hsvMean.get(2)));
            tags.addAll(qualityTags(lapStd * lapStd, grayStats[0], grayStats[1]));
            tags.addAll(lightingTags(labStats[0], lStats[1]));
            tags.addAll(compositionTags(img.cols(), img.rows(), centerEdgeDensity(edges)));

            double threshold = appTaggingProperties.getConfidenceThreshold();
            List<TagInfo> kept = tags.stream()
                    .filter(tag -> tag.getConfidence() >= threshold)
                    .collect(Collectors.toList());
            log.info("TAGGING_DONE file={} tagCount={}", enhancedPath.getFileName(), kept.size());
            return kept;
        } catch (RuntimeException e) {
            log.warn("TAGGING_FAILED file={} reason={}", enhancedPath.getFileName(), e.getMessage());
            return Collections.emptyList();
        } finally {
            img.release();
            hsv.release();
            lab.release();
            gray.release();
            lap.release();
            edges.release();
        }
    }

    static List<TagInfo> colorTags(double hueMean, double satMean, double valueMean) {
        List<TagInfo> tags = new ArrayList<>();
        if (satMean < 50) {
            tags.add(new TagInfo("desaturated", 0.8D, "color"));
            tags.add(new TagInfo("faded colors", 0.7D, "style"));
        } else if (satMean > 150) {
            tags.add(new TagInfo("vibrant", 0.8D, "color"));
            tags.add(new TagInfo("saturated", 0.7D, "color"));
        }
        // OpenCV hue runs 0..180
        if (satMean > 30) {
            if (hueMean < 15 || (hueMean >= 165 && hueMean < 180)) {
                tags.add(new TagInfo("red tones", 0.6D, "color"));
            } else if (hueMean < 35) {
                tags.add(new TagInfo("warm tones", 0.6D, "color"));
            } else if (hueMean < 85) {
                tags.add(new TagInfo("green tones", 0.6D, "color"));
            } else if (hueMean < 135) {
                tags.add(new TagInfo("blue tones", 0.6D, "color"));
                tags.add(new TagInfo("cool tones", 0.5D, "color"));
            }
        }
        if (satMean < 60 && valueMean < 100) {
            tags.add(new TagInfo("aged film", 0.5D, "style"));
        }
        return tags;
    }

    static List<TagInfo> qualityTags(double laplacianVariance, double brightness, double grayStd) {
        List<TagInfo> tags = new ArrayList<>();
        if (laplacianVariance > 500) {
            tags.add(new TagInfo("sharp", 0.8D, "quality"));
        } else if (laplacianVariance < 100) {
            tags.add(new TagInfo("blurry", 0.7D, "quality"));
            tags.add(new TagInfo("soft focus", 0.5D, "style"));
        }
        if (brightness > 200) {
            tags.add(new TagInfo("bright", 0.7D, "lighting"));
            if (brightness > 230) {
                tags.add(new TagInfo("overexposed", 0.6D, "quality"));
            }
        } else if (brightness < 60) {
            tags.add(new TagInfo("dark", 0.7D, "lighting"));
            if (brightness < 30) {
                tags.add(new TagInfo("underexposed", 0.6D, "quality"));
            }
        }
        if (grayStd > 40) {
            tags.add(new TagInfo("grainy", 0.6D, "style"));
            tags.add(new TagInfo("high grain", 0.5D, "film"));
        }
        return tags;
    }

    static List<TagInfo> lightingTags(double labBMean, double lightnessStd) {
        List<TagInfo> tags = new ArrayList<>();
        if (labBMean > 135) {
            tags.add(new TagInfo("warm light", 0.7D, "lighting"));
            tags.add(new TagInfo("golden hour", 0.5D, "time"));
        } else if (labBMean < 120) {
            tags.add(new TagInfo("cool light", 0.7D, "lighting"));
            tags.add(new TagInfo("overcast", 0.4D, "weather"));
        }
        if (lightnessStd > 40) {
            tags.add(new TagInfo("high contrast", 0.6D, "lighting"));
            tags.add(new TagInfo("dramatic lighting", 0.5D, "style"));
        } else if (lightnessStd < 20) {
            tags.add(new TagInfo("flat lighting", 0.6D, "lighting"));
            tags.add(new TagInfo("soft light", 0.5D, "lighting"));
        }
        return tags;
    }

    static List<TagInfo> compositionTags(int width, int height, double centerEdgeDensity) {
        List<TagInfo> tags = new ArrayList<>();
        double aspect = height == 0 ? 1.0D : (double) width / height;
        if (aspect > 1.3D) {
            tags.add(new TagInfo("landscape orientation", 0.9D, "composition"));
        } else if (aspect < 0.8D) {
            tags.add(new TagInfo("portrait orientation", 0.9D, "composition"));
        } else {
            tags.add(new TagInfo("square format", 0.9D, "composition"));
        }
        if (centerEdgeDensity > 0.1D) {
            tags.add(new TagInfo("centered subject", 0.5D, "composition"));
        }
        return tags;
    }

    private static double centerEdgeDensity(Mat edges) {
        int w = edges.cols();
        int h = edges.rows();
        int x1 = w / 3;
        int y1 = h / 3;
        int cw = 2 * w / 3 - x1;
        int ch = 2 * h / 3 - y1;
        if (cw <= 0 || ch <= 0) {
            return 0.0D;
        }
        Mat center = new Mat(edges, new Rect(x1, y1, cw, ch));
        try {
            return opencv_core.countNonZero(center) / (double) (cw * ch);
        } finally {
            center.release();
        }
    }

    /**
     * Mean and standard deviation of one channel.
     */
    private static double[] meanAndStd(Mat src, int channel) {
        Mat mean = new Mat();
        Mat std = new Mat();
        try {
            opencv_core.meanStdDev(src, mean, std);
            DoubleIndexer meanIdx = mean.createIndexer();
            DoubleIndexer stdIdx = std.createIndexer();
            return new double[]{meanIdx.get(channel), stdIdx.get(channel)};
        } finally {
            mean.release();
            std.release();
        }
    }
}
