package com.example.filmarchive.infrastructure.image;

import com.example.filmarchive.domain.model.FaceRegion;
import java.util.List;
import org.bytedeco.opencv.opencv_core.Mat;

public interface FaceDetector {

    boolean isAvailable();

    /**
     * Finds frontal faces in an 8-bit BGR frame. Returns an empty list when nothing is found
     * or detection is unavailable; never throws.
     */
    List<FaceRegion> detect(Mat bgr);
}
