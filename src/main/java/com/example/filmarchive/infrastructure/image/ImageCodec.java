package com.example.filmarchive.infrastructure.image;

import com.example.filmarchive.common.exception.ImageDecodeException;
import java.nio.file.Path;
import org.bytedeco.opencv.opencv_core.Mat;

public interface ImageCodec {

    Mat read(Path path) throws ImageDecodeException;

    Mat readGray(Path path) throws ImageDecodeException;

    boolean write(Path path, Mat image, int... params);

    /**
     * Whether an encoder is available for files carrying the given suffix, e.g. ".jxl".
     */
    boolean canWrite(String suffix);
}
