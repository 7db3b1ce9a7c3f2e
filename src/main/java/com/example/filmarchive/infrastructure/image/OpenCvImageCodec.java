package com.example.filmarchive.infrastructure.image;

import com.example.filmarchive.common.exception.ImageDecodeException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class OpenCvImageCodec implements ImageCodec {

    private static final Logger log = LoggerFactory.getLogger(OpenCvImageCodec.class);

    @Override
    public Mat read(Path path) {
        return decode(path, opencv_imgcodecs.IMREAD_UNCHANGED);
    }

    @Override
    public Mat readGray(Path path) {
        return decode(path, opencv_imgcodecs.IMREAD_GRAYSCALE);
    }

    @Override
    public boolean write(Path path, Mat image, int... params) {
        try {
            if (params == null || params.length == 0) {
                return opencv_imgcodecs.imwrite(path.toString(), image);
            }
            return opencv_imgcodecs.imwrite(path.toString(), image, new IntPointer(params));
        } catch (RuntimeException e) {
            log.warn("IMAGE_ENCODE_FAILED path={} reason={}", path, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean canWrite(String suffix) {
        try {
            return opencv_imgcodecs.haveImageWriter("sample" + suffix);
        } catch (RuntimeException e) {
            log.debug("IMAGE_WRITER_CHECK_FAILED suffix={} reason={}", suffix, e.getMessage());
            return false;
        }
    }

    private Mat decode(Path path, int flags) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ImageDecodeException(path, "Image file not found: " + path);
        }
        Mat mat;
        try {
            mat = opencv_imgcodecs.imread(path.toString(), flags);
        } catch (RuntimeException e) {
            throw new ImageDecodeException(path, "Could not load image: " + path, e);
        }
        if (mat == null || mat.empty()) {
            throw new ImageDecodeException(path, "Could not load image: " + path);
        }
        return mat;
    }
}
