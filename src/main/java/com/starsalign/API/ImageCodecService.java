package com.starsalign.API;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_imgcodecs.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Turns uploads into single-channel float images and results back into 32-bit TIFF bytes.
 */
@Service
public class ImageCodecService {
    private static final Logger logger = LoggerFactory.getLogger(ImageCodecService.class);

    public static final String TIFF_MEDIA_TYPE = "image/tiff";

    public Mat decode(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ImageDecodingException("Missing image upload");
        }
        try {
            return decode(file.getBytes(), file.getOriginalFilename());
        } catch (IOException e) {
            throw new ImageDecodingException("Could not read upload " + file.getOriginalFilename(), e);
        }
    }

    /**
     * Decodes any format OpenCV reads, keeping the stored bit depth. Colour images are reduced to
     * luma and every depth is converted to CV_32F.
     */
    public Mat decode(byte[] bytes, String name) {
        Mat raw = new Mat(bytes);
        Mat img = imdecode(raw, IMREAD_UNCHANGED);
        raw.release();
        if (img == null || img.empty()) {
            throw new ImageDecodingException("Not a readable image: " + name);
        }

        Mat gray = toGray(img, name);
        Mat result = gray;
        if (gray.depth() != CV_32F) {
            result = new Mat();
            gray.convertTo(result, CV_32F);
            gray.release();
        }
        logger.debug("Decoded {}: {}x{}", name, result.cols(), result.rows());
        return result;
    }

    private static Mat toGray(Mat img, String name) {
        switch (img.channels()) {
            case 1:
                return img;
            case 3: {
                Mat gray = new Mat();
                cvtColor(img, gray, COLOR_BGR2GRAY);
                img.release();
                return gray;
            }
            case 4: {
                Mat gray = new Mat();
                cvtColor(img, gray, COLOR_BGRA2GRAY);
                img.release();
                return gray;
            }
            default:
                throw new ImageDecodingException("Unsupported channel count " + img.channels() + " in " + name);
        }
    }

    public byte[] encodeTiff(Mat image) {
        BytePointer buf = new BytePointer();
        try {
            if (!imencode(".tiff", image, buf)) {
                throw new IllegalStateException("TIFF encoding failed");
            }
            byte[] out = new byte[(int) buf.limit()];
            buf.get(out);
            return out;
        } finally {
            buf.close();
        }
    }
}
