package com.starsalign.imageAlignment;

import com.starsalign.homography.Homography;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Outcome of one alignment call.
 */
@Getter
@AllArgsConstructor
public class Registration {
    private final Homography homography;
    private final int correspondenceCount;
    private final int inlierCount;
    private final Mat aligned;

    public double getDx() {
        return homography.getDx();
    }

    public double getDy() {
        return homography.getDy();
    }
}
