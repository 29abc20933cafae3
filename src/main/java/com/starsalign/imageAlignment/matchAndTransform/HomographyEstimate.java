package com.starsalign.imageAlignment.matchAndTransform;

import com.starsalign.homography.Homography;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class HomographyEstimate {
    private final Homography homography;
    private final boolean[] inlierMask;

    public int getInlierCount() {
        int count = 0;
        for (boolean inlier : inlierMask) if (inlier) count++;
        return count;
    }
}
