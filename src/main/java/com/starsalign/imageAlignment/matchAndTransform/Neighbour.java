package com.starsalign.imageAlignment.matchAndTransform;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One nearest-neighbour hit: descriptor {@code queryIndex} of the query set matched
 * descriptor {@code trainIndex} of the train set at {@code distance}.
 */
@Getter
@AllArgsConstructor
public class Neighbour {
    private final int queryIndex;
    private final int trainIndex;
    private final float distance;
}
