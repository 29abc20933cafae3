package com.starsalign.API;

import com.starsalign.imageAlignment.AlignmentStrategy;
import com.starsalign.imageAlignment.ImageAligner;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Map;

@Service
public class AlignmentService {

    private final StarsAlignProperties properties;
    private final Map<AlignmentStrategy, ImageAligner> aligners = new EnumMap<>(AlignmentStrategy.class);

    @Autowired
    public AlignmentService(StarsAlignProperties properties) {
        this.properties = properties;
        Path scratch = properties.getScratchDirectory() == null || properties.getScratchDirectory().isBlank()
                ? null
                : Paths.get(properties.getScratchDirectory());
        for (AlignmentStrategy strategy : AlignmentStrategy.values()) {
            aligners.put(strategy, ImageAligner.forStrategy(strategy, scratch));
        }
    }

    /**
     * @param strategyName fast or precise; null or blank selects the configured default
     */
    public AlignmentStrategy resolveStrategy(String strategyName) {
        if (strategyName == null || strategyName.isBlank()) {
            return AlignmentStrategy.fromName(properties.getDefaultStrategy());
        }
        return AlignmentStrategy.fromName(strategyName);
    }

    public ImageAligner aligner(AlignmentStrategy strategy) {
        return aligners.get(strategy);
    }

    public Mat align(Mat reference, Mat science, AlignmentStrategy strategy) {
        return aligner(strategy).align(reference, science);
    }

    public Mat diff(Mat reference, Mat science, AlignmentStrategy strategy) {
        return aligner(strategy).diff(reference, science);
    }
}
