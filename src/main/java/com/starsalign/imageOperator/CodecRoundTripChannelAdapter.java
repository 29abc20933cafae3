package com.starsalign.imageOperator;

import com.starsalign.imageAlignment.exception.ScratchResourceException;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.bytedeco.opencv.global.opencv_imgcodecs.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Precise path: the normalized image is written as a lossless PNG, read back as a 3-channel BGR
 * image through the generic codec and reduced to luma before feature extraction.
 * <p>
 * Every call owns a uniquely named scratch file that is removed before the call returns,
 * whether it succeeds or not.
 */
public class CodecRoundTripChannelAdapter implements ChannelAdapter {
    private static final Logger logger = LoggerFactory.getLogger(CodecRoundTripChannelAdapter.class);

    private static final String SCRATCH_PREFIX = "starsalign-";
    private static final String SCRATCH_SUFFIX = ".png";

    private final Path scratchDirectory;

    public CodecRoundTripChannelAdapter() {
        this(Paths.get(System.getProperty("java.io.tmpdir")));
    }

    public CodecRoundTripChannelAdapter(Path scratchDirectory) {
        this.scratchDirectory = scratchDirectory;
    }

    public Path getScratchDirectory() {
        return scratchDirectory;
    }

    @Override
    public Mat prepare(Mat normalized) {
        Path scratch = createScratch();
        RuntimeException failure = null;
        try {
            return roundTrip(normalized, scratch);
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            deleteScratch(scratch, failure);
        }
    }

    private Mat roundTrip(Mat normalized, Path scratch) {
        String file = scratch.toString();
        if (!imwrite(file, normalized)) {
            throw new ScratchResourceException("Could not encode image to scratch file " + file);
        }

        Mat color = imread(file, IMREAD_COLOR);
        if (color == null || color.empty()) {
            throw new ScratchResourceException("Could not decode scratch file " + file);
        }

        Mat gray = new Mat();
        cvtColor(color, gray, COLOR_BGR2GRAY);
        color.release();
        return gray;
    }

    private Path createScratch() {
        try {
            Path scratch = Files.createTempFile(scratchDirectory, SCRATCH_PREFIX, SCRATCH_SUFFIX);
            logger.debug("Created scratch file {}", scratch);
            return scratch;
        } catch (IOException | SecurityException e) {
            throw new ScratchResourceException("Could not create scratch file in " + scratchDirectory, e);
        }
    }

    // A cleanup failure never hides the error that aborted the call
    private void deleteScratch(Path scratch, RuntimeException failure) {
        try {
            Files.deleteIfExists(scratch);
            logger.debug("Removed scratch file {}", scratch);
        } catch (IOException e) {
            ScratchResourceException cleanup = new ScratchResourceException("Could not remove scratch file " + scratch, e);
            if (failure != null) {
                failure.addSuppressed(cleanup);
            } else {
                throw cleanup;
            }
        }
    }
}
