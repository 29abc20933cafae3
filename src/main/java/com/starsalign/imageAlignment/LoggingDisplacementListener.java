package com.starsalign.imageAlignment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDisplacementListener implements DisplacementListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingDisplacementListener.class);

    @Override
    public void displacementEstimated(double dx, double dy) {
        logger.info("The displacement on the x-axis is of {} pixels", dx);
        logger.info("The displacement on the y-axis is of {} pixels", dy);
    }
}
