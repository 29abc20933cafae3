package com.starsalign.API;

/**
 * An uploaded file could not be read as an image.
 */
public class ImageDecodingException extends RuntimeException {

    public ImageDecodingException(String message) {
        super(message);
    }

    public ImageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
