package com.phillippitts.mathscrap.exception;

/**
 * Thrown when an input image cannot be read, decoded, or violates size limits.
 * Fatal for that image only.
 */
public class UnreadableImageException extends MathScrapException {

    private final String imagePath;
    private final String reason;

    public UnreadableImageException(String imagePath, String reason) {
        super("Unreadable image (" + imagePath + "): " + reason);
        this.imagePath = imagePath;
        this.reason = reason;
    }

    public UnreadableImageException(String imagePath, String reason, Throwable cause) {
        super("Unreadable image (" + imagePath + "): " + reason, cause);
        this.imagePath = imagePath;
        this.reason = reason;
    }

    public String getImagePath() {
        return imagePath;
    }

    public String getReason() {
        return reason;
    }
}
