package com.orthosense.exception;

/**
 * Thrown when a pose frame has the wrong joint count or coordinate arity, or carries values
 * that cannot be analysed. Such frames never reach a window.
 */
public class InvalidFrameException extends OrthoSenseException {

    private final int frameIndex;
    private final String reason;

    public InvalidFrameException(String reason) {
        super("Invalid pose frame: " + reason);
        this.frameIndex = -1;
        this.reason = reason;
    }

    public InvalidFrameException(int frameIndex, String reason) {
        super("Invalid pose frame #" + frameIndex + ": " + reason);
        this.frameIndex = frameIndex;
        this.reason = reason;
    }

    public InvalidFrameException(String reason, Throwable cause) {
        super("Invalid pose frame: " + reason, cause);
        this.frameIndex = -1;
        this.reason = reason;
    }

    /** Index of the offending frame within its recording, or -1 when unknown. */
    public int getFrameIndex() {
        return frameIndex;
    }

    public String getReason() {
        return reason;
    }
}
