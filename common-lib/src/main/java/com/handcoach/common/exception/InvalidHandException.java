package com.handcoach.common.exception;

/** The hand record cannot be turned into a playable hand. Raised before any analysis runs. */
public class InvalidHandException extends HandAnalysisException {

    public static final String STAGE = "HandParser";

    public InvalidHandException(String message) {
        super(STAGE, message);
    }

    public InvalidHandException(String message, Throwable cause) {
        super(STAGE, message, cause);
    }
}
