package com.handcoach.common.exception;

/**
 * The text-generation service failed, timed out or answered with something unusable.
 * Always absorbed by the pipeline's fallback handling.
 */
public class NarrativeServiceException extends HandAnalysisException {

    public NarrativeServiceException(String stage, String message) {
        super(stage, message);
    }

    public NarrativeServiceException(String stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
