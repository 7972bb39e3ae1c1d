package com.handcoach.common.exception;

public class HandAnalysisException extends RuntimeException {
    private final String stage;

    public HandAnalysisException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public HandAnalysisException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
