package com.llmregress.provider;

import java.io.IOException;

public abstract class ProviderException extends IOException {
    private final int statusCode;

    protected ProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public abstract boolean isTransient();

    // -1 when no response was received
    public int statusCode() {
        return statusCode;
    }

    public static boolean isTransientStatus(int statusCode) {
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }

    public static ProviderException forStatus(String message, int statusCode) {
        return isTransientStatus(statusCode)
                ? new ProviderTransientException(message, statusCode, null)
                : new ProviderPermanentException(message, statusCode, null);
    }
}
