package com.llmregress.provider;

public class ProviderPermanentException extends ProviderException {

    public ProviderPermanentException(String message) {
        this(message, -1, null);
    }

    public ProviderPermanentException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
