package com.llmregress.provider;

public class ProviderTransientException extends ProviderException {

    public ProviderTransientException(String message) {
        this(message, -1, null);
    }

    public ProviderTransientException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
