package com.llmregress.expand;

import java.io.IOException;

public class DataSourceException extends IOException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
