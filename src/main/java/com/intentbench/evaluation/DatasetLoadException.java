package com.intentbench.evaluation;

import java.io.IOException;

public class DatasetLoadException extends IOException {

    public DatasetLoadException(String message) {
        super(message);
    }

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
