package com.classscan.config;

public class ScannerConfigException extends RuntimeException {
    private final String option;
    private final String value;

    public ScannerConfigException(String message, String option, String value) {
        super(buildMessage(message, option, value));
        this.option = option;
        this.value = value;
    }

    public ScannerConfigException(String message, String option, String value, Throwable cause) {
        super(buildMessage(message, option, value), cause);
        this.option = option;
        this.value = value;
    }

    public String getOption() {
        return option;
    }

    public String getValue() {
        return value;
    }

    private static String buildMessage(String message, String option, String value) {
        return "Invalid scanner option '" + option + "' = \"" + value + "\": " + message;
    }
}
