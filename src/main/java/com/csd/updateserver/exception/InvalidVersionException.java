package com.csd.updateserver.exception;

public class InvalidVersionException extends UpdateServerException {

    private final String value;

    public InvalidVersionException(String value) {
        super("Invalid version: " + value);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
