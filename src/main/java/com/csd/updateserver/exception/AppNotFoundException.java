package com.csd.updateserver.exception;

public class AppNotFoundException extends UpdateServerException {

    public AppNotFoundException(String appName) {
        super("No update folder for app: " + appName);
    }
}
