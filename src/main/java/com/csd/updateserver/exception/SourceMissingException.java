package com.csd.updateserver.exception;

import java.nio.file.Path;

public class SourceMissingException extends UpdateServerException {

    public SourceMissingException(String upgradeId, Path sourcePath) {
        super("Upgrade source path not found for " + upgradeId + ": " + sourcePath);
    }
}
