package com.csd.updateserver.exception;

import java.nio.file.Path;

/**
 * A stored update file is neither an executable nor a tarball.
 */
public class CorruptAssetException extends UpdateServerException {

    public CorruptAssetException(Path file) {
        super("File is not an executable nor tarball file: " + file);
    }
}
