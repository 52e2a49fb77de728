package com.csd.updateserver.exception;

import java.nio.file.Path;

public class IntegrityMismatchException extends UpdateServerException {

    public IntegrityMismatchException(Path file, long expected, long actual) {
        super("Size mismatch for " + file + ": expected " + expected + " bytes, got " + actual);
    }
}
