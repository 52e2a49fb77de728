package com.csd.updateserver.exception;

import java.nio.file.Path;

/**
 * Neither the app's cache folder nor the fallback cache root is writable.
 */
public class CacheUnavailableException extends UpdateServerException {

    public CacheUnavailableException(Path preferred, Path fallback, Throwable cause) {
        super("No writable cache directory (tried " + preferred + " and " + fallback + ")", cause);
    }
}
