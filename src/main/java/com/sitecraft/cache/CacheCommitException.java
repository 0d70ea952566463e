package com.sitecraft.cache;

import java.io.IOException;

public class CacheCommitException extends IOException {
    public CacheCommitException(String message, Throwable cause) {
        super(message, cause);
    }
}
