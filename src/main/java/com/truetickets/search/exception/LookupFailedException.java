package com.truetickets.search.exception;

import lombok.Getter;

@Getter
public class LookupFailedException extends RuntimeException {
    private final String path;

    public LookupFailedException(String path, Throwable cause) {
        super("Lookup failed: " + path, cause);
        this.path = path;
    }
}
