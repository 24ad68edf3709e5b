package com.truetickets.search.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final String path;

    public EntityNotFoundException(String path) {
        super("Entity not found: " + path);
        this.path = path;
    }
}
