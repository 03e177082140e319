package com.vendinghive.exception;

public class DuplicateExclusionException extends RuntimeException {

    public DuplicateExclusionException(String providerId) {
        super("Location is already excluded: " + providerId);
    }
}
