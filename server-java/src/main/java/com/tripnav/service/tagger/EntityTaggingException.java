package com.tripnav.service.tagger;

public class EntityTaggingException extends RuntimeException {

    public EntityTaggingException(String message) {
        super(message);
    }

    public EntityTaggingException(String message, Throwable cause) {
        super(message, cause);
    }
}
