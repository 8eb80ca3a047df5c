package com.tripnav.service.maps;

public class PlaceResolutionException extends RuntimeException {

    public PlaceResolutionException(String message) {
        super(message);
    }

    public PlaceResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
