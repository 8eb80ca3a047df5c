package com.tripnav.model;

/**
 * How the coordinate of a location was obtained.
 */
public enum ResolutionStatus {
    /** Geocoded from the extracted text. */
    RESOLVED,
    /** Resolution failed or was skipped; the configured default was substituted. */
    DEFAULTED,
    /** No location was mentioned. */
    ABSENT
}
