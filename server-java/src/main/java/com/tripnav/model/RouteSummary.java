package com.tripnav.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RouteSummary {
    long distanceMeters;
    long durationSeconds;
    String distanceText;
    String durationText;
    String encodedPath;
}
