package com.tripnav.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResolvedLocation {
    String text;
    Coordinate coordinate;
    String countryCode;
    ResolutionStatus status;

    public static ResolvedLocation absent() {
        return ResolvedLocation.builder()
                .status(ResolutionStatus.ABSENT)
                .build();
    }

    public boolean isResolved() {
        return status == ResolutionStatus.RESOLVED;
    }
}
