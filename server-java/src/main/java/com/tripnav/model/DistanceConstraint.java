package com.tripnav.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DistanceConstraint {
    String text; // e.g. "300 miles"
    Integer value; // null when the number is too large for an int
    String unit;
}
