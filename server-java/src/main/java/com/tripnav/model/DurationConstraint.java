package com.tripnav.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DurationConstraint {
    String text; // e.g. "30 minutes"
    Integer value; // null when the number is too large for an int
    String unit;
}
