package com.tripnav.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TimeConstraints {
    List<String> times;
    List<DurationConstraint> durations;
}
