package com.tripnav.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Place {
    String title;
    String address;
    Coordinate coordinate;
}
