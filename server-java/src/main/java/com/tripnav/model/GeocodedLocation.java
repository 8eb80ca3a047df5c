package com.tripnav.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GeocodedLocation {
    Coordinate coordinate;
    String countryCode;
    String formattedAddress;
}
