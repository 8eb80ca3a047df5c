package com.tripnav.model;

import lombok.Value;

@Value
public class Coordinate {
    double lat;
    double lon;

    public static Coordinate of(double lat, double lon) {
        return new Coordinate(lat, lon);
    }

    /**
     * "lat,lon" as accepted by the maps URLs and the places search.
     */
    public String toLatLonString() {
        return lat + "," + lon;
    }
}
