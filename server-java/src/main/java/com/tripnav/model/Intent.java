package com.tripnav.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Routing preferences that can be detected in a trip request.
 */
public enum Intent {
    BASIC_NAVIGATION("Basic Navigation"),
    MULTI_STOP("Multi-Stop"),
    TIME_CONSTRAINED("Time-Constrained"),
    TRAFFIC_AWARE("Traffic-Aware"),
    SCENIC_ROUTING("Scenic Routing"),
    FUEL_EFFICIENT("Fuel-Efficient"),
    AVOIDING_TOLLS("Avoiding Tolls"),
    AVOIDING_HIGHWAYS("Avoiding Highways"),
    WEATHER_BASED("Weather-Based"),
    EV_CHARGING("EV Charging"),
    EMERGENCY_ROUTING("Emergency Routing"),
    PARKING_AVAILABILITY("Parking Availability"),
    SHORTEST("Shortest"),
    REST_STOP("Rest Stop"),
    NIGHT_STAY("Night Stay");

    private final String label;

    Intent(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
