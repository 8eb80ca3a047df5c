package com.tripnav.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Waypoint {
    String text;
    List<Place> places;
}
