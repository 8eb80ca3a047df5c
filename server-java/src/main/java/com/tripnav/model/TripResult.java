package com.tripnav.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class TripResult {
    String query;
    Set<Intent> intents;
    ResolvedLocation start;
    ResolvedLocation end;
    List<String> genericLocations;
    List<Waypoint> waypoints;
    List<DistanceConstraint> distanceConstraints;
    TimeConstraints timeConstraints;
    RouteSummary routeSummary;
    List<String> notices;
}
