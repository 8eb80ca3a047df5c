package com.tripnav.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Everything read out of the query text before any place resolution.
 */
@Value
@Builder
public class ExtractedQuery {
    String query;
    Set<Intent> intents;
    String startLocation;
    boolean startDefaulted; // true when no "from ... to" was found
    String endLocation;
    List<String> genericLocations;
    List<String> waypoints;
    List<DistanceConstraint> distanceConstraints;
    TimeConstraints timeConstraints;
}
