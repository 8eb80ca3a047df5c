package com.tripnav.service.maps;

import com.tripnav.model.Coordinate;
import com.tripnav.model.RouteSummary;

import java.util.Optional;

public interface RouteSummaryProvider {

    /**
     * @return distance, duration and encoded path of a driving route, or empty when no route exists
     */
    Optional<RouteSummary> route(Coordinate start, Coordinate end);
}
