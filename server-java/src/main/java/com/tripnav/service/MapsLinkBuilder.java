package com.tripnav.service;

import com.tripnav.model.Place;
import com.tripnav.model.ResolutionStatus;
import com.tripnav.model.ResolvedLocation;
import com.tripnav.model.TripResult;
import com.tripnav.model.Waypoint;
import com.tripnav.service.extraction.StartEndExtractor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a Google Maps directions link for an assembled trip.
 */
@Component
public class MapsLinkBuilder {

    private static final String DIRECTIONS_URL = "https://www.google.com/maps/dir/";

    /**
     * @return the link, or empty when the trip has no end location
     */
    public Optional<String> buildLink(TripResult trip) {
        if (trip == null || trip.getEnd() == null || trip.getEnd().getStatus() == ResolutionStatus.ABSENT) {
            return Optional.empty();
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(DIRECTIONS_URL)
                .queryParam("api", 1);

        // Without an origin Google Maps starts from the device location.
        String origin = locationParam(trip.getStart());
        if (origin != null) {
            builder.queryParam("origin", origin);
        }
        builder.queryParam("destination", locationParam(trip.getEnd()));

        List<String> stops = trip.getWaypoints() == null ? List.of() : trip.getWaypoints().stream()
                .map(MapsLinkBuilder::waypointParam)
                .collect(Collectors.toList());
        if (!stops.isEmpty()) {
            builder.queryParam("waypoints", String.join("|", stops));
        }

        builder.queryParam("travelmode", "driving");
        return Optional.of(builder.build().encode().toUriString());
    }

    private static String locationParam(ResolvedLocation location) {
        if (location == null) {
            return null;
        }
        if (location.isResolved()) {
            return location.getCoordinate().toLatLonString();
        }
        if (location.getText() == null || StartEndExtractor.CURRENT_LOCATION.equals(location.getText())) {
            return null;
        }
        return location.getText();
    }

    private static String waypointParam(Waypoint waypoint) {
        if (waypoint.getPlaces() != null && !waypoint.getPlaces().isEmpty()) {
            Place best = waypoint.getPlaces().get(0);
            if (best.getCoordinate() != null) {
                return best.getCoordinate().toLatLonString();
            }
            if (best.getAddress() != null) {
                return best.getAddress();
            }
        }
        return waypoint.getText();
    }
}
