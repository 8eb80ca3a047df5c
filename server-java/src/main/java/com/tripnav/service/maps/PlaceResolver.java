package com.tripnav.service.maps;

import com.tripnav.model.GeocodedLocation;
import com.tripnav.model.PlaceCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Geocoding and nearby-place search.
 * Implementations throw {@link PlaceResolutionException} when the backend cannot be reached.
 */
public interface PlaceResolver {

    /**
     * @param name        free-text place name
     * @param countryHint ISO country code to scope the lookup, or {@code null}
     * @return the best match, or empty when nothing matched
     */
    Optional<GeocodedLocation> geocode(String name, String countryHint);

    /**
     * Raw candidates near a coordinate. No open-now filtering or dedup is applied;
     * callers over-fetch and filter themselves.
     */
    List<PlaceCandidate> search(String query, double lat, double lon, int limit);
}
