package com.tripnav.service.maps;

import com.google.maps.GeoApiContext;
import com.google.maps.GeocodingApi;
import com.google.maps.GeocodingApiRequest;
import com.google.maps.PlacesApi;
import com.google.maps.errors.ApiException;
import com.google.maps.model.AddressComponent;
import com.google.maps.model.AddressComponentType;
import com.google.maps.model.ComponentFilter;
import com.google.maps.model.GeocodingResult;
import com.google.maps.model.LatLng;
import com.google.maps.model.PlacesSearchResponse;
import com.google.maps.model.PlacesSearchResult;
import com.tripnav.model.Coordinate;
import com.tripnav.model.GeocodedLocation;
import com.tripnav.model.PlaceCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
@Slf4j
public class GoogleMapsPlaceResolver implements PlaceResolver {

    private static final int SEARCH_RADIUS_METERS = 50_000;

    private final GeoApiContext geoApiContext;

    public GoogleMapsPlaceResolver(GeoApiContext geoApiContext) {
        this.geoApiContext = geoApiContext;
    }

    @Override
    public Optional<GeocodedLocation> geocode(String name, String countryHint) {
        log.info("Geocoding \"{}\" (country hint: {})", name, countryHint);

        GeocodingApiRequest request = GeocodingApi.geocode(geoApiContext, name).language("en");
        if (countryHint != null && !countryHint.isBlank()) {
            request = request.components(ComponentFilter.country(countryHint))
                    .region(countryHint.toLowerCase(Locale.ROOT));
        }

        GeocodingResult[] results;
        try {
            results = request.await();
        } catch (ApiException | IOException e) {
            throw new PlaceResolutionException("Geocoding failed for \"" + name + "\": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlaceResolutionException("Geocoding interrupted for \"" + name + "\"", e);
        }

        if (results == null || results.length == 0) {
            return Optional.empty();
        }

        GeocodingResult result = results[0];
        return Optional.of(GeocodedLocation.builder()
                .coordinate(Coordinate.of(result.geometry.location.lat, result.geometry.location.lng))
                .countryCode(countryCodeOf(result))
                .formattedAddress(result.formattedAddress)
                .build());
    }

    @Override
    public List<PlaceCandidate> search(String query, double lat, double lon, int limit) {
        log.info("Searching \"{}\" near {},{} (limit {})", query, lat, lon, limit);

        PlacesSearchResponse response;
        try {
            response = PlacesApi.textSearchQuery(geoApiContext, query)
                    .location(new LatLng(lat, lon))
                    .radius(SEARCH_RADIUS_METERS)
                    .await();
        } catch (ApiException | IOException e) {
            throw new PlaceResolutionException("Place search failed for \"" + query + "\": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlaceResolutionException("Place search interrupted for \"" + query + "\"", e);
        }

        List<PlaceCandidate> candidates = new ArrayList<>();
        if (response == null || response.results == null) {
            return candidates;
        }
        for (PlacesSearchResult result : response.results) {
            if (candidates.size() == limit) {
                break;
            }
            candidates.add(PlaceCandidate.builder()
                    .title(result.name)
                    .address(result.formattedAddress != null ? result.formattedAddress : result.vicinity)
                    .coordinate(result.geometry != null
                            ? Coordinate.of(result.geometry.location.lat, result.geometry.location.lng)
                            : null)
                    .open(result.openingHours != null && Boolean.TRUE.equals(result.openingHours.openNow))
                    .build());
        }
        return candidates;
    }

    private static String countryCodeOf(GeocodingResult result) {
        if (result.addressComponents == null) {
            return null;
        }
        for (AddressComponent component : result.addressComponents) {
            if (component.types == null) {
                continue;
            }
            for (AddressComponentType type : component.types) {
                if (type == AddressComponentType.COUNTRY) {
                    return component.shortName;
                }
            }
        }
        return null;
    }
}
