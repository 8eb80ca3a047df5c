package com.tripnav.service;

import com.tripnav.model.Coordinate;
import com.tripnav.model.ExtractedQuery;
import com.tripnav.model.GeocodedLocation;
import com.tripnav.model.Place;
import com.tripnav.model.PlaceCandidate;
import com.tripnav.model.ResolutionStatus;
import com.tripnav.model.ResolvedLocation;
import com.tripnav.model.RouteSummary;
import com.tripnav.model.TripResult;
import com.tripnav.model.Waypoint;
import com.tripnav.service.maps.PlaceResolver;
import com.tripnav.service.maps.RouteSummaryProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Turns one trip request into a {@link TripResult}.
 *
 * <p>Start is resolved first since the end lookup is scoped to its country and
 * waypoints are searched around its coordinate. End and every waypoint are then
 * resolved concurrently, each call bounded by {@code trip.resolver.timeout-ms}.
 * A failed or timed-out call never aborts the request: Start/End fall back to the
 * configured default coordinate and a waypoint simply gets no places. Each
 * fallback is reported in {@link TripResult#getNotices()}.
 */
@Service
@Slf4j
public class TripAssemblerService {

    private final QueryUnderstandingService queryUnderstandingService;
    private final PlaceResolver placeResolver;
    private final RouteSummaryProvider routeSummaryProvider;
    private final ExecutorService resolverExecutor;
    private final Coordinate fallbackCoordinate;
    private final String fallbackCountry;
    private final int waypointLimit;
    private final int fetchSize;
    private final long timeoutMs;

    public TripAssemblerService(
            QueryUnderstandingService queryUnderstandingService,
            PlaceResolver placeResolver,
            RouteSummaryProvider routeSummaryProvider,
            @Qualifier("resolverExecutor") ExecutorService resolverExecutor,
            @Value("${trip.fallback.lat:32.7767}") double fallbackLat,
            @Value("${trip.fallback.lon:-96.7970}") double fallbackLon,
            @Value("${trip.fallback.country:US}") String fallbackCountry,
            @Value("${trip.waypoint.limit:2}") int waypointLimit,
            @Value("${trip.waypoint.fetch-size:10}") int fetchSize,
            @Value("${trip.resolver.timeout-ms:5000}") long timeoutMs
    ) {
        this.queryUnderstandingService = queryUnderstandingService;
        this.placeResolver = placeResolver;
        this.routeSummaryProvider = routeSummaryProvider;
        this.resolverExecutor = resolverExecutor;
        this.fallbackCoordinate = Coordinate.of(fallbackLat, fallbackLon);
        this.fallbackCountry = fallbackCountry;
        this.waypointLimit = waypointLimit;
        this.fetchSize = Math.max(fetchSize, waypointLimit);
        this.timeoutMs = timeoutMs;
    }

    public TripResult assemble(String query) {
        log.info("Assembling trip for \"{}\"", query);
        return assemble(queryUnderstandingService.understand(query));
    }

    public TripResult assemble(ExtractedQuery extracted) {
        Outcome<ResolvedLocation> start = resolveStart(extracted).join();

        String countryHint = start.getValue().isResolved() ? start.getValue().getCountryCode() : null;
        Coordinate anchor = start.getValue().getCoordinate();

        CompletableFuture<Outcome<ResolvedLocation>> endFuture = resolveEnd(extracted.getEndLocation(), countryHint);
        List<CompletableFuture<Outcome<Waypoint>>> waypointFutures = new ArrayList<>();
        for (String waypoint : extracted.getWaypoints()) {
            waypointFutures.add(resolveWaypoint(waypoint, anchor));
        }

        Outcome<ResolvedLocation> end = endFuture.join();
        List<Outcome<Waypoint>> waypoints = new ArrayList<>();
        for (CompletableFuture<Outcome<Waypoint>> future : waypointFutures) {
            waypoints.add(future.join());
        }

        Outcome<RouteSummary> route = resolveRoute(start.getValue(), end.getValue()).join();

        List<String> notices = new ArrayList<>();
        start.addNoticeTo(notices);
        end.addNoticeTo(notices);
        waypoints.forEach(outcome -> outcome.addNoticeTo(notices));
        route.addNoticeTo(notices);

        List<Waypoint> resolvedWaypoints = new ArrayList<>();
        waypoints.forEach(outcome -> resolvedWaypoints.add(outcome.getValue()));

        return TripResult.builder()
                .query(extracted.getQuery())
                .intents(extracted.getIntents())
                .start(start.getValue())
                .end(end.getValue())
                .genericLocations(extracted.getGenericLocations())
                .waypoints(List.copyOf(resolvedWaypoints))
                .distanceConstraints(extracted.getDistanceConstraints())
                .timeConstraints(extracted.getTimeConstraints())
                .routeSummary(route.getValue())
                .notices(List.copyOf(notices))
                .build();
    }

    private CompletableFuture<Outcome<ResolvedLocation>> resolveStart(ExtractedQuery extracted) {
        String text = extracted.getStartLocation();
        if (extracted.isStartDefaulted()) {
            return CompletableFuture.completedFuture(fallback(text, "Start is \"" + text + "\""));
        }
        return resolveLocation(text, null, "start");
    }

    private CompletableFuture<Outcome<ResolvedLocation>> resolveEnd(String text, String countryHint) {
        if (text == null) {
            return CompletableFuture.completedFuture(new Outcome<>(ResolvedLocation.absent(), null));
        }
        return resolveLocation(text, countryHint, "end");
    }

    private CompletableFuture<Outcome<ResolvedLocation>> resolveLocation(String text, String countryHint, String role) {
        return withTimeout(() -> placeResolver.geocode(text, countryHint))
                .handle((geocoded, error) -> {
                    if (error != null) {
                        return fallback(text, "Could not resolve " + role + " \"" + text + "\" (" + describe(error) + ")");
                    }
                    if (geocoded.isEmpty()) {
                        return fallback(text, "No match for " + role + " \"" + text + "\"");
                    }
                    GeocodedLocation location = geocoded.get();
                    return new Outcome<>(ResolvedLocation.builder()
                            .text(text)
                            .coordinate(location.getCoordinate())
                            .countryCode(location.getCountryCode())
                            .status(ResolutionStatus.RESOLVED)
                            .build(), null);
                });
    }

    private CompletableFuture<Outcome<Waypoint>> resolveWaypoint(String text, Coordinate anchor) {
        return withTimeout(() -> placeResolver.search(text, anchor.getLat(), anchor.getLon(), fetchSize))
                .handle((candidates, error) -> {
                    if (error != null) {
                        return new Outcome<>(Waypoint.builder().text(text).places(List.of()).build(),
                                "Could not search places for waypoint \"" + text + "\" (" + describe(error) + ")");
                    }
                    return new Outcome<>(Waypoint.builder()
                            .text(text)
                            .places(selectPlaces(candidates, waypointLimit))
                            .build(), null);
                });
    }

    private CompletableFuture<Outcome<RouteSummary>> resolveRoute(ResolvedLocation start, ResolvedLocation end) {
        if (!start.isResolved() || !end.isResolved()) {
            return CompletableFuture.completedFuture(new Outcome<>(null, null));
        }
        return withTimeout(() -> routeSummaryProvider.route(start.getCoordinate(), end.getCoordinate()))
                .handle((summary, error) -> {
                    if (error != null) {
                        return new Outcome<>(null, "Route summary unavailable (" + describe(error) + ")");
                    }
                    if (summary.isEmpty()) {
                        return new Outcome<>(null, "No route found between start and end");
                    }
                    return new Outcome<>(summary.get(), null);
                });
    }

    /**
     * Open places only, first occurrence of each (title, address) pair, at most {@code limit}.
     */
    static List<Place> selectPlaces(List<PlaceCandidate> candidates, int limit) {
        List<Place> places = new ArrayList<>();
        if (candidates == null) {
            return places;
        }
        Set<String> seen = new HashSet<>();
        for (PlaceCandidate candidate : candidates) {
            if (places.size() == limit) {
                break;
            }
            if (!candidate.isOpen()) {
                continue;
            }
            String key = nullToEmpty(candidate.getTitle()) + "|" + nullToEmpty(candidate.getAddress());
            if (!seen.add(key)) {
                continue;
            }
            places.add(candidate.toPlace());
        }
        return List.copyOf(places);
    }

    private Outcome<ResolvedLocation> fallback(String text, String reason) {
        String notice = reason + "; using default location " + fallbackCoordinate.toLatLonString()
                + " (" + fallbackCountry + ")";
        return new Outcome<>(ResolvedLocation.builder()
                .text(text)
                .coordinate(fallbackCoordinate)
                .countryCode(fallbackCountry)
                .status(ResolutionStatus.DEFAULTED)
                .build(), notice);
    }

    private <T> CompletableFuture<T> withTimeout(Supplier<T> call) {
        return CompletableFuture.supplyAsync(call, resolverExecutor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    /**
     * A resolved value plus the fallback notice it produced, if any.
     */
    private static final class Outcome<T> {
        private final T value;
        private final String notice;

        Outcome(T value, String notice) {
            this.value = value;
            this.notice = notice;
        }

        T getValue() {
            return value;
        }

        void addNoticeTo(List<String> notices) {
            if (notice != null) {
                log.warn(notice);
                notices.add(notice);
            }
        }
    }
}
