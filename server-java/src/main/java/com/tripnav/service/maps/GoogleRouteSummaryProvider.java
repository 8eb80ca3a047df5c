package com.tripnav.service.maps;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.maps.DirectionsApi;
import com.google.maps.GeoApiContext;
import com.google.maps.errors.ApiException;
import com.google.maps.model.DirectionsLeg;
import com.google.maps.model.DirectionsResult;
import com.google.maps.model.DirectionsRoute;
import com.google.maps.model.LatLng;
import com.google.maps.model.TravelMode;
import com.tripnav.model.Coordinate;
import com.tripnav.model.RouteSummary;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Driving route summary from either the legacy Directions API (through the SDK)
 * or the Routes API (plain HTTP), chosen by {@code google.maps.routing.api}.
 */
@Service
@Slf4j
public class GoogleRouteSummaryProvider implements RouteSummaryProvider {

    private static final String ROUTES_API_URL = "https://routes.googleapis.com/directions/v2:computeRoutes";
    private static final Pattern DURATION_PATTERN = Pattern.compile("^(\\d+)s$");
    private static final double METERS_PER_MILE = 1609.34;

    private final GeoApiContext geoApiContext;
    private final OkHttpClient httpClient;
    private final Gson gson = new Gson();
    private final String routingApi;
    private final String apiKey;

    public GoogleRouteSummaryProvider(
            GeoApiContext geoApiContext,
            OkHttpClient httpClient,
            @Value("${google.maps.routing.api:directions}") String routingApi,
            @Value("${google.maps.api.key:}") String apiKey
    ) {
        this.geoApiContext = geoApiContext;
        this.httpClient = httpClient;
        this.routingApi = routingApi;
        this.apiKey = apiKey;
    }

    @Override
    public Optional<RouteSummary> route(Coordinate start, Coordinate end) {
        String api = resolveRoutingApi();
        log.info("Routing {} -> {} via {} API", start.toLatLonString(), end.toLatLonString(), api);
        try {
            if ("routes".equals(api)) {
                return routeViaRoutesApi(start, end);
            }
            return routeViaDirectionsApi(start, end);
        } catch (ApiException | IOException e) {
            throw new PlaceResolutionException("Route lookup failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlaceResolutionException("Route lookup interrupted", e);
        }
    }

    String resolveRoutingApi() {
        String api = (routingApi != null ? routingApi : "directions").trim().toLowerCase();
        if (!"directions".equals(api) && !"routes".equals(api)) {
            log.warn("Unknown google.maps.routing.api value \"{}\", falling back to \"directions\"", api);
            return "directions";
        }
        return api;
    }

    private Optional<RouteSummary> routeViaDirectionsApi(Coordinate start, Coordinate end)
            throws ApiException, InterruptedException, IOException {
        DirectionsResult result = DirectionsApi.newRequest(geoApiContext)
                .origin(new LatLng(start.getLat(), start.getLon()))
                .destination(new LatLng(end.getLat(), end.getLon()))
                .mode(TravelMode.DRIVING)
                .await();

        if (result == null || result.routes == null || result.routes.length == 0) {
            return Optional.empty();
        }

        DirectionsRoute route = result.routes[0];
        long totalDistance = 0;
        long totalDuration = 0;
        for (DirectionsLeg leg : route.legs) {
            totalDistance += leg.distance.inMeters;
            totalDuration += leg.duration.inSeconds;
        }

        return Optional.of(RouteSummary.builder()
                .distanceMeters(totalDistance)
                .durationSeconds(totalDuration)
                .distanceText(formatDistance(totalDistance))
                .durationText(formatDuration(totalDuration))
                .encodedPath(route.overviewPolyline != null ? route.overviewPolyline.getEncodedPath() : "")
                .build());
    }

    private Optional<RouteSummary> routeViaRoutesApi(Coordinate start, Coordinate end) throws IOException {
        JsonObject body = new JsonObject();
        body.add("origin", buildRoutesWaypoint(start));
        body.add("destination", buildRoutesWaypoint(end));
        body.addProperty("travelMode", "DRIVE");
        body.addProperty("languageCode", "en-US");
        body.addProperty("units", "IMPERIAL");

        String fieldMask = String.join(",",
                "routes.distanceMeters",
                "routes.duration",
                "routes.polyline",
                "routes.localizedValues");

        Request request = new Request.Builder()
                .url(ROUTES_API_URL)
                .post(RequestBody.create(gson.toJson(body), MediaType.parse("application/json")))
                .addHeader("X-Goog-Api-Key", apiKey)
                .addHeader("X-Goog-FieldMask", fieldMask)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new IOException("Routes API error (" + response.code() + "): " + responseBody);
            }
            return parseRoutesResponse(responseBody);
        }
    }

    /**
     * Reads the first route of a Routes API response, preferring its localized texts.
     */
    Optional<RouteSummary> parseRoutesResponse(String responseBody) {
        JsonObject data = gson.fromJson(responseBody, JsonObject.class);
        if (data == null || !data.has("routes") || data.getAsJsonArray("routes").isEmpty()) {
            return Optional.empty();
        }
        JsonObject route = data.getAsJsonArray("routes").get(0).getAsJsonObject();

        long distanceMeters = route.has("distanceMeters") ? route.get("distanceMeters").getAsLong() : 0;
        long durationSeconds = route.has("duration") ? parseDurationString(route.get("duration").getAsString()) : 0;

        String distanceText = formatDistance(distanceMeters);
        String durationText = formatDuration(durationSeconds);
        if (route.has("localizedValues")) {
            JsonObject localized = route.getAsJsonObject("localizedValues");
            if (localized.has("distance") && localized.getAsJsonObject("distance").has("text")) {
                distanceText = localized.getAsJsonObject("distance").get("text").getAsString();
            }
            if (localized.has("duration") && localized.getAsJsonObject("duration").has("text")) {
                durationText = localized.getAsJsonObject("duration").get("text").getAsString();
            }
        }

        String encodedPath = "";
        if (route.has("polyline") && route.getAsJsonObject("polyline").has("encodedPolyline")) {
            encodedPath = route.getAsJsonObject("polyline").get("encodedPolyline").getAsString();
        }

        return Optional.of(RouteSummary.builder()
                .distanceMeters(distanceMeters)
                .durationSeconds(durationSeconds)
                .distanceText(distanceText)
                .durationText(durationText)
                .encodedPath(encodedPath)
                .build());
    }

    private JsonObject buildRoutesWaypoint(Coordinate coordinate) {
        JsonObject latLng = new JsonObject();
        latLng.addProperty("latitude", coordinate.getLat());
        latLng.addProperty("longitude", coordinate.getLon());

        JsonObject location = new JsonObject();
        location.add("latLng", latLng);

        JsonObject waypoint = new JsonObject();
        waypoint.add("location", location);
        return waypoint;
    }

    /**
     * Parse a Routes API duration string like "300s" into seconds
     */
    static long parseDurationString(String durationStr) {
        if (durationStr == null || durationStr.isEmpty()) return 0;
        Matcher m = DURATION_PATTERN.matcher(durationStr);
        return m.matches() ? Long.parseLong(m.group(1)) : 0;
    }

    static String formatDistance(long meters) {
        return String.format("%.1f mi", meters / METERS_PER_MILE);
    }

    static String formatDuration(long seconds) {
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;

        if (hours > 0) {
            return String.format("%d hr %d min", hours, minutes);
        }
        return String.format("%d min", minutes);
    }
}
