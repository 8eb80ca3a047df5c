package com.tripnav.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Reconciles extracted waypoints with the tagger's generic locations and the trip endpoints.
 */
@Component
@Slf4j
public class QueryNormalizer {

    /**
     * Keeps waypoints in extraction order, dropping repeats and anything that is
     * already a generic location, the start or the end (compared ignoring case).
     */
    public List<String> uniqueWaypoints(List<String> waypoints,
                                        Collection<String> genericLocations,
                                        String start,
                                        String end) {
        Set<String> taken = new LinkedHashSet<>();
        genericLocations.stream()
                .filter(Objects::nonNull)
                .map(QueryNormalizer::key)
                .forEach(taken::add);
        if (start != null) {
            taken.add(key(start));
        }
        if (end != null) {
            taken.add(key(end));
        }

        List<String> unique = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String waypoint : waypoints) {
            String key = key(waypoint);
            if (key.isEmpty() || taken.contains(key) || !seen.add(key)) {
                continue;
            }
            unique.add(waypoint);
        }

        if (unique.size() != waypoints.size()) {
            log.debug("Waypoints {} normalized to {}", waypoints, unique);
        }
        return List.copyOf(unique);
    }

    private static String key(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
