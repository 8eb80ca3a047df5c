package com.tripnav.service.extraction;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects intermediate stops ("stop at", "night stay in", "via", "quick stop at").
 * Results come back lower-cased, in pattern order then match order, and may repeat
 * when two patterns cover the same phrase; dedup is left to {@code QueryNormalizer}.
 */
@Component
public class WaypointExtractor {

    private static final List<Pattern> TRIGGERS = List.of(
            Pattern.compile("\\bstop at ([\\w\\s]+)"),
            Pattern.compile("\\bnight stay (?:at|in) ([\\w\\s,]+)"),
            Pattern.compile("\\bvia ([\\w\\s,]+)"),
            Pattern.compile("\\bquick stop at ([\\w\\s]+)")
    );

    private static final Pattern LIST_SEPARATOR = Pattern.compile(",|\\band\\b");

    public List<String> extract(String text) {
        List<String> waypoints = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return waypoints;
        }
        String lower = text.toLowerCase(Locale.ROOT);

        for (Pattern trigger : TRIGGERS) {
            Matcher matcher = trigger.matcher(lower);
            while (matcher.find()) {
                for (String point : LIST_SEPARATOR.split(matcher.group(1))) {
                    String trimmed = point.trim();
                    if (!trimmed.isEmpty()) {
                        waypoints.add(trimmed);
                    }
                }
            }
        }
        return waypoints;
    }
}
