package com.tripnav.service;

import com.tripnav.model.Intent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps trip request text to intents using a fixed trigger-phrase table.
 * A trigger only matches at word boundaries, so "by" does not fire inside "Albany".
 */
@Component
@Slf4j
public class IntentClassifier {

    private static final Map<Intent, List<String>> TRIGGERS = new EnumMap<>(Intent.class);

    static {
        TRIGGERS.put(Intent.BASIC_NAVIGATION, List.of(
                "navigate", "route", "direction", "directions", "way to reach", "go to", "trip", "drive"));
        TRIGGERS.put(Intent.MULTI_STOP, List.of(
                "multi-stop", "stop at", "stops at", "via", "passing through", "multiple stops", "with stops"));
        TRIGGERS.put(Intent.TIME_CONSTRAINED, List.of(
                "arrive by", "reach by", "leave at", "depart at", "by", "before", "after", "sharp"));
        TRIGGERS.put(Intent.TRAFFIC_AWARE, List.of(
                "avoid traffic", "traffic-free", "least traffic", "no congestion"));
        TRIGGERS.put(Intent.SCENIC_ROUTING, List.of(
                "scenic", "beautiful", "picturesque", "scenery"));
        TRIGGERS.put(Intent.FUEL_EFFICIENT, List.of(
                "fuel-efficient", "save fuel", "economic route"));
        TRIGGERS.put(Intent.AVOIDING_TOLLS, List.of(
                "avoid tolls", "avoiding tolls", "no tolls", "without toll"));
        TRIGGERS.put(Intent.AVOIDING_HIGHWAYS, List.of(
                "avoid highways", "no highways", "without highways"));
        TRIGGERS.put(Intent.WEATHER_BASED, List.of(
                "weather", "rain", "snow", "storm", "avoid weather"));
        TRIGGERS.put(Intent.EV_CHARGING, List.of(
                "ev charging", "electric charging", "charging stations", "ev stops"));
        TRIGGERS.put(Intent.EMERGENCY_ROUTING, List.of(
                "hospital", "emergency", "urgent care", "immediately"));
        TRIGGERS.put(Intent.PARKING_AVAILABILITY, List.of(
                "parking", "park near", "where can i park"));
        TRIGGERS.put(Intent.SHORTEST, List.of(
                "shortest", "quickest", "fastest"));
        TRIGGERS.put(Intent.REST_STOP, List.of(
                "rest stop", "rest stops", "break every", "rest every", "stop every"));
        TRIGGERS.put(Intent.NIGHT_STAY, List.of(
                "night stay", "overnight", "stay in", "stay at"));
    }

    private static final Map<Intent, List<Pattern>> PATTERNS = compile(TRIGGERS);

    public Set<Intent> classify(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptySet();
        }
        String lower = text.toLowerCase(Locale.ROOT);

        Set<Intent> detected = new LinkedHashSet<>();
        for (Map.Entry<Intent, List<Pattern>> entry : PATTERNS.entrySet()) {
            for (Pattern trigger : entry.getValue()) {
                if (trigger.matcher(lower).find()) {
                    detected.add(entry.getKey());
                    break;
                }
            }
        }

        log.debug("Intents for \"{}\": {}", text, detected);
        return Collections.unmodifiableSet(detected);
    }

    static Map<Intent, List<String>> triggers() {
        return Collections.unmodifiableMap(TRIGGERS);
    }

    private static Map<Intent, List<Pattern>> compile(Map<Intent, List<String>> triggers) {
        Map<Intent, List<Pattern>> compiled = new EnumMap<>(Intent.class);
        triggers.forEach((intent, phrases) -> compiled.put(intent, phrases.stream()
                .map(phrase -> Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b"))
                .collect(Collectors.toUnmodifiableList())));
        return Collections.unmodifiableMap(compiled);
    }
}
