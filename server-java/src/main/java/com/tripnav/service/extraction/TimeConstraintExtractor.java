package com.tripnav.service.extraction;

import com.tripnav.model.DurationConstraint;
import com.tripnav.model.TaggedEntity;
import com.tripnav.model.TimeConstraints;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Calendar/time mentions come from the tagged entities, durations from a regex.
 * The two lists are not reconciled against each other.
 */
@Component
public class TimeConstraintExtractor {

    private static final Pattern DURATION = Pattern.compile(
            "((\\d+)\\s?(minutes|minute|mins|min|hours|hour|hrs|hr))\\b");

    public TimeConstraints extract(String text, List<TaggedEntity> entities) {
        if (text == null || text.isBlank()) {
            return TimeConstraints.builder()
                    .times(List.of())
                    .durations(List.of())
                    .build();
        }

        List<String> times = entities.stream()
                .filter(entity -> entity.getCategory() == TaggedEntity.EntityCategory.CALENDAR_TIME)
                .map(TaggedEntity::getText)
                .collect(Collectors.toList());

        List<DurationConstraint> durations = new ArrayList<>();
        Matcher matcher = DURATION.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            durations.add(DurationConstraint.builder()
                    .text(matcher.group(1))
                    .value(ExtractedNumbers.parseCount(matcher.group(2)))
                    .unit(matcher.group(3))
                    .build());
        }

        return TimeConstraints.builder()
                .times(List.copyOf(times))
                .durations(List.copyOf(durations))
                .build();
    }
}
