package com.tripnav.service.extraction;

import com.tripnav.model.DistanceConstraint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class DistanceConstraintExtractor {

    private static final Pattern REST_STOPS_EVERY = Pattern.compile(
            "rest stops every ((\\d+) ?(miles|mile|km|kilometers))\\b");

    public List<DistanceConstraint> extract(String text) {
        List<DistanceConstraint> constraints = new ArrayList<>();
        if (text == null) {
            return constraints;
        }
        Matcher matcher = REST_STOPS_EVERY.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            constraints.add(DistanceConstraint.builder()
                    .text(matcher.group(1))
                    .value(ExtractedNumbers.parseCount(matcher.group(2)))
                    .unit(matcher.group(3))
                    .build());
        }
        return constraints;
    }
}
