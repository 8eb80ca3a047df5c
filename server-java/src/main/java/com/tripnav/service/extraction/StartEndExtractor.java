package com.tripnav.service.extraction;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the "from X to Y" part of a request.
 */
@Component
public class StartEndExtractor {

    public static final String CURRENT_LOCATION = "current location";

    // Y ends at the first ",", ".", " with", " but", " and" or end of text.
    private static final Pattern FROM_TO = Pattern.compile(
            "\\bfrom\\s+(.+?)\\s+to\\s+(.+?)\\s*(?=,|\\.|\\s+with\\b|\\s+but\\b|\\s+and\\b|$)",
            Pattern.CASE_INSENSITIVE);

    public Endpoints extract(String text) {
        if (text != null) {
            Matcher matcher = FROM_TO.matcher(text);
            if (matcher.find()) {
                String start = matcher.group(1).trim();
                String end = matcher.group(2).trim();
                if (!start.isEmpty() && !end.isEmpty()) {
                    return new Endpoints(start, end, false);
                }
            }
        }
        return new Endpoints(CURRENT_LOCATION, null, true);
    }

    @Value
    public static class Endpoints {
        String start;
        String end;
        /** No "from ... to" was present and {@link #CURRENT_LOCATION} stands in for the start. */
        boolean startDefaulted;
    }
}
