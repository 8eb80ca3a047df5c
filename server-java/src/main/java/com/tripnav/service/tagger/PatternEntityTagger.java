package com.tripnav.service.tagger;

import com.tripnav.model.TaggedEntity;
import com.tripnav.model.TaggedEntity.EntityCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based tagger used when no NER service is configured.
 * A run of capitalized words is a facility when it contains a facility word and a
 * place name when it follows a locative preposition or continues a list of places.
 * Any other run (a brand or business name, usually) is tagged {@code OTHER}.
 * Calendar and clock expressions are calendar-time spans.
 */
@Slf4j
public class PatternEntityTagger implements EntityTagger {

    private static final Pattern CAPITALIZED_RUN = Pattern.compile(
            "\\b([A-Z][a-z]+(?:\\s+(?:of\\s+|de\\s+)?[A-Z][a-z]+)*)\\b");

    private static final Pattern CALENDAR_TIME = Pattern.compile(
            "\\b(" +
                    "(?:next\\s+|this\\s+)?(?:monday|tuesday|wednesday|thursday|friday|saturday|sunday)(?:\\s+(?:morning|afternoon|evening|night))?" +
                    "|(?:jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?\\s+\\d{1,2}(?:st|nd|rd|th)?(?:,?\\s+\\d{4})?" +
                    "|\\d{1,2}[/-]\\d{1,2}(?:[/-]\\d{2,4})?" +
                    "|\\d{1,2}(?::\\d{2})?\\s?(?:am|pm)" +
                    "|\\d{1,2}:\\d{2}" +
                    "|tomorrow(?:\\s+(?:morning|afternoon|evening|night))?" +
                    "|today|tonight|noon|midnight" +
                    "|this\\s+(?:morning|afternoon|evening|weekend)" +
                    "|next\\s+(?:week|weekend|month)" +
                    ")\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> FACILITY_WORDS = Set.of(
            "park", "airport", "station", "mall", "hospital", "center", "centre", "bridge", "museum",
            "stadium", "university", "college", "hotel", "terminal", "plaza", "market", "square", "tower");

    private static final Set<String> LOCATIVE_WORDS = Set.of(
            "in", "to", "from", "near", "through", "into", "toward", "towards", "around", "across", "between");

    // Comma and/or "and" between two list items.
    private static final Pattern LIST_CONTINUATION = Pattern.compile("\\s*(?:,\\s*(?:and\\s+)?|and\\s+)");

    // Capitalized words that never start a place name on their own.
    private static final Set<String> NON_PLACE_WORDS = Set.of(
            "i", "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
            "january", "february", "march", "april", "may", "june", "july", "august",
            "september", "october", "november", "december", "ev", "please");

    @Override
    public List<TaggedEntity> tag(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Span> spans = new ArrayList<>();
        tagCalendarTimes(text, spans);
        tagPlaces(text, spans);
        spans.sort(Comparator.comparingInt(Span::start));

        List<TaggedEntity> entities = new ArrayList<>(spans.size());
        for (Span span : spans) {
            entities.add(new TaggedEntity(span.text(), span.category()));
        }
        log.debug("Tagged {} entities in \"{}\"", entities.size(), text);
        return entities;
    }

    private void tagCalendarTimes(String text, List<Span> spans) {
        Matcher matcher = CALENDAR_TIME.matcher(text);
        while (matcher.find()) {
            spans.add(new Span(matcher.start(1), matcher.end(1), matcher.group(1), EntityCategory.CALENDAR_TIME));
        }
    }

    private void tagPlaces(String text, List<Span> spans) {
        int lastPlaceEnd = -1;
        Matcher matcher = CAPITALIZED_RUN.matcher(text);
        while (matcher.find()) {
            int start = matcher.start(1);
            int end = matcher.end(1);
            String phrase = matcher.group(1);
            String[] words = phrase.split("\\s+");

            // A single capitalized word opening a sentence is just sentence case.
            if (words.length == 1 && isSentenceStart(text, start)) {
                continue;
            }
            if (NON_PLACE_WORDS.contains(words[0].toLowerCase(Locale.ROOT)) || overlaps(spans, start, end)) {
                continue;
            }
            EntityCategory category;
            if (containsFacilityWord(words)) {
                category = EntityCategory.FACILITY;
            } else if (LOCATIVE_WORDS.contains(previousWord(text, start))
                    || (lastPlaceEnd >= 0 && LIST_CONTINUATION.matcher(text.substring(lastPlaceEnd, start)).matches())) {
                category = EntityCategory.PLACE_NAME;
            } else {
                category = EntityCategory.OTHER;
            }
            if (category != EntityCategory.OTHER) {
                lastPlaceEnd = end;
            }
            spans.add(new Span(start, end, phrase, category));
        }
    }

    private static String previousWord(String text, int index) {
        int end = index;
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        int begin = end;
        while (begin > 0 && Character.isLetter(text.charAt(begin - 1))) {
            begin--;
        }
        return text.substring(begin, end).toLowerCase(Locale.ROOT);
    }

    private static boolean containsFacilityWord(String[] words) {
        for (String word : words) {
            if (FACILITY_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSentenceStart(String text, int index) {
        for (int i = index - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c == '.' || c == '!' || c == '?';
            }
        }
        return true;
    }

    private static boolean overlaps(List<Span> spans, int start, int end) {
        for (Span span : spans) {
            if (start < span.end() && span.start() < end) {
                return true;
            }
        }
        return false;
    }

    private record Span(int start, int end, String text, EntityCategory category) {
    }
}
