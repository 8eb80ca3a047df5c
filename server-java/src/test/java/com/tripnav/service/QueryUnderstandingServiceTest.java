package com.tripnav.service;

import com.tripnav.model.DistanceConstraint;
import com.tripnav.model.ExtractedQuery;
import com.tripnav.model.Intent;
import com.tripnav.model.TaggedEntity;
import com.tripnav.model.TaggedEntity.EntityCategory;
import com.tripnav.service.extraction.DistanceConstraintExtractor;
import com.tripnav.service.extraction.GenericLocationExtractor;
import com.tripnav.service.extraction.StartEndExtractor;
import com.tripnav.service.extraction.TimeConstraintExtractor;
import com.tripnav.service.extraction.WaypointExtractor;
import com.tripnav.service.tagger.EntityTagger;
import com.tripnav.service.tagger.PatternEntityTagger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Query Understanding Tests")
class QueryUnderstandingServiceTest {

    static final List<String> QUERIES = List.of(
            "Plan a trip from Dallas to Austin with a stop at a Walmart and a coffee shop.",
            "Navigate from New York to Philadelphia and avoid highways, stop at a gas station and pharmacy.",
            "Drive from San Francisco to Napa Valley with scenic views and a night stay in Sonoma.",
            "Plan a long road trip from New York to Los Angeles with rest stops every 300 miles and a night stay in Chicago and Denver.",
            "Find the shortest route from my house to the airport with a quick stop at a nearby ATM.",
            "Show me a scenic drive from San Francisco to Yosemite National Park with a stop at a famous viewpoint.",
            "Go via Austin and Waco, stop at Austin for lunch",
            "Plan a trip from Dallas to Austin with a stop at Starbucks.",
            "Drive from Houston to San Antonio with a quick stop at Buc-ees and a stop at Whataburger",
            "I need to urgently reach a hospital from my office due to heavy snow and avoid traffic."
    );

    static QueryUnderstandingService newService() {
        return newService(new PatternEntityTagger());
    }

    static QueryUnderstandingService newService(EntityTagger tagger) {
        return new QueryUnderstandingService(
                tagger,
                new IntentClassifier(),
                new StartEndExtractor(),
                new GenericLocationExtractor(),
                new WaypointExtractor(),
                new DistanceConstraintExtractor(),
                new TimeConstraintExtractor(),
                new QueryNormalizer());
    }

    private final QueryUnderstandingService service = newService();

    @Test
    @DisplayName("Scenario: trip from Dallas to Austin with two stops")
    void testDallasAustin() {
        ExtractedQuery extracted = service.understand(
                "Plan a trip from Dallas to Austin with a stop at a Walmart and a coffee shop.");

        assertTrue(extracted.getIntents().containsAll(Set.of(Intent.BASIC_NAVIGATION, Intent.MULTI_STOP)));
        assertTrue("dallas".equalsIgnoreCase(extracted.getStartLocation()));
        assertTrue("austin".equalsIgnoreCase(extracted.getEndLocation()));
        assertFalse(extracted.isStartDefaulted());
        assertEquals(List.of("a walmart", "a coffee shop"), extracted.getWaypoints());
        assertTrue(extracted.getGenericLocations().isEmpty());
    }

    @Test
    @DisplayName("A named business stop stays a waypoint")
    void testBrandStopKept() {
        ExtractedQuery extracted = service.understand(
                "Plan a trip from Dallas to Austin with a stop at Starbucks.");

        assertEquals(List.of("starbucks"), extracted.getWaypoints());
        assertTrue(extracted.getGenericLocations().isEmpty());
    }

    @Test
    @DisplayName("Several named business stops all stay waypoints")
    void testBrandStopsKept() {
        ExtractedQuery extracted = service.understand(
                "Drive from Houston to San Antonio with a quick stop at Buc-ees and a stop at Whataburger");

        assertEquals(List.of("buc", "whataburger"), extracted.getWaypoints());
        assertTrue(extracted.getGenericLocations().isEmpty());
    }

    @Test
    @DisplayName("Oversized numbers are kept as text instead of failing")
    void testOversizedNumbers() {
        ExtractedQuery distance = service.understand("rest stops every 99999999999 miles");
        assertEquals("99999999999 miles", distance.getDistanceConstraints().get(0).getText());
        assertNull(distance.getDistanceConstraints().get(0).getValue());

        ExtractedQuery duration = service.understand("from Dallas to Austin, stay 3000000000 minutes");
        assertEquals("Austin", duration.getEndLocation());
        assertEquals("3000000000 minutes", duration.getTimeConstraints().getDurations().get(0).getText());
        assertNull(duration.getTimeConstraints().getDurations().get(0).getValue());
    }

    @Test
    @DisplayName("The query is tagged once and shared by the extractors")
    void testTaggedOnce() {
        String query = "tomorrow from Dallas to Austin with a night stay in Waco";
        EntityTagger tagger = mock(EntityTagger.class);
        when(tagger.tag(query)).thenReturn(List.of(
                new TaggedEntity("Dallas", EntityCategory.PLACE_NAME),
                new TaggedEntity("Austin", EntityCategory.PLACE_NAME),
                new TaggedEntity("tomorrow", EntityCategory.CALENDAR_TIME),
                new TaggedEntity("Waco", EntityCategory.PLACE_NAME)));

        ExtractedQuery extracted = newService(tagger).understand(query);

        assertEquals(List.of("Waco"), extracted.getGenericLocations());
        assertEquals(List.of("tomorrow"), extracted.getTimeConstraints().getTimes());
        verify(tagger, times(1)).tag(query);
    }

    @Test
    @DisplayName("Scenario: rest stops every 300 miles")
    void testRestStops() {
        ExtractedQuery extracted = service.understand("rest stops every 300 miles");

        assertEquals(List.of("300 miles"), extracted.getDistanceConstraints().stream()
                .map(DistanceConstraint::getText)
                .collect(Collectors.toList()));
        assertTrue(extracted.getIntents().contains(Intent.REST_STOP));
    }

    @Test
    @DisplayName("Scenario: no from/to and no place names")
    void testNothingToExtract() {
        ExtractedQuery extracted = service.understand("find the quickest way home");

        assertEquals(StartEndExtractor.CURRENT_LOCATION, extracted.getStartLocation());
        assertTrue(extracted.isStartDefaulted());
        assertNull(extracted.getEndLocation());
        assertTrue(extracted.getWaypoints().isEmpty());
        assertTrue(extracted.getGenericLocations().isEmpty());
    }

    @Test
    @DisplayName("Night-stay cities reported as locations are not repeated as waypoints")
    void testNightStayMerged() {
        ExtractedQuery extracted = service.understand(QUERIES.get(3));

        assertEquals("New York", extracted.getStartLocation());
        assertEquals("Los Angeles", extracted.getEndLocation());
        assertEquals(List.of("Chicago", "Denver"), extracted.getGenericLocations());
        assertTrue(extracted.getWaypoints().isEmpty());
        assertEquals("300 miles", extracted.getDistanceConstraints().get(0).getText());
    }

    @Test
    @DisplayName("Waypoints, generic locations and endpoints never overlap")
    void testDisjointness() {
        for (String query : QUERIES) {
            ExtractedQuery extracted = service.understand(query);

            Set<String> waypoints = lower(extracted.getWaypoints());
            Set<String> locations = lower(extracted.getGenericLocations());
            assertTrue(waypoints.stream().noneMatch(locations::contains), query);

            for (String endpoint : new String[]{extracted.getStartLocation(), extracted.getEndLocation()}) {
                if (endpoint != null) {
                    String key = endpoint.toLowerCase(Locale.ROOT);
                    assertFalse(waypoints.contains(key), query);
                    assertFalse(locations.contains(key), query);
                }
            }
            assertEquals(waypoints.size(), extracted.getWaypoints().size(), "waypoints must be unique: " + query);
        }
    }

    @Test
    @DisplayName("Extraction is deterministic")
    void testIdempotent() {
        for (String query : QUERIES) {
            assertEquals(service.understand(query), service.understand(query));
        }
    }

    private static Set<String> lower(List<String> texts) {
        return texts.stream().map(text -> text.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }
}
