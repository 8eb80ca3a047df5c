package com.tripnav.service.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Waypoint Extractor Tests")
class WaypointExtractorTest {

    private final WaypointExtractor extractor = new WaypointExtractor();

    @Test
    @DisplayName("stop at splits an and-delimited list")
    void testStopAt() {
        assertEquals(List.of("a walmart", "a coffee shop"), extractor.extract(
                "Plan a trip from Dallas to Austin with a stop at a Walmart and a coffee shop."));
    }

    @Test
    @DisplayName("night stay in splits commas and and")
    void testNightStay() {
        assertEquals(List.of("chicago", "denver"), extractor.extract(
                "Plan a long road trip from New York to Los Angeles with rest stops every 300 miles "
                        + "and a night stay in Chicago and Denver."));
        assertEquals(List.of("sonoma"), extractor.extract("Drive to Napa with a night stay at Sonoma."));
    }

    @Test
    @DisplayName("via captures a comma list")
    void testVia() {
        assertEquals(List.of("hartford", "worcester"), extractor.extract("Drive to Boston via Hartford, Worcester"));
    }

    @Test
    @DisplayName("and is only a separator as a whole word")
    void testAndWordBoundary() {
        assertEquals(List.of("portland", "salem"), extractor.extract("Make a stop at Portland and Salem"));
    }

    @Test
    @DisplayName("Results follow pattern order then match order")
    void testPatternOrder() {
        assertEquals(List.of("a bakery", "waco"), extractor.extract("Go via Waco. Stop at a bakery."));
    }

    @Test
    @DisplayName("quick stop at is also seen by stop at, duplicates are kept")
    void testQuickStopDuplicates() {
        assertEquals(List.of("a nearby atm", "a nearby atm"),
                extractor.extract("Find the shortest route home with a quick stop at a nearby ATM."));
    }

    @Test
    @DisplayName("No trigger means no waypoints")
    void testNoWaypoints() {
        assertTrue(extractor.extract("Navigate from Dallas to Austin").isEmpty());
        assertTrue(extractor.extract("").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }
}
