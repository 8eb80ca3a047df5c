package com.tripnav.controller;

import com.tripnav.model.Coordinate;
import com.tripnav.model.ExtractedQuery;
import com.tripnav.model.Intent;
import com.tripnav.model.ResolutionStatus;
import com.tripnav.model.ResolvedLocation;
import com.tripnav.model.TripResult;
import com.tripnav.service.MapsLinkBuilder;
import com.tripnav.service.QueryUnderstandingService;
import com.tripnav.service.TripAssemblerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Trip Controller Tests")
class TripControllerTest {

    private QueryUnderstandingService queryUnderstandingService;
    private TripAssemblerService tripAssemblerService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        queryUnderstandingService = mock(QueryUnderstandingService.class);
        tripAssemblerService = mock(TripAssemblerService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(
                new TripController(queryUnderstandingService, tripAssemblerService, new MapsLinkBuilder()))
                .build();
    }

    private static TripResult trip(String query) {
        Set<Intent> intents = new LinkedHashSet<>(List.of(Intent.BASIC_NAVIGATION, Intent.MULTI_STOP));
        return TripResult.builder()
                .query(query)
                .intents(intents)
                .start(ResolvedLocation.builder().text("Dallas").coordinate(Coordinate.of(32.75, -96.75))
                        .countryCode("US").status(ResolutionStatus.RESOLVED).build())
                .end(ResolvedLocation.builder().text("Austin").coordinate(Coordinate.of(30.25, -97.75))
                        .countryCode("US").status(ResolutionStatus.RESOLVED).build())
                .genericLocations(List.of())
                .waypoints(List.of())
                .distanceConstraints(List.of())
                .notices(List.of())
                .build();
    }

    @Test
    @DisplayName("POST /api/plan returns the assembled trip and a maps link")
    void testPlan() throws Exception {
        when(tripAssemblerService.assemble("from Dallas to Austin")).thenReturn(trip("from Dallas to Austin"));

        mockMvc.perform(post("/api/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"from Dallas to Austin\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.result.intents[0]").value("Basic Navigation"))
                .andExpect(jsonPath("$.result.start.status").value("RESOLVED"))
                .andExpect(jsonPath("$.result.end.text").value("Austin"))
                .andExpect(jsonPath("$.mapsLink").exists());
    }

    @Test
    @DisplayName("Blank query is a bad request")
    void testBlankQuery() throws Exception {
        mockMvc.perform(post("/api/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("No query provided"));

        verifyNoInteractions(tripAssemblerService);
    }

    @Test
    @DisplayName("Unexpected failure is a server error with the message")
    void testPlanFailure() throws Exception {
        when(tripAssemblerService.assemble(anyString())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"from A to B\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("boom"));
    }

    @Test
    @DisplayName("One failing query does not stop the batch")
    void testBatchIsolation() throws Exception {
        when(tripAssemblerService.assemble("first")).thenReturn(trip("first"));
        when(tripAssemblerService.assemble("broken")).thenThrow(new IllegalStateException("boom"));
        when(tripAssemblerService.assemble("third")).thenReturn(trip("third"));

        mockMvc.perform(post("/api/plan/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"queries\": [\"first\", \"broken\", \"third\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].success").value(true))
                .andExpect(jsonPath("$[1].success").value(false))
                .andExpect(jsonPath("$[1].error").value("boom"))
                .andExpect(jsonPath("$[2].success").value(true))
                .andExpect(jsonPath("$[2].result.query").value("third"));
    }

    @Test
    @DisplayName("Empty batch is a bad request")
    void testEmptyBatch() throws Exception {
        mockMvc.perform(post("/api/plan/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"queries\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /api/extract skips resolution")
    void testExtract() throws Exception {
        when(queryUnderstandingService.understand("rest stops every 300 miles")).thenReturn(ExtractedQuery.builder()
                .query("rest stops every 300 miles")
                .intents(Set.of(Intent.REST_STOP))
                .startLocation("current location")
                .startDefaulted(true)
                .waypoints(List.of())
                .genericLocations(List.of())
                .build());

        mockMvc.perform(post("/api/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"rest stops every 300 miles\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.extraction.startLocation").value("current location"))
                .andExpect(jsonPath("$.extraction.startDefaulted").value(true))
                .andExpect(jsonPath("$.extraction.endLocation").value(nullValue()));

        verifyNoInteractions(tripAssemblerService);
    }

    @Test
    @DisplayName("GET /api/health")
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }
}
