package com.tripnav.controller;

import com.tripnav.model.ExtractedQuery;
import com.tripnav.model.PlanRequest;
import com.tripnav.model.PlanResponse;
import com.tripnav.model.TripResult;
import com.tripnav.service.MapsLinkBuilder;
import com.tripnav.service.QueryUnderstandingService;
import com.tripnav.service.TripAssemblerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class TripController {

    private final QueryUnderstandingService queryUnderstandingService;
    private final TripAssemblerService tripAssemblerService;
    private final MapsLinkBuilder mapsLinkBuilder;

    /**
     * Run the full pipeline (extraction, resolution, route summary) for one request
     */
    @PostMapping("/plan")
    public ResponseEntity<PlanResponse> plan(@RequestBody PlanRequest request) {
        log.info("=== /api/plan called ===");

        String query = request.getQuery();
        if (query == null || query.isBlank()) {
            log.warn("No query provided");
            return ResponseEntity.badRequest().body(failure(query, "No query provided"));
        }

        try {
            return ResponseEntity.ok(planOne(query));
        } catch (Exception e) {
            log.error("Error planning trip for \"{}\"", query, e);
            return ResponseEntity.internalServerError().body(
                    failure(query, e.getMessage() != null ? e.getMessage() : "Failed to plan trip"));
        }
    }

    /**
     * Plan several requests; a failing request is reported in its own slot
     */
    @PostMapping("/plan/batch")
    public ResponseEntity<List<PlanResponse>> planBatch(@RequestBody PlanRequest request) {
        List<String> queries = request.getQueries();
        log.info("=== /api/plan/batch called with {} queries ===", queries != null ? queries.size() : 0);

        if (queries == null || queries.isEmpty()) {
            return ResponseEntity.badRequest().body(List.of(failure(null, "No queries provided")));
        }

        List<PlanResponse> responses = new ArrayList<>();
        for (String query : queries) {
            if (query == null || query.isBlank()) {
                responses.add(failure(query, "Empty query"));
                continue;
            }
            try {
                responses.add(planOne(query));
            } catch (Exception e) {
                log.error("Error planning trip for \"{}\", continuing with the batch", query, e);
                responses.add(failure(query,
                        e.getMessage() != null ? e.getMessage() : "Failed to plan trip"));
            }
        }
        return ResponseEntity.ok(responses);
    }

    /**
     * Extraction only, no place resolution
     */
    @PostMapping("/extract")
    public ResponseEntity<PlanResponse> extract(@RequestBody PlanRequest request) {
        String query = request.getQuery();
        if (query == null || query.isBlank()) {
            return ResponseEntity.badRequest().body(failure(query, "No query provided"));
        }

        try {
            ExtractedQuery extraction = queryUnderstandingService.understand(query);
            return ResponseEntity.ok(PlanResponse.builder()
                    .success(true)
                    .query(query)
                    .extraction(extraction)
                    .build());
        } catch (Exception e) {
            log.error("Error extracting \"{}\"", query, e);
            return ResponseEntity.internalServerError().body(
                    failure(query, e.getMessage() != null ? e.getMessage() : "Failed to extract query"));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    private PlanResponse planOne(String query) {
        TripResult result = tripAssemblerService.assemble(query);
        return PlanResponse.builder()
                .success(true)
                .query(query)
                .result(result)
                .mapsLink(mapsLinkBuilder.buildLink(result).orElse(null))
                .build();
    }

    private static PlanResponse failure(String query, String error) {
        return PlanResponse.builder()
                .success(false)
                .query(query)
                .error(error)
                .build();
    }
}
