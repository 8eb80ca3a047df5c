package com.tripnav.service;

import com.tripnav.model.DistanceConstraint;
import com.tripnav.model.ExtractedQuery;
import com.tripnav.model.Intent;
import com.tripnav.model.TaggedEntity;
import com.tripnav.model.TimeConstraints;
import com.tripnav.service.extraction.DistanceConstraintExtractor;
import com.tripnav.service.extraction.GenericLocationExtractor;
import com.tripnav.service.extraction.StartEndExtractor;
import com.tripnav.service.extraction.TimeConstraintExtractor;
import com.tripnav.service.extraction.WaypointExtractor;
import com.tripnav.service.tagger.EntityTagger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Runs every extractor over one query and normalizes the waypoints.
 * The query is tagged once and the entities are shared by the extractors that need them.
 * No place resolution happens here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryUnderstandingService {

    private final EntityTagger entityTagger;
    private final IntentClassifier intentClassifier;
    private final StartEndExtractor startEndExtractor;
    private final GenericLocationExtractor genericLocationExtractor;
    private final WaypointExtractor waypointExtractor;
    private final DistanceConstraintExtractor distanceConstraintExtractor;
    private final TimeConstraintExtractor timeConstraintExtractor;
    private final QueryNormalizer queryNormalizer;

    public ExtractedQuery understand(String query) {
        List<TaggedEntity> entities = query == null || query.isBlank() ? List.of() : entityTagger.tag(query);
        StartEndExtractor.Endpoints endpoints = startEndExtractor.extract(query);
        List<String> genericLocations = genericLocationExtractor.extract(
                entities, endpoints.getStart(), endpoints.getEnd());
        List<String> rawWaypoints = waypointExtractor.extract(query);
        List<DistanceConstraint> distanceConstraints = distanceConstraintExtractor.extract(query);
        TimeConstraints timeConstraints = timeConstraintExtractor.extract(query, entities);
        Set<Intent> intents = intentClassifier.classify(query);

        List<String> waypoints = queryNormalizer.uniqueWaypoints(
                rawWaypoints, genericLocations, endpoints.getStart(), endpoints.getEnd());

        log.info("Extracted start=\"{}\" end=\"{}\" waypoints={} intents={}",
                endpoints.getStart(), endpoints.getEnd(), waypoints, intents);

        return ExtractedQuery.builder()
                .query(query)
                .intents(intents)
                .startLocation(endpoints.getStart())
                .startDefaulted(endpoints.isStartDefaulted())
                .endLocation(endpoints.getEnd())
                .genericLocations(genericLocations)
                .waypoints(waypoints)
                .distanceConstraints(List.copyOf(distanceConstraints))
                .timeConstraints(timeConstraints)
                .build();
    }
}
