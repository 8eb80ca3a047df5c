package com.tripnav.runner;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.tripnav.model.Intent;
import com.tripnav.model.TripResult;
import com.tripnav.service.TripAssemblerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints the structured output of a fixed set of sample requests at startup.
 */
@Component
@ConditionalOnProperty(name = "trip.samples.enabled", havingValue = "true")
@Slf4j
public class SampleQueryRunner implements CommandLineRunner {

    static final List<String> SAMPLE_QUERIES = List.of(
            "Plan a trip from Dallas to Austin with a stop at a Walmart and a coffee shop.",
            "Navigate from New York to Philadelphia and avoid highways, stop at a gas station and pharmacy.",
            "Drive from San Francisco to Napa Valley with scenic views and a night stay in Sonoma.",
            "Plan a long road trip from New York to Los Angeles with rest stops every 300 miles and a night stay in Chicago and Denver.",
            "Find the shortest route from my house to the airport with a quick stop at a nearby ATM.",
            "Show me a scenic drive from San Francisco to Yosemite National Park with a stop at a famous viewpoint.",
            "Navigate from Dallas to Austin avoiding tolls and highways, prefer fuel-efficient route with EV charging every 150 miles.",
            "I need to urgently reach a hospital from my office due to heavy snow and avoid traffic.",
            "Plan a trip from Seattle to Portland, include scenic views, parking availability near downtown, and rest stops every 100 miles."
    );

    private final TripAssemblerService tripAssemblerService;
    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .registerTypeAdapter(Intent.class,
                    (JsonSerializer<Intent>) (intent, type, context) -> new JsonPrimitive(intent.getLabel()))
            .create();
    private final PrintStream out;

    @Autowired
    public SampleQueryRunner(TripAssemblerService tripAssemblerService) {
        this(tripAssemblerService, System.out);
    }

    SampleQueryRunner(TripAssemblerService tripAssemblerService, PrintStream out) {
        this.tripAssemblerService = tripAssemblerService;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        List<String> queries = args.length > 0 ? List.of(args) : SAMPLE_QUERIES;
        log.info("Running {} sample queries", queries.size());

        for (String query : queries) {
            out.println();
            out.println("Query: " + query);
            try {
                TripResult result = tripAssemblerService.assemble(query);
                out.println("Structured Output: " + gson.toJson(result));
            } catch (RuntimeException e) {
                log.error("Sample query failed: \"{}\"", query, e);
                out.println("Structured Output: <failed: " + e.getMessage() + ">");
            }
        }
    }
}
