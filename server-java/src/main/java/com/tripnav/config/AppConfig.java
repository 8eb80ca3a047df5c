package com.tripnav.config;

import com.google.maps.GeoApiContext;
import com.tripnav.service.tagger.EntityTagger;
import com.tripnav.service.tagger.FallbackEntityTagger;
import com.tripnav.service.tagger.PatternEntityTagger;
import com.tripnav.service.tagger.RemoteEntityTagger;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class AppConfig implements WebMvcConfigurer {

    @Value("${google.maps.api.key:}")
    private String googleMapsApiKey;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:5173", "http://localhost:3000")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true);
    }

    @Bean
    public GeoApiContext geoApiContext() {
        if (googleMapsApiKey == null || googleMapsApiKey.isBlank()) {
            log.warn("google.maps.api.key is not set; place lookups will fall back to defaults");
        }
        return new GeoApiContext.Builder()
                .apiKey(googleMapsApiKey)
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(10, TimeUnit.SECONDS)
                .build();
    }

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(10, TimeUnit.SECONDS)
                .build();
    }

    @Bean
    public EntityTagger entityTagger(
            OkHttpClient okHttpClient,
            @Value("${trip.tagger.mode:pattern}") String mode,
            @Value("${trip.tagger.url:}") String url) {
        PatternEntityTagger patternTagger = new PatternEntityTagger();
        if ("remote".equalsIgnoreCase(mode)) {
            if (url == null || url.isBlank()) {
                log.warn("trip.tagger.mode=remote but trip.tagger.url is empty, using pattern tagger");
                return patternTagger;
            }
            return new FallbackEntityTagger(new RemoteEntityTagger(okHttpClient, url), patternTagger);
        }
        return patternTagger;
    }

    @Bean(name = "resolverExecutor", destroyMethod = "shutdown")
    public ExecutorService resolverExecutor(@Value("${trip.resolver.threads:8}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "place-resolver-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
