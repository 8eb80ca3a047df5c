package com.tripnav.service.tagger;

import com.tripnav.model.TaggedEntity;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Uses the remote tagger and drops back to the built-in rules when it fails.
 */
@Slf4j
public class FallbackEntityTagger implements EntityTagger {

    private final EntityTagger primary;
    private final EntityTagger fallback;

    public FallbackEntityTagger(EntityTagger primary, EntityTagger fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public List<TaggedEntity> tag(String text) {
        try {
            return primary.tag(text);
        } catch (RuntimeException e) {
            log.warn("Entity tagging failed, using pattern tagger: {}", e.getMessage());
            return fallback.tag(text);
        }
    }
}
