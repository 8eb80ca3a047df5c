package com.tripnav.service.tagger;

import com.tripnav.model.TaggedEntity;

import java.util.List;

/**
 * Named-entity recognition over a single sentence.
 */
public interface EntityTagger {

    /**
     * @param text the raw sentence
     * @return typed spans in order of appearance, never {@code null}
     */
    List<TaggedEntity> tag(String text);
}
