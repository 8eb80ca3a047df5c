package com.tripnav.service.extraction;

import com.tripnav.model.TaggedEntity;
import com.tripnav.model.TaggedEntity.EntityCategory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Named places among the tagged entities of a query, minus the start and end texts.
 */
@Component
public class GenericLocationExtractor {

    private static final Set<EntityCategory> LOCATION_CATEGORIES =
            EnumSet.of(EntityCategory.PLACE_NAME, EntityCategory.FACILITY);

    public List<String> extract(List<TaggedEntity> entities, String... exclude) {
        if (entities == null || entities.isEmpty()) {
            return List.of();
        }
        List<String> excluded = Stream.of(exclude)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        return entities.stream()
                .filter(entity -> LOCATION_CATEGORIES.contains(entity.getCategory()))
                .map(TaggedEntity::getText)
                .filter(location -> excluded.stream().noneMatch(location::equalsIgnoreCase))
                .collect(Collectors.toUnmodifiableList());
    }
}
