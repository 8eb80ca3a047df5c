package com.tripnav.model;

import lombok.Builder;
import lombok.Value;

/**
 * Raw nearby-search hit, before the open filter and dedup are applied.
 */
@Value
@Builder
public class PlaceCandidate {
    String title;
    String address;
    Coordinate coordinate;
    boolean open;

    public Place toPlace() {
        return Place.builder()
                .title(title)
                .address(address)
                .coordinate(coordinate)
                .build();
    }
}
