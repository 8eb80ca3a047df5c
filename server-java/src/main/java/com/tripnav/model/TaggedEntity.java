package com.tripnav.model;

import lombok.Value;

@Value
public class TaggedEntity {
    String text;
    EntityCategory category;

    public enum EntityCategory {
        PLACE_NAME,
        FACILITY,
        CALENDAR_TIME,
        OTHER
    }
}
