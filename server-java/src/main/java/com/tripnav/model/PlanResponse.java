package com.tripnav.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanResponse {
    private boolean success;
    private String query;
    private TripResult result;
    private ExtractedQuery extraction;
    private String mapsLink;
    private String error;
}
