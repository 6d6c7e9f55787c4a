package com.example.campaign.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One audience criterion: subscribers whose {@code type} attribute matches any of {@code values}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentFilter {
    private String type;
    private List<String> values;
}
