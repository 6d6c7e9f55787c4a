package com.example.campaign.admin.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentResponse {
    private String id;
    private String name;
    private String description;
    /** True when the values come from the subscriber table rather than a fixed list. */
    private boolean dataDerived;
}
