package com.example.campaign.admin.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One segment row of the campaign form. The audience preview posts the same shape
 * with {@code segmentId} instead of {@code type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentFilterRequest {

    @NotBlank(message = "Segment type is required")
    @JsonAlias("segmentId")
    private String type;

    private String segmentName;

    private List<String> values;
}
