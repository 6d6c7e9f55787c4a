package com.example.campaign.admin.dto;

import com.example.campaign.shared.dto.CorrelatedRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Campaign form submission. Title and body may be incomplete on a draft; they are checked on publish.
 * {@code action} is "save" to publish or "draft" to keep editing later.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignRequest implements CorrelatedRequest {

    private String correlationId;

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    @Size(max = 65, message = "Title must be at most 65 characters")
    private String title;

    @Size(max = 180, message = "Body must be at most 180 characters")
    private String body;

    private String url;
    private String image;
    private String icon;
    private String badge;

    private boolean requireInteraction;
    private boolean renotify;
    private boolean silent;

    @Valid
    @Builder.Default
    private List<SegmentFilterRequest> segments = new ArrayList<>();

    private OffsetDateTime sendAt;

    @Builder.Default
    private String action = "save";
}
