package com.example.campaign.admin.controller;

import com.example.campaign.admin.dto.AudienceCountResponse;
import com.example.campaign.admin.dto.SegmentFilterRequest;
import com.example.campaign.admin.dto.SegmentResponse;
import com.example.campaign.admin.service.SegmentService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Set;

@RestController
@RequiredArgsConstructor
@Slf4j
public class SegmentController {

    private final SegmentService segmentService;
    private final Scheduler jdbcScheduler;

    @GetMapping("/api/campaign/segments")
    public Mono<ResponseEntity<List<SegmentResponse>>> listSegments() {
        return Mono.fromCallable(segmentService::listDimensions)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/api/segments/values/{dimensionId}")
    public Mono<ResponseEntity<Set<String>>> listValues(@PathVariable String dimensionId) {
        log.debug("Listing values for segment dimension {}", dimensionId);
        return Mono.fromCallable(() -> segmentService.listValues(dimensionId))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/api/segments")
    @RateLimiter(name = "audienceCountLimiter")
    public Mono<ResponseEntity<AudienceCountResponse>> countAudience(@RequestBody List<SegmentFilterRequest> filters) {
        return Mono.fromCallable(() -> segmentService.countAudience(filters))
                .subscribeOn(jdbcScheduler)
                .map(count -> ResponseEntity.ok(new AudienceCountResponse(count)));
    }
}
