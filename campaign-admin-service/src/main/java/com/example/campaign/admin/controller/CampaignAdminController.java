package com.example.campaign.admin.controller;

import com.example.campaign.admin.dto.CampaignRequest;
import com.example.campaign.admin.dto.CampaignResponse;
import com.example.campaign.admin.dto.CampaignStatsResponse;
import com.example.campaign.admin.service.CampaignLifecycleService;
import com.example.campaign.admin.service.CampaignQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

@RestController
@RequestMapping("/api/admin/campaigns")
@RequiredArgsConstructor
@Slf4j
public class CampaignAdminController {

    private final CampaignLifecycleService campaignLifecycleService;
    private final CampaignQueryService campaignQueryService;
    private final Scheduler jdbcScheduler;

    @PostMapping
    public Mono<ResponseEntity<CampaignResponse>> createCampaign(@Valid @RequestBody CampaignRequest request) {
        log.info("Received campaign '{}' with action {}", request.getName(), request.getAction());
        return Mono.fromCallable(() -> campaignLifecycleService.createCampaign(request))
                .subscribeOn(jdbcScheduler)
                .map(response -> {
                    log.info("Campaign {} created in status {}", response.getId(), response.getStatus());
                    return ResponseEntity.status(HttpStatus.CREATED).body(response);
                });
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<CampaignResponse>> updateCampaign(@PathVariable Long id,
                                                                 @Valid @RequestBody CampaignRequest request) {
        log.info("Updating campaign {} with action {}", id, request.getAction());
        return Mono.fromCallable(() -> campaignLifecycleService.updateCampaign(id, request))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/publish")
    public Mono<ResponseEntity<CampaignResponse>> publishCampaign(@PathVariable Long id) {
        log.info("Publishing campaign {}", id);
        return Mono.fromCallable(() -> campaignLifecycleService.publishCampaign(id))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/cancel")
    public Mono<ResponseEntity<CampaignResponse>> cancelCampaign(@PathVariable Long id) {
        log.info("Cancelling campaign {}", id);
        return Mono.fromCallable(() -> campaignLifecycleService.cancelCampaign(id))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<CampaignResponse>> getCampaign(@PathVariable Long id) {
        return Mono.fromCallable(() -> campaignQueryService.getCampaign(id))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @GetMapping
    public Mono<ResponseEntity<List<CampaignResponse>>> listCampaigns(@RequestParam(required = false) String status) {
        return Mono.fromCallable(() -> campaignQueryService.listCampaigns(status))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}/stats")
    public Mono<ResponseEntity<CampaignStatsResponse>> getCampaignStats(@PathVariable Long id) {
        return Mono.fromCallable(() -> campaignQueryService.getStats(id))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }
}
