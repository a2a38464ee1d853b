package com.aigreentick.services.groupcast.campaign.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.aigreentick.services.groupcast.campaign.dto.CampaignRequest;
import com.aigreentick.services.groupcast.campaign.dto.StatusChangeRequest;
import com.aigreentick.services.groupcast.campaign.model.Campaign;
import com.aigreentick.services.groupcast.campaign.service.CampaignService;
import com.aigreentick.services.groupcast.common.dto.ResponseMessage;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/campaigns")
@RequiredArgsConstructor
public class CampaignController {

    private final CampaignService campaignService;

    @GetMapping
    public ResponseEntity<List<Campaign>> listCampaigns() {
        return ResponseEntity.ok(campaignService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Campaign> getCampaign(@PathVariable String id) {
        return ResponseEntity.ok(campaignService.get(id));
    }

    @PostMapping
    public ResponseEntity<ResponseMessage<Campaign>> createCampaign(@Valid @RequestBody CampaignRequest request) {
        log.info("Received campaign create request: name={} groups={}",
                request.getName(), request.getTargetGroups().size());
        Campaign campaign = campaignService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ResponseMessage.success("Campaign created", campaign));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ResponseMessage<Campaign>> updateCampaign(
            @PathVariable String id,
            @RequestBody CampaignRequest request) {
        return ResponseEntity.ok(ResponseMessage.success("Campaign updated", campaignService.update(id, request)));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<ResponseMessage<Campaign>> changeStatus(
            @PathVariable String id,
            @Valid @RequestBody StatusChangeRequest request) {
        Campaign campaign = campaignService.setStatus(id, request.getStatus());
        return ResponseEntity.ok(ResponseMessage.success("Campaign status updated", campaign));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ResponseMessage<Void>> deleteCampaign(@PathVariable String id) {
        campaignService.delete(id);
        return ResponseEntity.ok(ResponseMessage.success("Campaign deleted", null));
    }
}
