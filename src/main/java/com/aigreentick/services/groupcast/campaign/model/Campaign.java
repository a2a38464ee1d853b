package com.aigreentick.services.groupcast.campaign.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.aigreentick.services.groupcast.campaign.enums.CampaignStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {

    private String id;

    private String name;

    private String message;

    private String imagePath;

    // unique destination ids, in send order
    @Builder.Default
    private List<String> targetGroups = new ArrayList<>();

    private ScheduleDescriptor schedule;

    @Builder.Default
    private CampaignStatus status = CampaignStatus.ACTIVE;

    private Instant createdAt;

    private Instant updatedAt;

    @Builder.Default
    private CampaignStats stats = new CampaignStats();

    @JsonIgnore
    public boolean isActive() {
        return status == CampaignStatus.ACTIVE;
    }
}
