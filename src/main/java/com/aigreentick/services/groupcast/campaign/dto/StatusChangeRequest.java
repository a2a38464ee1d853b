package com.aigreentick.services.groupcast.campaign.dto;

import com.aigreentick.services.groupcast.campaign.enums.CampaignStatus;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeRequest {

    @NotNull(message = "Status is required")
    private CampaignStatus status;
}
