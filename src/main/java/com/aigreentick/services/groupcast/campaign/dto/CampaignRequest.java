package com.aigreentick.services.groupcast.campaign.dto;

import java.util.List;

import com.aigreentick.services.groupcast.campaign.model.ScheduleDescriptor;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Campaign fields as submitted by the operator. On update, null fields keep their stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignRequest {

    @NotBlank(message = "Campaign name is required")
    private String name;

    @NotBlank(message = "Message is required")
    private String message;

    private String imagePath;

    @NotEmpty(message = "Select at least one group")
    private List<String> targetGroups;

    @NotNull(message = "Schedule is required")
    private ScheduleDescriptor schedule;
}
