package com.aigreentick.services.groupcast.campaign.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CampaignStatus {

    @JsonProperty("active")
    ACTIVE,

    @JsonProperty("paused")
    PAUSED
}
