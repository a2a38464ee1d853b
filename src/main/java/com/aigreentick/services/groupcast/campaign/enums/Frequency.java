package com.aigreentick.services.groupcast.campaign.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Frequency {

    @JsonProperty("daily")
    DAILY,

    @JsonProperty("weekly")
    WEEKLY
}
