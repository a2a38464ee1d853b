package com.aigreentick.services.groupcast.campaign.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ScheduleType {

    @JsonProperty("now")
    IMMEDIATE,

    @JsonProperty("once")
    ONCE,

    @JsonProperty("recurring")
    RECURRING
}
