package com.aigreentick.services.groupcast.group.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A destination group as last seen on the network.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Group {

    private String id;

    private String name;

    private int participantsCount;

    @JsonProperty("isAdmin")
    private boolean admin;

    private String description;

    private Instant createdAt;
}
