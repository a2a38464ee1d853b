package com.aigreentick.services.groupcast.transport.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class GatewaySendResponse {
    private String id;
    private String status;
}
