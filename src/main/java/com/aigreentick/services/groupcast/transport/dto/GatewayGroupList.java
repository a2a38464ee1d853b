package com.aigreentick.services.groupcast.transport.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GatewayGroupList {

    private String selfId;

    private List<GatewayGroup> groups;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GatewayGroup {
        private String id;
        private String subject;
        private String desc;
        private Long creation; // epoch seconds
        private List<Participant> participants;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Participant {
        private String id;
        private String admin; // "admin" | "superadmin" | null
    }
}
