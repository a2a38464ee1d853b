package com.aigreentick.services.groupcast.campaign.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignStats {

    public static final int MAX_EXECUTIONS = 10;

    private long totalSent;

    private long totalFailed;

    // oldest first, newest last
    @Builder.Default
    private List<ExecutionRecord> executions = new ArrayList<>();

    /**
     * Adds a run to the lifetime totals and the history, keeping only the latest {@value #MAX_EXECUTIONS}.
     */
    public void recordExecution(ExecutionRecord execution) {
        if (executions == null) {
            executions = new ArrayList<>();
        }
        totalSent += execution.getSent();
        totalFailed += execution.getFailed();
        executions.add(execution);
        while (executions.size() > MAX_EXECUTIONS) {
            executions.remove(0);
        }
    }
}
