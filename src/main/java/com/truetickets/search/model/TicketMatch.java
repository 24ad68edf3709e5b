package com.truetickets.search.model;

import java.time.Instant;
import java.util.Map;

public record TicketMatch(
    long number,
    String subject,
    String status,
    String device,
    String customerName,
    Instant createdAt
) implements CandidateResult {

    private static final Map<String, String> STATUS_LABELS = Map.of(
        "New", "Diagnosing",
        "Scheduled", "Finding Price",
        "Call Customer", "Approval Needed",
        "Waiting for Parts", "Waiting for Parts",
        "Waiting on Customer", "Waiting (Other)",
        "In Progress", "In Progress",
        "Customer Reply", "Ready",
        "Ready!", "Ready",
        "Resolved", "Resolved"
    );

    @Override
    public ResultKind kind() {
        return ResultKind.TICKET;
    }

    @Override
    public String path() {
        return "/&" + number;
    }

    /**
     * Status as shown to operators; unknown backend statuses pass through unchanged.
     */
    public String displayStatus() {
        if (status == null) {
            return "";
        }
        return STATUS_LABELS.getOrDefault(status, status);
    }
}
