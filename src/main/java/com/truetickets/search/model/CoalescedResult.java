package com.truetickets.search.model;

import java.util.List;

public record CoalescedResult(ResultKind kind, List<CandidateResult> results, SearchStatus status) {

    public CoalescedResult {
        results = List.copyOf(results);
    }

    public static CoalescedResult prompt() {
        return new CoalescedResult(ResultKind.TICKET, List.of(), SearchStatus.PROMPT);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
