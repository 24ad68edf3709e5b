package com.truetickets.search.model;

import java.util.List;
import java.util.Optional;

/**
 * Immutable view of the search surface, published to subscribers after every committed change.
 */
public record SearchSnapshot(
    boolean open,
    long generation,
    String query,
    SessionState sessionState,
    SearchStatus status,
    ResultKind kind,
    List<CandidateResult> results,
    int highlightedIndex
) {

    public SearchSnapshot {
        results = List.copyOf(results);
    }

    public static SearchSnapshot closed(long generation) {
        return new SearchSnapshot(false, generation, "", SessionState.IDLE, SearchStatus.PROMPT,
            ResultKind.TICKET, List.of(), 0);
    }

    public String message() {
        return status.getMessage();
    }

    public boolean isLoading() {
        return status == SearchStatus.LOADING;
    }

    public Optional<CandidateResult> highlighted() {
        if (results.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(results.get(highlightedIndex));
    }

    public SearchSnapshot withHighlight(int index) {
        return new SearchSnapshot(open, generation, query, sessionState, status, kind, results, index);
    }
}
