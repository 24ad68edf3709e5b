package com.truetickets.search.controller;

import com.truetickets.search.model.CoalescedResult;
import com.truetickets.search.model.ResultKind;
import com.truetickets.search.model.SearchStatus;

import java.util.List;

public record UnifiedSearchResponse(
    ResultKind kind,
    SearchStatus status,
    String message,
    List<SearchResultItem> results
) {
    public static UnifiedSearchResponse from(CoalescedResult result) {
        return new UnifiedSearchResponse(
            result.kind(),
            result.status(),
            result.status().getMessage(),
            result.results().stream().map(SearchResultItem::from).toList()
        );
    }
}
