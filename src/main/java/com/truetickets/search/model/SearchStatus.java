package com.truetickets.search.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SearchStatus {
    PROMPT("Enter a search query"),
    LOADING("Searching..."),
    NO_RESULTS("No results found"),
    POPULATED("");

    private final String message;
}
