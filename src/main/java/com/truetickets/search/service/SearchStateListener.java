package com.truetickets.search.service;

import com.truetickets.search.model.SearchSnapshot;

@FunctionalInterface
public interface SearchStateListener {
    void onChange(SearchSnapshot snapshot);
}
