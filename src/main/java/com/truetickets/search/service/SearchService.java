package com.truetickets.search.service;

import com.truetickets.search.controller.UnifiedSearchResponse;

public interface SearchService {

    /**
     * Classifies and resolves one query immediately, without debounce or session state.
     */
    UnifiedSearchResponse resolve(String query);

}
