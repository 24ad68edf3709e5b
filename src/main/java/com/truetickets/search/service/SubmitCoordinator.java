package com.truetickets.search.service;

import com.truetickets.search.model.CandidateResult;
import com.truetickets.search.model.CoalescedResult;
import com.truetickets.search.model.SearchSnapshot;
import lombok.extern.slf4j.Slf4j;

/**
 * Enter-key handling. Enter on a populated list opens the first result right away; Enter while
 * a search is still loading is remembered and honoured once, when that search resolves.
 */
@Slf4j
public class SubmitCoordinator {

    private final NavigationCallback navigation;
    private final Runnable dismiss;

    private boolean pendingSubmit;

    /**
     * @param navigation receives the path of the chosen entity
     * @param dismiss    closes the search surface; runs after navigation
     */
    public SubmitCoordinator(NavigationCallback navigation, Runnable dismiss) {
        this.navigation = navigation;
        this.dismiss = dismiss;
    }

    public void onSubmit(SearchSnapshot snapshot) {
        if (snapshot.isLoading()) {
            log.debug("Submit while generation {} is loading, deferring", snapshot.generation());
            pendingSubmit = true;
            return;
        }
        snapshot.results().stream().findFirst().ifPresent(this::navigateTo);
    }

    public void onResolved(CoalescedResult result) {
        if (!pendingSubmit) {
            return;
        }
        pendingSubmit = false;
        result.results().stream().findFirst().ifPresent(this::navigateTo);
    }

    public void navigateTo(CandidateResult result) {
        log.info("Opening {} {}", result.kind(), result.path());
        navigation.goTo(result.path());
        dismiss.run();
    }

    public void reset() {
        pendingSubmit = false;
    }

    public boolean isPending() {
        return pendingSubmit;
    }
}
