package com.truetickets.search.model;

/**
 * A single row of the search result list.
 */
public sealed interface CandidateResult permits CustomerMatch, TicketMatch {

    ResultKind kind();

    /**
     * Navigation target of this entity inside the host application.
     */
    String path();
}
