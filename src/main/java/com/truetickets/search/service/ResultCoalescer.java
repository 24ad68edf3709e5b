package com.truetickets.search.service;

import com.truetickets.search.model.CandidateResult;
import com.truetickets.search.model.CoalescedResult;
import com.truetickets.search.model.LookupOutcome;
import com.truetickets.search.model.ResultKind;
import com.truetickets.search.model.SearchStatus;
import com.truetickets.search.model.SearchStrategy;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Chooses the one homogeneous result list to show for a resolved lookup. In a text search
 * customers win over tickets whenever at least one customer matched.
 */
@Component
public class ResultCoalescer {

    public CoalescedResult coalesce(SearchStrategy strategy, LookupOutcome outcome) {
        if (strategy instanceof SearchStrategy.NoQuery) {
            return CoalescedResult.prompt();
        }

        ResultKind kind;
        List<CandidateResult> results;
        if (strategy instanceof SearchStrategy.PhoneLookup) {
            kind = ResultKind.CUSTOMER;
            results = List.copyOf(outcome.customers());
        } else if (strategy instanceof SearchStrategy.DualTextLookup && !outcome.customers().isEmpty()) {
            kind = ResultKind.CUSTOMER;
            results = List.copyOf(outcome.customers());
        } else {
            kind = ResultKind.TICKET;
            results = List.copyOf(outcome.tickets());
        }

        SearchStatus status = results.isEmpty() ? SearchStatus.NO_RESULTS : SearchStatus.POPULATED;
        return new CoalescedResult(kind, results, status);
    }
}
