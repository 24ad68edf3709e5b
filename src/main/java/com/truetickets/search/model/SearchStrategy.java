package com.truetickets.search.model;

import java.util.List;

/**
 * The lookup plan chosen for a query.
 */
public sealed interface SearchStrategy {

    record NoQuery() implements SearchStrategy {}

    record PhoneLookup(String digits) implements SearchStrategy {}

    record ExactTicketLookup(String number) implements SearchStrategy {}

    /**
     * @param suffix           the three typed digits
     * @param candidateNumbers absolute ticket numbers to probe, newest first
     */
    record SuffixTicketLookup(String suffix, List<Long> candidateNumbers) implements SearchStrategy {

        public SuffixTicketLookup {
            candidateNumbers = List.copyOf(candidateNumbers);
        }

        public SuffixTicketLookup withCandidates(List<Long> candidates) {
            return new SuffixTicketLookup(suffix, candidates);
        }
    }

    record DualTextLookup(String text) implements SearchStrategy {}
}
