package com.truetickets.search.service;

import com.truetickets.search.config.SearchProperties;
import com.truetickets.search.controller.UnifiedSearchResponse;
import com.truetickets.search.exception.WrongQueryException;
import com.truetickets.search.infra.CancellationToken;
import com.truetickets.search.model.CoalescedResult;
import com.truetickets.search.model.LookupOutcome;
import com.truetickets.search.model.Query;
import com.truetickets.search.model.SearchStrategy;
import com.truetickets.search.repository.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchServiceImpl implements SearchService {

    private final QueryClassifier classifier;
    private final SuffixResolver suffixResolver;
    private final LookupDispatcher dispatcher;
    private final ResultCoalescer coalescer;
    private final TicketRepository ticketRepository;
    private final SearchProperties properties;

    @Override
    public UnifiedSearchResponse resolve(String rawQuery) {
        validateQuery(rawQuery);

        Query query = Query.of(rawQuery);
        SearchStrategy strategy = classifier.classify(query);
        if (strategy instanceof SearchStrategy.SuffixTicketLookup suffix) {
            strategy = suffixResolver.resolve(suffix, ticketRepository.findLatestTicketNumber());
        }
        log.debug("Resolving '{}' with {}", query.trimmed(), strategy);

        LookupOutcome outcome = dispatcher.dispatch(strategy, CancellationToken.none()).join();
        CoalescedResult result = coalescer.coalesce(strategy, outcome);
        return UnifiedSearchResponse.from(result);
    }

    private void validateQuery(String query) {
        if (query == null) {
            throw new WrongQueryException("Query is required");
        }
        if (query.length() > properties.maxQueryLength()) {
            throw new WrongQueryException("Query too long");
        }
    }
}
