package com.truetickets.search.service;

import com.truetickets.search.exception.EntityNotFoundException;
import com.truetickets.search.infra.CancellationToken;
import com.truetickets.search.model.LookupOutcome;
import com.truetickets.search.model.SearchStrategy;
import com.truetickets.search.model.TicketMatch;
import com.truetickets.search.repository.CustomerRepository;
import com.truetickets.search.repository.TicketRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Issues the lookups a strategy calls for, concurrently where it calls for more than one.
 * The returned future never completes exceptionally: every failed probe contributes an empty list.
 */
@Slf4j
@Component
public class LookupDispatcher {

    private final TicketRepository ticketRepository;
    private final CustomerRepository customerRepository;
    private final Executor lookupTaskExecutor;

    public LookupDispatcher(
        TicketRepository ticketRepository,
        CustomerRepository customerRepository,
        @Qualifier("lookupTaskExecutor") Executor lookupTaskExecutor
    ) {
        this.ticketRepository = ticketRepository;
        this.customerRepository = customerRepository;
        this.lookupTaskExecutor = lookupTaskExecutor;
    }

    public CompletableFuture<LookupOutcome> dispatch(SearchStrategy strategy, CancellationToken token) {
        if (strategy instanceof SearchStrategy.PhoneLookup phone) {
            return probe("customers by phone " + phone.digits(),
                () -> customerRepository.autocomplete(phone.digits(), token))
                .thenApply(LookupOutcome::ofCustomers);
        }
        if (strategy instanceof SearchStrategy.ExactTicketLookup exact) {
            return probe("ticket " + exact.number(),
                () -> ticketRepository.findByNumber(exact.number(), token))
                .thenApply(LookupOutcome::ofTickets);
        }
        if (strategy instanceof SearchStrategy.SuffixTicketLookup suffix) {
            return dispatchSuffix(suffix, token);
        }
        if (strategy instanceof SearchStrategy.DualTextLookup dual) {
            var customers = probe("customers matching '" + dual.text() + "'",
                () -> customerRepository.autocomplete(dual.text(), token));
            var tickets = probe("tickets matching '" + dual.text() + "'",
                () -> ticketRepository.search(dual.text(), token));
            return customers.thenCombine(tickets, LookupOutcome::new);
        }
        return CompletableFuture.completedFuture(LookupOutcome.empty());
    }

    private CompletableFuture<LookupOutcome> dispatchSuffix(SearchStrategy.SuffixTicketLookup suffix,
                                                           CancellationToken token) {
        List<CompletableFuture<Optional<TicketMatch>>> probes = suffix.candidateNumbers().stream()
            .map(number -> probe("ticket " + number,
                () -> ticketRepository.findByNumber(String.valueOf(number), token))
                .thenApply(tickets -> tickets.stream().findFirst()))
            .toList();

        return CompletableFuture.allOf(probes.toArray(CompletableFuture[]::new))
            .thenApply(done -> {
                Map<Long, TicketMatch> found = new LinkedHashMap<>();
                probes.forEach(probe -> probe.join()
                    .ifPresent(ticket -> found.putIfAbsent(ticket.number(), ticket)));
                return LookupOutcome.ofTickets(List.copyOf(found.values()));
            });
    }

    private <T> CompletableFuture<List<T>> probe(String description, Supplier<List<T>> lookup) {
        CompletableFuture<List<T>> future;
        try {
            future = CompletableFuture.supplyAsync(lookup, lookupTaskExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Lookup of {} rejected: {}", description, e.getMessage());
            return CompletableFuture.completedFuture(List.of());
        }
        return future.exceptionally(error -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
            if (cause instanceof EntityNotFoundException) {
                log.debug("No {}", description);
            } else if (cause instanceof CancellationException) {
                log.debug("Lookup of {} cancelled", description);
            } else {
                log.warn("Lookup of {} failed, treating as no results", description, cause);
            }
            return List.of();
        });
    }
}
