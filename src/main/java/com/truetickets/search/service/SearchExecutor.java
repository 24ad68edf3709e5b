package com.truetickets.search.service;

import com.truetickets.search.infra.SearchScheduler;
import com.truetickets.search.model.LookupOutcome;
import com.truetickets.search.model.Query;
import com.truetickets.search.model.SearchSession;
import com.truetickets.search.model.SearchStrategy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the lookups of the newest query and nothing else.
 *
 * <p>Every query gets the next generation number. A completion is committed only while its
 * generation is still the current one; completions of older generations are dropped no matter
 * in which order they arrive. Superseded sessions also get their cancellation token fired so
 * lookups that have not started yet are skipped.
 *
 * <p>Not thread-safe: every method must be called on the search loop, and completions are
 * posted back to it.
 */
@Slf4j
public class SearchExecutor {

    /**
     * Receives the lifecycle of the current session. Called on the search loop.
     */
    public interface Listener {

        void onIdle(long generation);

        void onDebouncing(SearchSession session);

        void onDispatched(SearchSession session);

        void onResolved(SearchSession session, LookupOutcome outcome);
    }

    private final QueryClassifier classifier;
    private final SuffixResolver suffixResolver;
    private final LookupDispatcher dispatcher;
    private final SearchScheduler scheduler;
    private final Duration debounce;
    private final Listener listener;

    private long currentGeneration;
    private SearchSession session;
    private SearchScheduler.ScheduledTask pendingDispatch;
    private OptionalLong latestTicketNumber = OptionalLong.empty();

    public SearchExecutor(
        QueryClassifier classifier,
        SuffixResolver suffixResolver,
        LookupDispatcher dispatcher,
        SearchScheduler scheduler,
        Duration debounce,
        Listener listener
    ) {
        this.classifier = classifier;
        this.suffixResolver = suffixResolver;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.debounce = debounce;
        this.listener = listener;
    }

    public void submit(Query query) {
        if (isUnchanged(query)) {
            log.debug("Query '{}' unchanged, keeping generation {}", query.trimmed(), currentGeneration);
            return;
        }

        long generation = supersedeCurrent();

        if (query.isEmpty()) {
            session = null;
            listener.onIdle(generation);
            return;
        }

        SearchSession next = new SearchSession(query, generation);
        session = next;
        listener.onDebouncing(next);
        pendingDispatch = scheduler.schedule(() -> dispatch(next), debounce);
    }

    /**
     * Abandons the current session, if any. Its lookups may still complete but will be ignored.
     */
    public long abort() {
        cancelPendingDispatch();
        if (session != null) {
            log.debug("Aborting generation {}", session.getGeneration());
            session.abort();
            session = null;
        }
        return ++currentGeneration;
    }

    public void updateLatestTicketNumber(OptionalLong latest) {
        this.latestTicketNumber = latest;
    }

    public OptionalLong getLatestTicketNumber() {
        return latestTicketNumber;
    }

    public long getCurrentGeneration() {
        return currentGeneration;
    }

    private boolean isUnchanged(Query query) {
        if (session == null) {
            return query.isEmpty();
        }
        return session.getQuery().trimmed().equals(query.trimmed());
    }

    private long supersedeCurrent() {
        cancelPendingDispatch();
        if (session != null) {
            session.supersede();
        }
        return ++currentGeneration;
    }

    private void cancelPendingDispatch() {
        if (pendingDispatch != null) {
            pendingDispatch.cancel();
            pendingDispatch = null;
        }
    }

    private void dispatch(SearchSession dispatched) {
        if (!isCurrent(dispatched)) {
            return;
        }
        pendingDispatch = null;

        SearchStrategy strategy = plan(dispatched);
        dispatched.dispatched(strategy);
        log.debug("Generation {} dispatching {}", dispatched.getGeneration(), strategy);
        listener.onDispatched(dispatched);

        CompletableFuture<LookupOutcome> lookups;
        try {
            lookups = dispatcher.dispatch(strategy, dispatched.getCancellationToken());
        } catch (RuntimeException e) {
            log.warn("Dispatch of generation {} failed", dispatched.getGeneration(), e);
            lookups = CompletableFuture.completedFuture(LookupOutcome.empty());
        }

        lookups.whenComplete((outcome, error) -> {
            if (error != null) {
                log.warn("Lookups of generation {} failed", dispatched.getGeneration(), error);
            }
            LookupOutcome committed = error == null ? outcome : LookupOutcome.empty();
            scheduler.execute(() -> complete(dispatched, committed));
        });
    }

    private SearchStrategy plan(SearchSession planned) {
        SearchStrategy strategy = classifier.classify(planned.getQuery());
        if (strategy instanceof SearchStrategy.SuffixTicketLookup suffix) {
            return suffixResolver.resolve(suffix, latestTicketNumber);
        }
        return strategy;
    }

    private void complete(SearchSession completed, LookupOutcome outcome) {
        if (!isCurrent(completed)) {
            log.debug("Dropping results of generation {}, current is {}",
                completed.getGeneration(), currentGeneration);
            return;
        }
        completed.resolve();
        listener.onResolved(completed, outcome);
    }

    private boolean isCurrent(SearchSession candidate) {
        return candidate == session && candidate.getGeneration() == currentGeneration && candidate.isLive();
    }
}
