package com.truetickets.search.service;

import com.truetickets.search.infra.SearchScheduler;
import com.truetickets.search.model.CandidateResult;
import com.truetickets.search.model.CoalescedResult;
import com.truetickets.search.model.LookupOutcome;
import com.truetickets.search.model.Query;
import com.truetickets.search.model.SearchSession;
import com.truetickets.search.model.SearchSnapshot;
import com.truetickets.search.model.SearchStatus;
import com.truetickets.search.model.SessionState;
import com.truetickets.search.repository.TicketRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * The search surface: operator input in, snapshots and navigation out.
 *
 * <p>Public methods may be called from any thread; they are queued onto the search loop, which
 * owns all state. Subscribers are notified on the loop, in order, once per committed change.
 */
@Slf4j
public class EntitySearchResolver implements SearchExecutor.Listener {

    static final String NEW_CUSTOMER_PATH = "/newcustomer";

    private final SearchScheduler scheduler;
    private final ResultCoalescer coalescer;
    private final TicketRepository ticketRepository;
    private final Executor lookupTaskExecutor;
    private final NavigationCallback navigation;
    private final CloseSignal closeSignal;
    private final SearchExecutor executor;
    private final SubmitCoordinator submitCoordinator;

    private final List<SearchStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile SearchSnapshot snapshot = SearchSnapshot.closed(0);

    private boolean open;
    private long openPeriod;
    private String rawQuery = "";

    public EntitySearchResolver(
        QueryClassifier classifier,
        SuffixResolver suffixResolver,
        LookupDispatcher dispatcher,
        ResultCoalescer coalescer,
        TicketRepository ticketRepository,
        Executor lookupTaskExecutor,
        SearchScheduler scheduler,
        Duration debounce,
        NavigationCallback navigation,
        CloseSignal closeSignal
    ) {
        this.scheduler = scheduler;
        this.coalescer = coalescer;
        this.ticketRepository = ticketRepository;
        this.lookupTaskExecutor = lookupTaskExecutor;
        this.navigation = navigation;
        this.closeSignal = closeSignal;
        this.executor = new SearchExecutor(classifier, suffixResolver, dispatcher, scheduler, debounce, this);
        this.submitCoordinator = new SubmitCoordinator(navigation, this::dismiss);
    }

    public void open() {
        scheduler.execute(() -> {
            if (open) {
                return;
            }
            open = true;
            rawQuery = "";
            long period = ++openPeriod;
            log.info("Search opened");
            publish(new SearchSnapshot(true, executor.getCurrentGeneration(), "", SessionState.IDLE,
                SearchStatus.PROMPT, snapshot.kind(), List.of(), 0));
            fetchLatestTicketNumber(period);
        });
    }

    public void close() {
        scheduler.execute(this::closeSurface);
    }

    /**
     * Operator dismissed the surface: close it and tell the host.
     */
    public void cancel() {
        scheduler.execute(() -> {
            if (open) {
                dismiss();
            }
        });
    }

    public void updateQuery(String raw) {
        scheduler.execute(() -> {
            if (!open) {
                log.debug("Ignoring input while search is closed");
                return;
            }
            rawQuery = raw == null ? "" : raw;
            executor.submit(Query.of(rawQuery));
        });
    }

    public void submit() {
        scheduler.execute(() -> {
            if (open) {
                submitCoordinator.onSubmit(snapshot);
            }
        });
    }

    public void moveHighlight(int delta) {
        scheduler.execute(() -> {
            SearchSnapshot current = snapshot;
            if (!open || current.results().isEmpty()) {
                return;
            }
            int last = current.results().size() - 1;
            int index = Math.max(0, Math.min(last, current.highlightedIndex() + delta));
            if (index != current.highlightedIndex()) {
                publish(current.withHighlight(index));
            }
        });
    }

    public void openHighlighted() {
        scheduler.execute(() -> {
            if (open) {
                snapshot.highlighted().ifPresent(submitCoordinator::navigateTo);
            }
        });
    }

    public void select(int index) {
        scheduler.execute(() -> {
            List<CandidateResult> results = snapshot.results();
            if (!open || index < 0 || index >= results.size()) {
                log.debug("Ignoring selection of row {} out of {}", index, results.size());
                return;
            }
            submitCoordinator.navigateTo(results.get(index));
        });
    }

    /**
     * Leaves search for the new-customer form, prefilled from whatever was typed.
     */
    public void startNewCustomer() {
        scheduler.execute(() -> {
            if (!open) {
                return;
            }
            String path = newCustomerPath(rawQuery);
            navigation.goTo(path);
            dismiss();
        });
    }

    public Subscription subscribe(SearchStateListener listener) {
        scheduler.execute(() -> {
            listeners.add(listener);
            listener.onChange(snapshot);
        });
        return () -> listeners.remove(listener);
    }

    public SearchSnapshot snapshot() {
        return snapshot;
    }

    @Override
    public void onIdle(long generation) {
        submitCoordinator.reset();
        publish(new SearchSnapshot(true, generation, rawQuery, SessionState.IDLE, SearchStatus.PROMPT,
            snapshot.kind(), List.of(), 0));
    }

    @Override
    public void onDebouncing(SearchSession session) {
        publish(loading(session));
    }

    @Override
    public void onDispatched(SearchSession session) {
        publish(loading(session));
    }

    @Override
    public void onResolved(SearchSession session, LookupOutcome outcome) {
        CoalescedResult result = coalescer.coalesce(session.getStrategy(), outcome);
        log.debug("Generation {} resolved with {} {} results", session.getGeneration(),
            result.results().size(), result.kind());
        publish(new SearchSnapshot(true, session.getGeneration(), rawQuery, session.getState(),
            result.status(), result.kind(), result.results(), 0));
        submitCoordinator.onResolved(result);
    }

    static String newCustomerPath(String query) {
        String text = query == null ? "" : query.trim();
        if (text.isEmpty()) {
            return NEW_CUSTOMER_PATH;
        }
        String digits = Query.of(text).digits();
        boolean phone = QueryClassifier.isLikelyPhone(digits);
        return UriComponentsBuilder.fromPath(NEW_CUSTOMER_PATH)
            .queryParam(phone ? "phone" : "full_name", "{value}")
            .encode()
            .buildAndExpand(phone ? digits : text)
            .toUriString();
    }

    private SearchSnapshot loading(SearchSession session) {
        return new SearchSnapshot(true, session.getGeneration(), rawQuery, session.getState(),
            SearchStatus.LOADING, snapshot.kind(), List.of(), 0);
    }

    private void dismiss() {
        closeSurface();
        closeSignal.close();
    }

    private void closeSurface() {
        if (!open) {
            return;
        }
        open = false;
        openPeriod++;
        rawQuery = "";
        long generation = executor.abort();
        executor.updateLatestTicketNumber(OptionalLong.empty());
        submitCoordinator.reset();
        log.info("Search closed");
        publish(SearchSnapshot.closed(generation));
    }

    private void fetchLatestTicketNumber(long period) {
        CompletableFuture
            .supplyAsync(ticketRepository::findLatestTicketNumber, lookupTaskExecutor)
            .exceptionally(error -> {
                log.warn("Latest ticket number lookup failed", error);
                return OptionalLong.empty();
            })
            .thenAccept(latest -> scheduler.execute(() -> {
                if (open && period == openPeriod) {
                    log.debug("Latest ticket number is {}", latest);
                    executor.updateLatestTicketNumber(latest);
                }
            }));
    }

    private void publish(SearchSnapshot next) {
        snapshot = next;
        for (SearchStateListener listener : listeners) {
            try {
                listener.onChange(next);
            } catch (RuntimeException e) {
                log.error("Search listener failed", e);
            }
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
