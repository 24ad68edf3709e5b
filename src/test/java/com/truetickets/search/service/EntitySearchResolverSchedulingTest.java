package com.truetickets.search.service;

import com.truetickets.search.infra.TaskSchedulerSearchScheduler;
import com.truetickets.search.model.LookupOutcome;
import com.truetickets.search.model.SearchSnapshot;
import com.truetickets.search.model.SearchStatus;
import com.truetickets.search.model.SearchStrategy;
import com.truetickets.search.model.TicketMatch;
import com.truetickets.search.repository.TicketRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Runs the resolver on a real single-threaded loop with a short quiet period.
 */
class EntitySearchResolverSchedulingTest {

    private static final Duration DEBOUNCE = Duration.ofMillis(50);

    private final LookupDispatcher dispatcher = mock(LookupDispatcher.class);
    private final TicketRepository ticketRepository = mock(TicketRepository.class);
    private final List<String> navigated = new CopyOnWriteArrayList<>();
    private final List<SearchSnapshot> published = new CopyOnWriteArrayList<>();

    private ThreadPoolTaskScheduler loop;
    private ExecutorService lookups;
    private EntitySearchResolver resolver;

    @BeforeEach
    void setUp() {
        loop = new ThreadPoolTaskScheduler();
        loop.setPoolSize(1);
        loop.setThreadNamePrefix("test-loop-");
        loop.initialize();
        lookups = Executors.newFixedThreadPool(2);

        when(ticketRepository.findLatestTicketNumber()).thenReturn(OptionalLong.empty());
        resolver = new EntitySearchResolver(new QueryClassifier(), new SuffixResolver(2), dispatcher,
            new ResultCoalescer(), ticketRepository, lookups, new TaskSchedulerSearchScheduler(loop), DEBOUNCE,
            navigated::add, () -> { });
        resolver.subscribe(published::add);
        resolver.open();
    }

    @AfterEach
    void tearDown() {
        loop.shutdown();
        lookups.shutdownNow();
    }

    @Test
    void burstOfKeystrokesDispatchesOnlyTheLastQuery() {
        TicketMatch ticket = new TicketMatch(12345, "Screen", "New", "Phone", "Jane Doe", Instant.EPOCH);
        when(dispatcher.dispatch(any(), any()))
            .thenReturn(CompletableFuture.supplyAsync(() -> LookupOutcome.ofTickets(List.of(ticket)), lookups));

        resolver.updateQuery("1");
        resolver.updateQuery("12");
        resolver.updateQuery("123");
        resolver.updateQuery("1234");
        resolver.updateQuery("12345");

        await().atMost(Duration.ofSeconds(2))
            .untilAsserted(() -> assertThat(resolver.snapshot().status()).isEqualTo(SearchStatus.POPULATED));

        verify(dispatcher).dispatch(eq(new SearchStrategy.ExactTicketLookup("12345")), any());
        verify(dispatcher, never()).dispatch(eq(new SearchStrategy.ExactTicketLookup("1234")), any());
        assertThat(resolver.snapshot().query()).isEqualTo("12345");
    }

    @Test
    void submitBeforeResultsArriveNavigatesOnce() {
        CompletableFuture<LookupOutcome> slow = new CompletableFuture<>();
        when(dispatcher.dispatch(any(), any())).thenReturn(slow);

        resolver.updateQuery("12345");
        resolver.submit();
        await().atMost(Duration.ofSeconds(2))
            .untilAsserted(() -> verify(dispatcher).dispatch(any(), any()));

        slow.completeAsync(() -> LookupOutcome.ofTickets(List.of(
            new TicketMatch(12345, "Screen", "New", "Phone", "Jane Doe", Instant.EPOCH))), lookups);

        await().atMost(Duration.ofSeconds(2)).until(() -> !navigated.isEmpty());
        assertThat(navigated).containsExactly("/&12345");
        assertThat(published).anyMatch(SearchSnapshot::isLoading);
    }
}
