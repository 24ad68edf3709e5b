package com.truetickets.search.model;

import com.truetickets.search.infra.CancellationToken;
import lombok.Getter;

/**
 * Binds a query to its generation and tracks its lifecycle. Only mutated on the search loop.
 */
@Getter
public class SearchSession {

    private final Query query;
    private final long generation;
    private final CancellationToken cancellationToken = new CancellationToken();

    private SearchStrategy strategy;
    private SessionState state = SessionState.DEBOUNCING;

    public SearchSession(Query query, long generation) {
        this.query = query;
        this.generation = generation;
    }

    public void dispatched(SearchStrategy strategy) {
        requireState(SessionState.DEBOUNCING);
        this.strategy = strategy;
        this.state = SessionState.IN_FLIGHT;
    }

    public void resolve() {
        requireState(SessionState.IN_FLIGHT);
        this.state = SessionState.RESOLVED;
    }

    public void supersede() {
        end(SessionState.SUPERSEDED);
    }

    public void abort() {
        end(SessionState.ABORTED);
    }

    public boolean isLive() {
        return !state.isTerminal();
    }

    private void end(SessionState terminal) {
        cancellationToken.cancel();
        if (isLive()) {
            state = terminal;
        }
    }

    private void requireState(SessionState expected) {
        if (state != expected) {
            throw new IllegalStateException(
                "Session " + generation + " is " + state + ", expected " + expected);
        }
    }
}
