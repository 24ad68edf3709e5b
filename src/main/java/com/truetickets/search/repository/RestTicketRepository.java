package com.truetickets.search.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.truetickets.search.exception.EntityNotFoundException;
import com.truetickets.search.exception.LookupFailedException;
import com.truetickets.search.infra.CancellationToken;
import com.truetickets.search.model.TicketMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

@Slf4j
@Repository
@RequiredArgsConstructor
public class RestTicketRepository implements TicketRepository {

    static final String TICKETS_PATH = "/tickets";

    private final LookupApi lookupApi;
    private final LookupResponseMapper mapper;

    @Override
    public List<TicketMatch> findByNumber(String number, CancellationToken token) {
        JsonNode body = lookupApi.get(TICKETS_PATH, Map.of("number", number), token);
        return mapper.tickets(body);
    }

    @Override
    public List<TicketMatch> search(String text, CancellationToken token) {
        JsonNode body = lookupApi.get(TICKETS_PATH, Map.of("query", text), token);
        return mapper.tickets(body);
    }

    /**
     * Highest ticket number on the first page of tickets, which lists the newest tickets.
     */
    @Override
    @Retryable(retryFor = LookupFailedException.class, maxAttempts = 3, backoff = @Backoff(delay = 200, multiplier = 2))
    public OptionalLong findLatestTicketNumber() {
        try {
            JsonNode body = lookupApi.get(TICKETS_PATH, Map.of("page", "1"), CancellationToken.none());
            return mapper.tickets(body).stream()
                .mapToLong(TicketMatch::number)
                .max();
        } catch (EntityNotFoundException e) {
            return OptionalLong.empty();
        }
    }

    @Recover
    public OptionalLong recoverLatestTicketNumber(LookupFailedException e) {
        log.warn("Could not determine the latest ticket number, suffix search disabled: {}", e.getMessage());
        return OptionalLong.empty();
    }
}
