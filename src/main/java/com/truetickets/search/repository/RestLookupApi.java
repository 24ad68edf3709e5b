package com.truetickets.search.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.truetickets.search.exception.EntityNotFoundException;
import com.truetickets.search.exception.LookupFailedException;
import com.truetickets.search.infra.CancellationToken;
import com.truetickets.search.infra.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

@Slf4j
@Repository
public class RestLookupApi implements LookupApi {

    private final RestClient lookupRestClient;
    private final RateLimiter lookupLimiter;

    public RestLookupApi(
        @Qualifier("lookupRestClient") RestClient lookupRestClient,
        @Qualifier("lookupLimiter") RateLimiter lookupLimiter
    ) {
        this.lookupRestClient = lookupRestClient;
        this.lookupLimiter = lookupLimiter;
    }

    @Override
    public JsonNode get(String path, Map<String, String> queryParams, CancellationToken token) {
        token.throwIfCancelled();

        // Cancellation interrupts the calling thread while it waits for a permit or for the response.
        Thread caller = Thread.currentThread();
        try (CancellationToken.Registration ignored = token.onCancel(caller::interrupt)) {
            JsonNode body = lookupLimiter.execute(path, 1, () -> fetch(path, queryParams, token));
            token.throwIfCancelled();
            return body;
        } finally {
            if (token.isCancelled()) {
                Thread.interrupted();
            }
        }
    }

    private JsonNode fetch(String path, Map<String, String> queryParams, CancellationToken token) {
        token.throwIfCancelled();
        log.debug("GET {} {}", path, queryParams);
        try {
            JsonNode body = lookupRestClient.get()
                .uri(builder -> {
                    builder.path(path);
                    queryParams.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
                    return builder.build(queryParams);
                })
                .retrieve()
                .body(JsonNode.class);
            return body == null ? NullNode.getInstance() : body;
        } catch (HttpClientErrorException.NotFound e) {
            throw new EntityNotFoundException(path);
        } catch (RestClientException e) {
            token.throwIfCancelled();
            throw new LookupFailedException(path, e);
        }
    }
}
