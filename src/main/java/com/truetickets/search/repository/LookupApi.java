package com.truetickets.search.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.truetickets.search.infra.CancellationToken;

import java.util.Map;

/**
 * Read-only access to the backend lookup endpoints.
 */
public interface LookupApi {

    /**
     * Issues a GET against {@code path} with the given query parameters.
     *
     * @throws com.truetickets.search.exception.EntityNotFoundException when the backend reports no such entity
     * @throws com.truetickets.search.exception.LookupFailedException on any other transport or server failure
     * @throws java.util.concurrent.CancellationException when {@code token} was cancelled before the body arrived
     */
    JsonNode get(String path, Map<String, String> queryParams, CancellationToken token);
}
