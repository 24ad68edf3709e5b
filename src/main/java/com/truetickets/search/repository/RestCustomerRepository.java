package com.truetickets.search.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.truetickets.search.infra.CancellationToken;
import com.truetickets.search.model.CustomerMatch;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class RestCustomerRepository implements CustomerRepository {

    static final String AUTOCOMPLETE_PATH = "/customers/autocomplete";

    private final LookupApi lookupApi;
    private final LookupResponseMapper mapper;

    @Override
    public List<CustomerMatch> autocomplete(String query, CancellationToken token) {
        JsonNode body = lookupApi.get(AUTOCOMPLETE_PATH, Map.of("query", query), token);
        return mapper.customers(body);
    }
}
