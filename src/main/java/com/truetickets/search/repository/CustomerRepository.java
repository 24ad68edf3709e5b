package com.truetickets.search.repository;

import com.truetickets.search.infra.CancellationToken;
import com.truetickets.search.model.CustomerMatch;

import java.util.List;

public interface CustomerRepository {
    List<CustomerMatch> autocomplete(String query, CancellationToken token);
}
