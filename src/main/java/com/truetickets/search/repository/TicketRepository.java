package com.truetickets.search.repository;

import com.truetickets.search.infra.CancellationToken;
import com.truetickets.search.model.TicketMatch;

import java.util.List;
import java.util.OptionalLong;

public interface TicketRepository {
    List<TicketMatch> findByNumber(String number, CancellationToken token);
    List<TicketMatch> search(String text, CancellationToken token);
    OptionalLong findLatestTicketNumber();
}
