package com.truetickets.search.model;

import java.util.List;

/**
 * Everything one dispatch brought back, per entity kind. Failed probes contribute nothing.
 */
public record LookupOutcome(List<CustomerMatch> customers, List<TicketMatch> tickets) {

    public LookupOutcome {
        customers = List.copyOf(customers);
        tickets = List.copyOf(tickets);
    }

    public static LookupOutcome empty() {
        return new LookupOutcome(List.of(), List.of());
    }

    public static LookupOutcome ofCustomers(List<CustomerMatch> customers) {
        return new LookupOutcome(customers, List.of());
    }

    public static LookupOutcome ofTickets(List<TicketMatch> tickets) {
        return new LookupOutcome(List.of(), tickets);
    }
}
