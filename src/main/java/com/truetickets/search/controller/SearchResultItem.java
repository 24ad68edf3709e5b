package com.truetickets.search.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.truetickets.search.model.CandidateResult;
import com.truetickets.search.model.CustomerMatch;
import com.truetickets.search.model.ResultKind;
import com.truetickets.search.model.TicketMatch;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResultItem(
    ResultKind kind,
    String id,
    String path,
    String name,
    String phone,
    @JsonProperty("ticket_number") Long ticketNumber,
    String subject,
    String status,
    String device,
    @JsonProperty("customer_name") String customerName,
    @JsonProperty("created_at") Instant createdAt
) {
    public static SearchResultItem from(CandidateResult result) {
        if (result instanceof CustomerMatch customer) {
            return new SearchResultItem(
                ResultKind.CUSTOMER,
                customer.id(),
                customer.path(),
                customer.name(),
                customer.displayPhone(),
                null,
                null,
                null,
                null,
                null,
                customer.createdAt()
            );
        }
        TicketMatch ticket = (TicketMatch) result;
        return new SearchResultItem(
            ResultKind.TICKET,
            String.valueOf(ticket.number()),
            ticket.path(),
            null,
            null,
            ticket.number(),
            ticket.subject(),
            ticket.displayStatus(),
            ticket.device(),
            ticket.customerName(),
            ticket.createdAt()
        );
    }
}
