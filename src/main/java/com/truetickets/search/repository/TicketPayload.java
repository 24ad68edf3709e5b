package com.truetickets.search.repository;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
record TicketPayload(
    @JsonProperty("ticket_number") Long ticketNumber,
    String subject,
    String status,
    String device,
    @JsonProperty("customer_name") @JsonAlias("customer_full_name") String customerName,
    CustomerPayload customer,
    @JsonProperty("created_at") Long createdAt
) {}
