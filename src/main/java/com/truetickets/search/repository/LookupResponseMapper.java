package com.truetickets.search.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.truetickets.search.model.CustomerMatch;
import com.truetickets.search.model.TicketMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Turns lookup bodies into result rows. The backend answers with a bare array, an object wrapping
 * the array, or a single entity object depending on the endpoint; all three are accepted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LookupResponseMapper {

    private final ObjectMapper objectMapper;

    public List<TicketMatch> tickets(JsonNode body) {
        return elements(body, "tickets", "ticket_number")
            .map(node -> objectMapper.convertValue(node, TicketPayload.class))
            .filter(payload -> {
                if (payload.ticketNumber() == null) {
                    log.debug("Skipping ticket without a number");
                    return false;
                }
                return true;
            })
            .map(this::toTicket)
            .toList();
    }

    public List<CustomerMatch> customers(JsonNode body) {
        return elements(body, "customers", "customer_id")
            .map(node -> objectMapper.convertValue(node, CustomerPayload.class))
            .filter(payload -> {
                if (payload.customerId() == null || payload.customerId().isBlank()) {
                    log.debug("Skipping customer without an id");
                    return false;
                }
                return true;
            })
            .map(this::toCustomer)
            .toList();
    }

    private TicketMatch toTicket(TicketPayload payload) {
        String customerName = payload.customerName();
        if (customerName == null && payload.customer() != null) {
            customerName = payload.customer().fullName();
        }
        return new TicketMatch(
            payload.ticketNumber(),
            payload.subject(),
            payload.status(),
            payload.device(),
            customerName,
            toInstant(payload.createdAt())
        );
    }

    private CustomerMatch toCustomer(CustomerPayload payload) {
        String phone = payload.primaryPhone();
        if (phone == null && payload.phoneNumbers() != null) {
            phone = payload.phoneNumbers().stream()
                .filter(Objects::nonNull)
                .map(CustomerPayload.PhoneNumberPayload::number)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
        }
        return new CustomerMatch(
            payload.customerId(),
            payload.fullName(),
            phone,
            toInstant(payload.createdAt())
        );
    }

    private static Instant toInstant(Long epochMillis) {
        return epochMillis == null ? null : Instant.ofEpochMilli(epochMillis);
    }

    private static Stream<JsonNode> elements(JsonNode body, String wrapperField, String idField) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return Stream.empty();
        }
        if (body.isArray()) {
            return StreamSupport.stream(body.spliterator(), false);
        }
        if (body.isObject()) {
            JsonNode wrapped = body.get(wrapperField);
            if (wrapped != null && wrapped.isArray()) {
                return StreamSupport.stream(wrapped.spliterator(), false);
            }
            if (body.has(idField)) {
                return Stream.of(body);
            }
        }
        return Stream.empty();
    }
}
