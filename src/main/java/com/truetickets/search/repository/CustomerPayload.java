package com.truetickets.search.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
record CustomerPayload(
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("full_name") String fullName,
    @JsonProperty("primary_phone") String primaryPhone,
    @JsonProperty("phone_numbers") List<PhoneNumberPayload> phoneNumbers,
    @JsonProperty("created_at") Long createdAt
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PhoneNumberPayload(String number) {}
}
