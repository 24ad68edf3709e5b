package com.truetickets.search.model;

import java.time.Instant;

public record CustomerMatch(
    String id,
    String name,
    String phone,
    Instant createdAt
) implements CandidateResult {

    @Override
    public ResultKind kind() {
        return ResultKind.CUSTOMER;
    }

    @Override
    public String path() {
        return "/$" + id;
    }

    /**
     * Ten-digit numbers render as {@code 555-123-4567}; anything else is returned as stored.
     */
    public String displayPhone() {
        if (phone == null) {
            return null;
        }
        String digits = phone.replaceAll("\\D", "");
        if (digits.length() == 10) {
            return digits.substring(0, 3) + "-" + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        return phone;
    }
}
