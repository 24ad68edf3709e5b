package com.truetickets.search.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
