package com.truetickets.search.event;

public record NavigationRequestedEvent(String path) {}
