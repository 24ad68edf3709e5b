package com.truetickets.search.event;

public record SearchSurfaceClosedEvent() {}
