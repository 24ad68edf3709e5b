package com.truetickets.search.event;

/**
 * Published by the host to show ({@code open == true}) or hide the search surface.
 */
public record SearchSurfaceToggledEvent(boolean open) {}
