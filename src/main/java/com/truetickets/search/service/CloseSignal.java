package com.truetickets.search.service;

/**
 * Tells the host to dismiss the search surface.
 */
@FunctionalInterface
public interface CloseSignal {
    void close();
}
