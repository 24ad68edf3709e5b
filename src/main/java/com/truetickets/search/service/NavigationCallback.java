package com.truetickets.search.service;

@FunctionalInterface
public interface NavigationCallback {
    void goTo(String path);
}
