package com.truetickets.search.model;

public enum ResultKind {
    CUSTOMER,
    TICKET
}
