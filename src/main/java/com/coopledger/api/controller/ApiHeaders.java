package com.coopledger.api.controller;

/**
 * Authentication happens upstream; the caller's identity arrives in this header.
 */
final class ApiHeaders {

    static final String ACTOR_ID = "X-Actor-Id";

    private ApiHeaders() {
    }
}
