package com.noteshub.gamification.controller;

/**
 * Request headers set by the gateway in front of this service.
 */
public final class ApiHeaders {

    // id of the authenticated caller
    public static final String USER_ID = "X-User-Id";

    private ApiHeaders() {
    }
}
