package com.baton.dispatch.api;

/**
 * Request body for POST /api/v1/work-items/{id}/transitions.
 *
 * @param from  phase the caller believes the item is in
 * @param to    requested phase
 * @param actor initiating actor
 */
public record TransitionRequest(String from, String to, String actor) {}
