package com.baton.dispatch.api;

public record ClaimRequest(String actor) {}
