package com.baton.dispatch.api;

import java.util.List;

public record ScopeRequest(String actor, List<String> claimed, List<String> excluded) {}
