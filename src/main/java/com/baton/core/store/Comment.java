package com.baton.core.store;

import java.io.Serializable;
import java.time.Instant;

/**
 * A comment posted on an issue. Comment ids are ordered by creation.
 */
public record Comment(
    String id,
    String issueId,
    String author,
    String body,
    Instant createdAt
) implements Serializable {}
