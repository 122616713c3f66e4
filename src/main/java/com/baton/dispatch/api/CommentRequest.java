package com.baton.dispatch.api;

/**
 * A status comment to post on a work item. Structured blocks in the body are acted on
 * exactly as if the comment had been posted directly in the ticket store.
 */
public record CommentRequest(String actor, String body) {}
