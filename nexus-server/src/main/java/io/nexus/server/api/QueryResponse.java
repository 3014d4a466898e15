package io.nexus.server.api;

/// Answer to a synchronous query.
///
/// @param query the query as submitted
/// @param answer the router's final answer, never blank
public record QueryResponse(String query, String answer) {}
