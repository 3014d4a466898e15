package io.nexus.server.api;

import io.nexus.server.validation.ValidQuery;

/// Body of `POST /api/v1/query` and `POST /api/v1/query/stream`.
///
/// @param query the natural-language request to answer
public record QueryRequest(@ValidQuery String query) {}
