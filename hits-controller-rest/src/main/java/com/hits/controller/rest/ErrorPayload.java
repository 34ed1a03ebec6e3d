package com.hits.controller.rest;

import java.time.Instant;

/** Structured error body returned by the hit and stats endpoints. */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {}
