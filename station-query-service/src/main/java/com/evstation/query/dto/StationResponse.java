package com.evstation.query.dto;

/** Body of {@code GET /stations/{stationId}}. */
public record StationResponse(StationState station) {}
