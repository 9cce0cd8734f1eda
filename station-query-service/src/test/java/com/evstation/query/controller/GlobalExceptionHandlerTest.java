package com.evstation.query.controller;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.evstation.query.exception.StationNotFoundException;

class GlobalExceptionHandlerTest {

  private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

  @Test
  void handleStationNotFound_Returns404WithStationInMessage() {
    ResponseEntity<Map<String, Object>> response =
        handler.handleStationNotFound(new StationNotFoundException("station-42"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody())
        .containsEntry("error", "Not found")
        .containsEntry("message", "Station station-42 not found");
  }

  @Test
  void handleUnknownPath_Returns404() {
    ResponseEntity<Map<String, Object>> response =
        handler.handleUnknownPath(new NoResourceFoundException(HttpMethod.GET, "stationz"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody()).containsEntry("error", "Not found");
  }

  @Test
  void handleMethodNotAllowed_Returns405() {
    ResponseEntity<Map<String, Object>> response =
        handler.handleMethodNotAllowed(
            new HttpRequestMethodNotSupportedException("DELETE", List.of("GET", "OPTIONS")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
    assertThat(response.getBody()).containsEntry("message", "Method DELETE is not supported");
  }

  @Test
  void handleGenericException_Returns500WithFixedMessage() {
    ResponseEntity<Map<String, Object>> response =
        handler.handleGenericException(
            new RuntimeException(
                "Requested resource not found: Table: ev-station-state not found "
                    + "(Service: DynamoDb, Status Code: 400, Request ID: 7Q3L0JUKD2)"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody())
        .containsEntry("error", "Internal server error")
        .containsEntry("message", "An unexpected error occurred");
    assertThat(response.getBody().toString())
        .doesNotContain("ev-station-state")
        .doesNotContain("Request ID");
  }
}
