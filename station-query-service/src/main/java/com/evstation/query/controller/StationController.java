package com.evstation.query.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.evstation.query.dto.StationListResponse;
import com.evstation.query.dto.StationResponse;
import com.evstation.query.service.StationQueryService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@RequestMapping(value = "/stations", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Stations", description = "Latest known state of battery swap stations")
public class StationController {

  private final StationQueryService stationQueryService;

  public StationController(StationQueryService stationQueryService) {
    this.stationQueryService = stationQueryService;
  }

  @GetMapping
  @Operation(summary = "List stations", description = "Latest state of every station")
  @ApiResponse(responseCode = "200", description = "All stations with their count")
  public ResponseEntity<StationListResponse> listStations() {
    return ResponseEntity.ok(stationQueryService.listStations());
  }

  @GetMapping("/{stationId}")
  @Operation(summary = "Get station", description = "Latest state of one station")
  @ApiResponse(responseCode = "200", description = "Station found")
  @ApiResponse(responseCode = "404", description = "Station never reported")
  public ResponseEntity<StationResponse> getStation(
      @Parameter(description = "Station identifier", example = "station-01") @PathVariable
          String stationId) {
    return ResponseEntity.ok(stationQueryService.getStation(stationId));
  }
}
