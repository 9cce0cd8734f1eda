package com.evstation.query.service;

import org.springframework.stereotype.Service;

import com.evstation.query.dto.StationListResponse;
import com.evstation.query.dto.StationResponse;
import com.evstation.query.exception.StationNotFoundException;
import com.evstation.query.repository.StationStateRepository;

import lombok.extern.slf4j.Slf4j;

/** Read side of the station latest-state store. */
@Slf4j
@Service
public class StationQueryService {

  private final StationStateRepository repository;

  public StationQueryService(StationStateRepository repository) {
    this.repository = repository;
  }

  public StationListResponse listStations() {
    StationListResponse response = StationListResponse.of(repository.findAll());
    log.info("Listed {} stations", response.count());
    return response;
  }

  /**
   * Looks up one station.
   *
   * @throws StationNotFoundException if the station has no stored state
   */
  public StationResponse getStation(String stationId) {
    return repository
        .findByDeviceId(stationId)
        .map(StationResponse::new)
        .orElseThrow(() -> new StationNotFoundException(stationId));
  }
}
