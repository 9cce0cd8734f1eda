package com.evstation.query.dto;

import java.util.List;

/**
 * Body of {@code GET /stations}.
 *
 * @param count number of stations returned
 * @param stations latest state of every known station, in store order
 */
public record StationListResponse(int count, List<StationState> stations) {

  public static StationListResponse of(List<StationState> stations) {
    return new StationListResponse(stations.size(), stations);
  }
}
