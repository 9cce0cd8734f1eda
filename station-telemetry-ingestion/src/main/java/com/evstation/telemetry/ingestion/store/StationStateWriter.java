package com.evstation.telemetry.ingestion.store;

import com.evstation.telemetry.ingestion.dto.StationStateRecord;

/**
 * Writes the latest state of a station.
 *
 * <p>An upsert replaces whatever is stored for the record's device id, unconditionally. There is
 * no ordering check: a late, older event overwrites newer state. Once {@code upsert} returns the
 * new state is visible to readers.
 */
public interface StationStateWriter {

  /**
   * Stores the record under its device id.
   *
   * @param record complete state; replaces any existing item
   * @throws StoreWriteException if the store throttled the write or was unavailable
   */
  void upsert(StationStateRecord record);
}
