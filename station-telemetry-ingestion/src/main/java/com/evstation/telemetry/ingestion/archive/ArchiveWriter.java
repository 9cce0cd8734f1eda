package com.evstation.telemetry.ingestion.archive;

import com.evstation.telemetry.ingestion.store.StoreWriteException;

/**
 * Appends immutable telemetry objects to the archive.
 *
 * <p>Keys are expected to be unique per call; the writer never reads, merges or deletes objects.
 */
public interface ArchiveWriter {

  /**
   * Stores one archive object.
   *
   * @param key unique object key
   * @param body canonical event bytes
   * @param deviceId station the object belongs to, recorded as object metadata
   * @throws StoreWriteException if the store throttled the write or was unavailable
   */
  void append(String key, byte[] body, String deviceId);
}
