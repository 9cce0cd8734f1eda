package com.evstation.telemetry.ingestion.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.evstation.telemetry.ingestion.dto.StationStateRecord;
import com.evstation.telemetry.ingestion.store.StationStateWriter;
import com.evstation.telemetry.ingestion.store.StoreFailureKind;
import com.evstation.telemetry.ingestion.store.StoreWriteException;

/** Latest-state store backed by a map, with switchable failures for coordinator tests. */
public class InMemoryStationStateWriter implements StationStateWriter {

  private final Map<String, StationStateRecord> items = new ConcurrentHashMap<>();
  private final List<String> writeAttempts = new ArrayList<>();
  private StoreFailureKind failure;
  private Runnable afterWrite = () -> {};

  @Override
  public void upsert(StationStateRecord record) {
    writeAttempts.add(record.getDeviceId());
    if (failure != null) {
      throw StoreWriteException.of(failure, "State store unavailable", null);
    }
    items.put(record.getDeviceId(), record);
    afterWrite.run();
  }

  public void failWith(StoreFailureKind kind) {
    this.failure = kind;
  }

  public void recover() {
    this.failure = null;
  }

  public void afterWrite(Runnable hook) {
    this.afterWrite = hook;
  }

  public Optional<StationStateRecord> find(String deviceId) {
    return Optional.ofNullable(items.get(deviceId));
  }

  public int size() {
    return items.size();
  }

  public List<String> writeAttempts() {
    return writeAttempts;
  }
}
