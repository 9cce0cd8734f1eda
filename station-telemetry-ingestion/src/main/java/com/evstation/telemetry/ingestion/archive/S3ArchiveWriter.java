package com.evstation.telemetry.ingestion.archive;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import org.springframework.stereotype.Repository;

import com.evstation.telemetry.ingestion.config.properties.IngestionConfigurationProperties;
import com.evstation.telemetry.ingestion.store.StoreExceptionClassifier;
import com.evstation.telemetry.ingestion.store.StoreFailureKind;
import com.evstation.telemetry.ingestion.store.StoreWriteException;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/** S3 implementation of the telemetry archive. */
@Slf4j
@Repository
public class S3ArchiveWriter implements ArchiveWriter {

  static final String CONTENT_TYPE = "application/json";
  static final String DEVICE_ID_METADATA = "device_id";
  static final String INGESTION_TIME_METADATA = "ingestion_time";

  private final S3Client s3Client;
  private final String bucketName;
  private final StoreExceptionClassifier exceptionClassifier;
  private final Clock clock;

  public S3ArchiveWriter(
      S3Client s3Client,
      IngestionConfigurationProperties ingestionConfig,
      StoreExceptionClassifier exceptionClassifier,
      Clock clock) {
    this.s3Client = s3Client;
    this.bucketName = ingestionConfig.archiveBucketName();
    this.exceptionClassifier = exceptionClassifier;
    this.clock = clock;
    log.info("Archive writer initialized for bucket {}", bucketName);
  }

  @Override
  public void append(String key, byte[] body, String deviceId) {
    PutObjectRequest request =
        PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentType(CONTENT_TYPE)
            .metadata(
                Map.of(
                    DEVICE_ID_METADATA, deviceId,
                    INGESTION_TIME_METADATA, Instant.now(clock).toString()))
            .build();

    try {
      s3Client.putObject(request, RequestBody.fromBytes(body));
      log.debug("Archived to s3://{}/{}", bucketName, key);
    } catch (SdkException e) {
      StoreFailureKind kind = exceptionClassifier.classify(e);
      throw StoreWriteException.of(
          kind, "Failed to archive " + key + " to bucket " + bucketName + ": " + e.getMessage(), e);
    }
  }
}
