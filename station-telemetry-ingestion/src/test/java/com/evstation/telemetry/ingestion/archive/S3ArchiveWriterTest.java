package com.evstation.telemetry.ingestion.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.evstation.telemetry.ingestion.config.properties.IngestionConfigurationProperties;
import com.evstation.telemetry.ingestion.store.CapacityExceededException;
import com.evstation.telemetry.ingestion.store.StoreExceptionClassifier;
import com.evstation.telemetry.ingestion.store.TransientStoreException;

import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

@ExtendWith(MockitoExtension.class)
class S3ArchiveWriterTest {

  private static final String KEY =
      "telemetry/year=2024/month=01/day=15/station-01_20240115_142345_1a2b3c4d.json";
  private static final Instant NOW = Instant.parse("2024-01-15T14:23:46Z");

  @Mock private S3Client s3Client;

  private S3ArchiveWriter writer;

  @BeforeEach
  void setUp() {
    IngestionConfigurationProperties config =
        new IngestionConfigurationProperties(
            "ev-station-state",
            "ev-station-archive",
            "telemetry",
            Duration.ofSeconds(10),
            Duration.ofSeconds(3),
            Duration.ofSeconds(30),
            false);
    writer =
        new S3ArchiveWriter(
            s3Client, config, new StoreExceptionClassifier(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void append_ValidObject_PutsJsonWithMetadata() throws Exception {
    // Given
    byte[] body = "{\"device_id\": \"station-01\"}".getBytes(StandardCharsets.UTF_8);
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenReturn(PutObjectResponse.builder().build());

    // When
    writer.append(KEY, body, "station-01");

    // Then
    ArgumentCaptor<PutObjectRequest> requestCaptor =
        ArgumentCaptor.forClass(PutObjectRequest.class);
    ArgumentCaptor<RequestBody> bodyCaptor = ArgumentCaptor.forClass(RequestBody.class);
    verify(s3Client).putObject(requestCaptor.capture(), bodyCaptor.capture());

    PutObjectRequest request = requestCaptor.getValue();
    assertThat(request.bucket()).isEqualTo("ev-station-archive");
    assertThat(request.key()).isEqualTo(KEY);
    assertThat(request.contentType()).isEqualTo(S3ArchiveWriter.CONTENT_TYPE);
    assertThat(request.metadata())
        .containsEntry(S3ArchiveWriter.DEVICE_ID_METADATA, "station-01")
        .containsEntry(S3ArchiveWriter.INGESTION_TIME_METADATA, "2024-01-15T14:23:46Z");

    try (InputStream stream = bodyCaptor.getValue().contentStreamProvider().newStream()) {
      assertThat(stream.readAllBytes()).isEqualTo(body);
    }
  }

  @Test
  void append_SlowDown_ThrowsCapacityExceeded() {
    // Given
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(
            S3Exception.builder()
                .statusCode(503)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("SlowDown").build())
                .build());

    // When / Then
    assertThatThrownBy(() -> writer.append(KEY, new byte[] {'{', '}'}, "station-01"))
        .isInstanceOf(CapacityExceededException.class)
        .hasMessageContaining(KEY);
  }

  @Test
  void append_NetworkFailure_ThrowsTransient() {
    // Given
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(SdkClientException.create("connection refused"));

    // When / Then
    assertThatThrownBy(() -> writer.append(KEY, new byte[] {'{', '}'}, "station-01"))
        .isInstanceOf(TransientStoreException.class);
  }
}
