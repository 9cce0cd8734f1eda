package com.evstation.query.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import com.evstation.query.repository.StationStateRepository;

import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

@ExtendWith(MockitoExtension.class)
class DynamoDBReadinessHealthIndicatorTest {

  @Mock private StationStateRepository repository;

  private DynamoDBReadinessHealthIndicator healthIndicator;

  @BeforeEach
  void setUp() {
    healthIndicator = new DynamoDBReadinessHealthIndicator(repository);
  }

  @Test
  void health_HealthyTable_IsUp() {
    when(repository.validateTableHealth())
        .thenReturn(
            new StationStateRepository.HealthCheckResult(
                true, 12L, "ev-station-state", 10L, "Table is active"));

    Health health = healthIndicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails())
        .containsEntry("tableName", "ev-station-state")
        .containsEntry("itemCount", 10L);
  }

  @Test
  void health_TableNotActive_IsDown() {
    when(repository.validateTableHealth())
        .thenReturn(
            new StationStateRepository.HealthCheckResult(
                false, 12L, "ev-station-state", 0L, "Table status is UPDATING"));

    Health health = healthIndicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    assertThat(health.getDetails()).containsEntry("status", "Table status is UPDATING");
  }

  @Test
  void health_MissingTable_IsDown() {
    when(repository.validateTableHealth())
        .thenThrow(ResourceNotFoundException.builder().message("not found").build());

    assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
  }

  @Test
  void health_ConnectionError_IsDown() {
    when(repository.validateTableHealth())
        .thenThrow(DynamoDbException.builder().message("unreachable").build());

    assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.DOWN);
  }

  @Test
  void health_UnexpectedError_IsOutOfService() {
    when(repository.validateTableHealth()).thenThrow(new IllegalStateException("boom"));

    assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
  }
}
