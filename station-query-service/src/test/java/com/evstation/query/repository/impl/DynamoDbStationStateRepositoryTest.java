package com.evstation.query.repository.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.evstation.query.dto.StationState;
import com.evstation.query.repository.StationStateRepository;

import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.model.DescribeTableEnhancedResponse;
import software.amazon.awssdk.enhanced.dynamodb.model.Page;
import software.amazon.awssdk.enhanced.dynamodb.model.PageIterable;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

@ExtendWith(MockitoExtension.class)
class DynamoDbStationStateRepositoryTest {

  @Mock private DynamoDbTable<StationState> table;

  private DynamoDbStationStateRepository repository;

  @BeforeEach
  void setUp() {
    lenient().when(table.tableName()).thenReturn("ev-station-state");
    repository = new DynamoDbStationStateRepository(table);
  }

  private static StationState station(String id) {
    return StationState.builder().deviceId(id).batteryAvailable(10).status("operational").build();
  }

  @Test
  void findAll_SeveralScanPages_ReturnsItemsOfEveryPage() {
    // Given
    Page<StationState> first = Page.create(List.of(station("station-01"), station("station-02")));
    Page<StationState> second = Page.create(List.of(station("station-03")));
    PageIterable<StationState> pages = PageIterable.create(() -> List.of(first, second).iterator());
    when(table.scan()).thenReturn(pages);

    // When
    List<StationState> stations = repository.findAll();

    // Then
    assertThat(stations)
        .extracting(StationState::getDeviceId)
        .containsExactly("station-01", "station-02", "station-03");
  }

  @Test
  void findAll_EmptyTable_ReturnsEmptyList() {
    Page<StationState> empty = Page.create(List.of());
    PageIterable<StationState> pages = PageIterable.create(() -> List.of(empty).iterator());
    when(table.scan()).thenReturn(pages);

    assertThat(repository.findAll()).isEmpty();
  }

  @Test
  void findByDeviceId_ExistingItem_ReturnsIt() {
    // Given
    when(table.getItem(any(Key.class))).thenReturn(station("station-01"));

    // When
    Optional<StationState> result = repository.findByDeviceId("station-01");

    // Then
    assertThat(result).map(StationState::getDeviceId).contains("station-01");
    ArgumentCaptor<Key> keyCaptor = ArgumentCaptor.forClass(Key.class);
    verify(table).getItem(keyCaptor.capture());
    assertThat(keyCaptor.getValue().partitionKeyValue().s()).isEqualTo("station-01");
  }

  @Test
  void findByDeviceId_MissingItem_ReturnsEmpty() {
    when(table.getItem(any(Key.class))).thenReturn(null);

    assertThat(repository.findByDeviceId("station-99")).isEmpty();
  }

  @Test
  void findByDeviceId_BlankId_DoesNotQuery() {
    assertThat(repository.findByDeviceId(" ")).isEmpty();
    verify(table, never()).getItem(any(Key.class));
  }

  @Test
  void validateTableHealth_ActiveTable_IsHealthy() {
    // Given
    when(table.describeTable())
        .thenReturn(
            DescribeTableEnhancedResponse.builder()
                .response(
                    DescribeTableResponse.builder()
                        .table(
                            TableDescription.builder()
                                .tableStatus(TableStatus.ACTIVE)
                                .itemCount(10L)
                                .build())
                        .build())
                .build());

    // When
    StationStateRepository.HealthCheckResult result = repository.validateTableHealth();

    // Then
    assertThat(result.isHealthy()).isTrue();
    assertThat(result.itemCount()).isEqualTo(10L);
    assertThat(result.tableName()).isEqualTo("ev-station-state");
  }
}
