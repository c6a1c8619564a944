package dev.clarityhub.budget;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DatabaseProcessingUsageStoreTest {

  private static final LocalDate DAY = LocalDate.of(2026, 3, 1);

  @Mock ProcessingUsageRepository repository;

  private DatabaseProcessingUsageStore store;

  @BeforeEach
  void setUp() {
    store = new DatabaseProcessingUsageStore(repository);
  }

  @Test
  void missingRowReadsAsZeroUsage() {
    given(repository.findById(new ProcessingUsageRecord.Key("tenant-a", DAY)))
        .willReturn(Optional.empty());

    ProcessingUsage usage = store.get("tenant-a", DAY);

    assertThat(usage).isEqualTo(ProcessingUsage.none("tenant-a", DAY));
  }

  @Test
  void successfulUpsertReturnsTheStoredTotals() {
    ProcessingUsageRecord row = mock(ProcessingUsageRecord.class);
    given(row.toUsage()).willReturn(new ProcessingUsage("tenant-a", DAY, 3, 300));
    given(repository.reserveWithinCaps("tenant-a", DAY, 1, 100, 10, 1000)).willReturn(1);
    given(repository.findById(any())).willReturn(Optional.of(row));

    Optional<ProcessingUsage> reserved = store.tryReserve("tenant-a", DAY, 1, 100, 10, 1000);

    assertThat(reserved).contains(new ProcessingUsage("tenant-a", DAY, 3, 300));
  }

  @Test
  void refusedUpsertReturnsEmpty() {
    given(repository.reserveWithinCaps("tenant-a", DAY, 1, 100, 10, 1000)).willReturn(0);

    assertThat(store.tryReserve("tenant-a", DAY, 1, 100, 10, 1000)).isEmpty();
  }

  @Test
  void workloadLargerThanTheCapsNeverReachesTheDatabase() {
    assertThat(store.tryReserve("tenant-a", DAY, 11, 0, 10, 1000)).isEmpty();

    verify(repository, never())
        .reserveWithinCaps(anyString(), any(), anyInt(), anyLong(), anyInt(), anyLong());
  }
}
