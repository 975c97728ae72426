package com.kvrestore.connector.snapshot;

import static com.kvrestore.testing.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.kvrestore.core.model.ImportHandle;
import com.kvrestore.core.model.ImportProgress;
import com.kvrestore.core.model.SnapshotMetadata;
import com.kvrestore.core.model.TransferStatus;
import com.kvrestore.core.retry.ErrorKind;
import com.kvrestore.core.retry.RemoteServiceException;
import com.kvrestore.core.util.JsonUtils;
import com.kvrestore.testing.InMemoryBlobStore;
import com.kvrestore.testing.InMemoryTableCatalog;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BlobSnapshotServiceTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-12-20T08:45:13Z"), ZoneOffset.UTC);

  private InMemoryTableCatalog source;
  private InMemoryTableCatalog target;
  private InMemoryBlobStore store;
  private BlobSnapshotService service;

  @BeforeEach
  void setUp() {
    source = new InMemoryTableCatalog();
    target = new InMemoryTableCatalog();
    store = new InMemoryBlobStore();
    source.addTable(ordersSchema("orders"), row(1, "one"), row(2, "two"), row(3, "three"));
    service = new BlobSnapshotService(source, target, store, CLOCK, Runnable::run);
  }

  @Test
  @DisplayName("An export writes gzip data and a COMPLETED manifest under the snapshot location")
  void exportsTable() {
    // when
    SnapshotMetadata metadata = service.requestExport("orders");

    // then
    assertThat(metadata.getSnapshotId()).isEqualTo("orders/20251220_084513");
    assertThat(metadata.getLocationReference()).isEqualTo("full-backups/orders/20251220_084513/");
    assertThat(metadata.getCutoverTime()).isEqualTo(CLOCK.instant());
    assertThat(service.pollExport(metadata.getSnapshotId())).isEqualTo(TransferStatus.COMPLETED);
    assertThat(store.keys())
        .contains(
            "full-backups/orders/20251220_084513/manifest.json",
            "full-backups/orders/20251220_084513/data/part-00000.json.gz");

    JsonNode manifest =
        JsonUtils.readTree(store.get("full-backups/orders/20251220_084513/manifest.json"));
    assertThat(manifest.get("status").asText()).isEqualTo("COMPLETED");
    assertThat(manifest.get("item_count").asLong()).isEqualTo(3);
  }

  @Test
  @DisplayName("pollExport() falls back to the stored manifest for exports of another process")
  void pollExportFromManifest() {
    String snapshotId = service.requestExport("orders").getSnapshotId();
    BlobSnapshotService other = new BlobSnapshotService(source, target, store, CLOCK, Runnable::run);

    assertThat(other.pollExport(snapshotId)).isEqualTo(TransferStatus.COMPLETED);
    assertThatThrownBy(() -> other.pollExport("orders/19990101_000000"))
        .isInstanceOfSatisfying(
            RemoteServiceException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.RESOURCE_NOT_FOUND));
  }

  @Test
  @DisplayName("An import creates the new table with the source key schema and all rows")
  void importsSnapshot() {
    // given
    SnapshotMetadata metadata = service.requestExport("orders");

    // when
    ImportHandle handle =
        service.requestImport(
            metadata.getLocationReference(), source.describeTable("orders"), "orders_restored");
    ImportProgress progress = service.pollImport(handle);

    // then
    assertThat(progress.status()).isEqualTo(TransferStatus.COMPLETED);
    assertThat(progress.importedItemCount()).isEqualTo(3);
    assertThat(target.describeTable("orders_restored").partitionKeyName()).isEqualTo("id");
    assertThat(target.table("orders_restored").snapshotRows())
        .containsEntry(key(2), row(2, "two"))
        .hasSize(3);
  }

  @Test
  @DisplayName("Importing into an existing table is refused with RESOURCE_IN_USE")
  void refusesExistingTable() {
    target.addTable(ordersSchema("orders_restored"));

    assertThatThrownBy(
            () ->
                service.requestImport(
                    "full-backups/orders/20251220_084513/",
                    ordersSchema("orders"),
                    "orders_restored"))
        .isInstanceOfSatisfying(
            RemoteServiceException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.RESOURCE_IN_USE));
  }

  @Test
  @DisplayName("An import from a location without data ends FAILED without creating the table")
  void importWithoutData() {
    ImportHandle handle =
        service.requestImport("full-backups/orders/missing", ordersSchema("orders"), "orders_restored");

    ImportProgress progress = service.pollImport(handle);

    assertThat(progress.status()).isEqualTo(TransferStatus.FAILED);
    assertThat(progress.failureReason()).hasValueSatisfying(r -> assertThat(r).startsWith("VALIDATION - "));
    assertThat(target.tableExists("orders_restored")).isFalse();
  }

  @Test
  @DisplayName("A transfer submitted to a background executor is observed IN_PROGRESS first")
  void asynchronousExport() {
    // given
    List<Runnable> pending = new ArrayList<>();
    BlobSnapshotService deferred = new BlobSnapshotService(source, target, store, CLOCK, pending::add);

    // when
    SnapshotMetadata metadata = deferred.requestExport("orders");

    // then
    assertThat(metadata.getStatus()).isEqualTo(TransferStatus.IN_PROGRESS);
    assertThat(deferred.pollExport(metadata.getSnapshotId())).isEqualTo(TransferStatus.IN_PROGRESS);
    pending.forEach(Runnable::run);
    assertThat(deferred.pollExport(metadata.getSnapshotId())).isEqualTo(TransferStatus.COMPLETED);
  }
}
