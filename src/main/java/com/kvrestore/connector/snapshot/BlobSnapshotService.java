package com.kvrestore.connector.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kvrestore.connector.BlobObject;
import com.kvrestore.connector.BlobStore;
import com.kvrestore.connector.KeyValueTable;
import com.kvrestore.connector.SnapshotService;
import com.kvrestore.connector.TableCatalog;
import com.kvrestore.core.model.AttributeValue;
import com.kvrestore.core.model.ImportHandle;
import com.kvrestore.core.model.ImportProgress;
import com.kvrestore.core.model.SnapshotMetadata;
import com.kvrestore.core.model.TableSchema;
import com.kvrestore.core.model.TransferStatus;
import com.kvrestore.core.retry.ErrorKind;
import com.kvrestore.core.retry.RemoteServiceException;
import com.kvrestore.core.util.AttributeValueJson;
import com.kvrestore.core.util.JsonUtils;
import com.kvrestore.core.util.Timestamps;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snapshot service that exports a table into the backup store and imports a stored snapshot into
 * a new table. Both transfers run on a background executor and are observed by polling, the same
 * way a managed bulk export/import service is driven.
 *
 * <p>Layout of one snapshot: {@code full-backups/<table>/<yyyyMMdd_HHmmss>/manifest.json} and
 * {@code .../data/part-00000.json.gz}, gzip JSON lines of {@code {"Item": {...}}}.
 */
public class BlobSnapshotService implements SnapshotService {

  private static final Logger log = LoggerFactory.getLogger(BlobSnapshotService.class);

  public static final String BACKUP_PREFIX = "full-backups/";
  static final String MANIFEST = "manifest.json";
  static final String DATA_DIR = "data/";
  static final String DATA_FILE = "part-00000.json.gz";
  static final String ITEM_FIELD = "Item";

  private final TableCatalog sourceCatalog;
  private final TableCatalog targetCatalog;
  private final BlobStore store;
  private final Clock clock;
  private final Executor executor;
  private final ExecutorService ownedExecutor;

  private final Map<String, TransferStatus> exports = new ConcurrentHashMap<>();
  private final Map<String, ImportProgress> imports = new ConcurrentHashMap<>();

  public BlobSnapshotService(
      TableCatalog sourceCatalog, TableCatalog targetCatalog, BlobStore store, Clock clock) {
    this(sourceCatalog, targetCatalog, store, clock, Executors.newSingleThreadExecutor(), true);
  }

  // for unit tests: Runnable::run makes every transfer finish before the request returns
  public BlobSnapshotService(
      TableCatalog sourceCatalog,
      TableCatalog targetCatalog,
      BlobStore store,
      Clock clock,
      Executor executor) {
    this(sourceCatalog, targetCatalog, store, clock, executor, false);
  }

  private BlobSnapshotService(
      TableCatalog sourceCatalog,
      TableCatalog targetCatalog,
      BlobStore store,
      Clock clock,
      Executor executor,
      boolean owned) {
    this.sourceCatalog = sourceCatalog;
    this.targetCatalog = targetCatalog;
    this.store = store;
    this.clock = clock;
    this.executor = executor;
    this.ownedExecutor = owned ? (ExecutorService) executor : null;
  }

  @Override
  public SnapshotMetadata requestExport(String tableId) {
    KeyValueTable table = sourceCatalog.openTable(tableId);
    Instant cutover = clock.instant();
    String recoveryPoint = Timestamps.recoveryPoint(cutover);
    String snapshotId = tableId + "/" + recoveryPoint;
    String location = BACKUP_PREFIX + snapshotId + "/";

    SnapshotMetadata metadata =
        SnapshotMetadata.builder()
            .snapshotId(snapshotId)
            .sourceTableId(tableId)
            .recoveryPointId(recoveryPoint)
            .cutoverTime(cutover)
            .locationReference(location)
            .status(TransferStatus.IN_PROGRESS)
            .build();

    exports.put(snapshotId, TransferStatus.IN_PROGRESS);
    writeManifest(metadata, 0);
    executor.execute(() -> export(table, metadata));
    log.info("[SnapshotService] Export {} requested for table {}", snapshotId, tableId);
    return metadata;
  }

  @Override
  public TransferStatus pollExport(String snapshotId) {
    TransferStatus status = exports.get(snapshotId);
    if (status != null) {
      return status;
    }
    String manifestKey = BACKUP_PREFIX + snapshotId + "/" + MANIFEST;
    if (!store.exists(manifestKey)) {
      throw new RemoteServiceException(ErrorKind.RESOURCE_NOT_FOUND, "Unknown export: " + snapshotId);
    }
    JsonNode manifest = JsonUtils.readTree(store.get(manifestKey));
    return TransferStatus.valueOf(manifest.path("status").asText(TransferStatus.FAILED.name()));
  }

  @Override
  public ImportHandle requestImport(String location, TableSchema schema, String newTableName) {
    if (targetCatalog.tableExists(newTableName)) {
      throw new RemoteServiceException(
          ErrorKind.RESOURCE_IN_USE, "Import target table already exists: " + newTableName);
    }
    String prefix = location.endsWith("/") ? location : location + "/";
    ImportHandle handle = new ImportHandle(UUID.randomUUID().toString(), newTableName);
    imports.put(handle.importId(), ImportProgress.inProgress(0));
    executor.execute(() -> load(handle, prefix, schema.withTableName(newTableName)));
    log.info("[SnapshotService] Import {} requested from {}", handle, prefix);
    return handle;
  }

  @Override
  public ImportProgress pollImport(ImportHandle handle) {
    ImportProgress progress = imports.get(handle.importId());
    if (progress == null) {
      throw new RemoteServiceException(ErrorKind.RESOURCE_NOT_FOUND, "Unknown import: " + handle);
    }
    return progress;
  }

  @Override
  public void close() {
    if (ownedExecutor == null) {
      return;
    }
    ownedExecutor.shutdown();
    try {
      if (!ownedExecutor.awaitTermination(1, TimeUnit.HOURS)) {
        log.warn("[SnapshotService] Transfers still running at shutdown");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[SnapshotService] Interrupted while waiting for transfers", e);
    }
  }

  private void export(KeyValueTable table, SnapshotMetadata metadata) {
    try {
      List<Map<String, AttributeValue>> items = table.scan();
      store.put(metadata.getLocationReference() + DATA_DIR + DATA_FILE, gzipLines(items));
      writeManifest(metadata.withStatus(TransferStatus.COMPLETED), items.size());
      exports.put(metadata.getSnapshotId(), TransferStatus.COMPLETED);
      log.info("[SnapshotService] Export {} completed: {} items", metadata.getSnapshotId(), items.size());
    } catch (RuntimeException e) {
      log.error("[SnapshotService] Export {} failed", metadata.getSnapshotId(), e);
      exports.put(metadata.getSnapshotId(), TransferStatus.FAILED);
      try {
        writeManifest(metadata.withStatus(TransferStatus.FAILED), 0);
      } catch (RuntimeException manifestError) {
        log.warn("[SnapshotService] Could not mark export {} as failed", metadata.getSnapshotId(), manifestError);
      }
    }
  }

  private void load(ImportHandle handle, String prefix, TableSchema schema) {
    long imported = 0;
    try {
      List<BlobObject> parts =
          store.list(prefix + DATA_DIR).stream().filter(blob -> blob.key().endsWith(".json.gz")).toList();
      if (parts.isEmpty()) {
        imports.put(handle.importId(), ImportProgress.failed("VALIDATION", "No snapshot data under " + prefix));
        log.error("[SnapshotService] Import {} failed: no data under {}", handle, prefix);
        return;
      }
      targetCatalog.createTable(schema);
      KeyValueTable table = targetCatalog.openTable(schema.getTableName());
      for (BlobObject part : parts) {
        for (String line : gunzipLines(store.get(part.key()))) {
          if (line.isBlank()) {
            continue;
          }
          table.putItem(AttributeValueJson.readItem(JsonUtils.mapper().readTree(line).get(ITEM_FIELD)));
          imported++;
        }
        imports.put(handle.importId(), ImportProgress.inProgress(imported));
      }
      imports.put(handle.importId(), ImportProgress.completed(imported));
      log.info("[SnapshotService] Import {} completed: {} items", handle, imported);
    } catch (IOException | RuntimeException e) {
      imports.put(
          handle.importId(),
          ImportProgress.failed(RemoteServiceException.kindOf(e).name(), e.getMessage()));
      log.error("[SnapshotService] Import {} failed after {} items", handle, imported, e);
    }
  }

  private void writeManifest(SnapshotMetadata metadata, long itemCount) {
    ObjectNode manifest = JsonUtils.mapper().valueToTree(metadata);
    manifest.put("item_count", itemCount);
    store.put(metadata.getLocationReference() + MANIFEST, JsonUtils.toBytes(manifest));
  }

  static byte[] gzipLines(List<Map<String, AttributeValue>> items) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (Writer writer =
        new OutputStreamWriter(new GZIPOutputStream(bytes), StandardCharsets.UTF_8)) {
      for (Map<String, AttributeValue> item : items) {
        ObjectNode line = JsonUtils.mapper().createObjectNode();
        line.set(ITEM_FIELD, AttributeValueJson.writeItem(item));
        writer.write(JsonUtils.toJson(line));
        writer.write('\n');
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to compress snapshot data", e);
    }
    return bytes.toByteArray();
  }

  static List<String> gunzipLines(byte[] body) throws IOException {
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(
                new GZIPInputStream(new ByteArrayInputStream(body)), StandardCharsets.UTF_8))) {
      return reader.lines().toList();
    }
  }
}
