package com.kvrestore.command;

import static com.kvrestore.core.config.ConfigKeys.*;

import com.kvrestore.connector.feed.ChangeFeedPublisher;
import com.kvrestore.core.config.ScopedConfig;
import com.kvrestore.core.launcher.CommandArgs;
import com.kvrestore.core.launcher.RecoveryCommand;
import com.kvrestore.core.model.ChangeRecord;
import com.kvrestore.core.util.StreamRecordCodec;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code publish-changes --input-file records.json --backup-root DIR [--change-prefix P]}
 *
 * <p>Seeds the change feed with captured stream records, either a JSON array or a {@code
 * {"Records": [...]}} envelope.
 */
public class PublishChangesCommand implements RecoveryCommand {

  private static final Logger log = LoggerFactory.getLogger(PublishChangesCommand.class);
  public static final String NAME = "publish-changes";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int run(String[] rawArgs) {
    ScopedConfig.activateCommand(name());
    CommandArgs args = CommandArgs.parse(rawArgs);
    Path input = Path.of(args.require(INPUT_FILE));

    try (RecoveryEnvironment env = new RecoveryEnvironment(args)) {
      env.getBackupStore().verifyAccessible();
      publish(env.changeFeedPublisher(), input);
      return 0;
    }
  }

  static Optional<String> publish(ChangeFeedPublisher publisher, Path input) {
    List<ChangeRecord> records;
    try {
      records = StreamRecordCodec.parseArtifact(Files.readAllBytes(input));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read " + input, e);
    }
    Optional<String> key = publisher.publish(records);
    if (key.isEmpty()) {
      log.warn("[PublishChanges] {} holds no records, nothing published", input);
    }
    return key;
  }
}
