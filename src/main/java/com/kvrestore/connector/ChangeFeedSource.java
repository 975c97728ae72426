package com.kvrestore.connector;

import com.kvrestore.core.model.ChangeArtifact;
import com.kvrestore.core.model.ChangeBatch;
import java.util.List;

/** Read side of the captured change log. */
public interface ChangeFeedSource {

  /** Artifacts under {@code prefix} with their production time, unordered. */
  List<ChangeArtifact> listChangeArtifacts(String prefix);

  ChangeBatch getArtifact(String key);
}
