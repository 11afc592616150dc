/*
 * Where: Flock domain model
 * What: Outcome of writing one batch into its day partition
 * Why: The classifier works on the stamped documents that were written
 */
package com.flock.server.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

public record PartitionWriteResult(
    String partition, int written, int failed, List<ObjectNode> records) {

  public PartitionWriteResult {
    records = records == null ? List.of() : records.stream().map(ObjectNode::deepCopy).toList();
  }

  @Override
  public List<ObjectNode> records() {
    return records.stream().map(ObjectNode::deepCopy).toList();
  }
}
