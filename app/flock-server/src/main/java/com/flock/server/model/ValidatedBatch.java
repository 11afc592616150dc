/*
 * Where: Flock domain model
 * What: A submission batch whose every element passed validation
 * Why: Only validated batches may reach the writer, classifier or dispatcher
 */
package com.flock.server.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

public record ValidatedBatch(List<ObjectNode> records) {

  public ValidatedBatch {
    records = records == null ? List.of() : records.stream().map(ObjectNode::deepCopy).toList();
  }

  @Override
  public List<ObjectNode> records() {
    return records.stream().map(ObjectNode::deepCopy).toList();
  }

  public int size() {
    return records.size();
  }
}
