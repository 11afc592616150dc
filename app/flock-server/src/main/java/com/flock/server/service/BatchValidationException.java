/*
 * Where: Flock service layer
 * What: A submitted batch failed shape or field validation
 * Why: The whole batch is rejected before anything is written or dispatched
 */
package com.flock.server.service;

public class BatchValidationException extends RuntimeException {

  private final Integer index;
  private final String field;

  public BatchValidationException(String message) {
    this(message, null, null);
  }

  public BatchValidationException(String message, Integer index, String field) {
    super(message);
    this.index = index;
    this.field = field;
  }

  /** Position of the offending element, or null when the batch itself is malformed. */
  public Integer index() {
    return index;
  }

  public String field() {
    return field;
  }
}
