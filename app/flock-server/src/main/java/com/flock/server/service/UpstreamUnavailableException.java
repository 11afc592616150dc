/*
 * Where: Flock service layer
 * What: The document store could not accept any record of a batch
 * Why: The client only learns about a generic submission failure
 */
package com.flock.server.service;

public class UpstreamUnavailableException extends RuntimeException {

  public UpstreamUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
