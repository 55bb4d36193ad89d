package com.replyrelay.orchestrator.common.web;

/** Semantic HTTP 409, e.g. retrying a record that did not fail delivery. */
public class ConflictException extends RuntimeException {
  public ConflictException(String message) {
    super(message);
  }
}
