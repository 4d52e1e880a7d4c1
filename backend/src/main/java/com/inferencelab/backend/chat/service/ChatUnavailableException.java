package com.inferencelab.backend.chat.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** The assistant is not configured; the condition lasts until an operator fixes configuration. */
public class ChatUnavailableException extends ResponseStatusException {

  public ChatUnavailableException(String reason) {
    super(HttpStatus.SERVICE_UNAVAILABLE, reason);
  }
}
