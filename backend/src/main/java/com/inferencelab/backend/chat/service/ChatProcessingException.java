package com.inferencelab.backend.chat.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** A chat turn failed after it was accepted: the assistant errored, timed out or replied badly. */
public class ChatProcessingException extends ResponseStatusException {

  public ChatProcessingException(String cause, Throwable throwable) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, "Error processing chat: " + cause, throwable);
  }
}
