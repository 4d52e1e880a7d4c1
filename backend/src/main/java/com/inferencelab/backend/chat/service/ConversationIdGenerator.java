package com.inferencelab.backend.chat.service;

import java.time.Clock;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Mints identifiers of the form {@code conv_<epochSeconds>_<token>}. */
@Component
public class ConversationIdGenerator {

  private static final String PREFIX = "conv_";

  private final Clock clock;

  public ConversationIdGenerator(Clock clock) {
    this.clock = clock;
  }

  public String mint() {
    String token = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    return PREFIX + clock.instant().getEpochSecond() + "_" + token;
  }
}
