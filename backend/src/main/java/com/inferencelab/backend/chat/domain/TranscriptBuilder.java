package com.inferencelab.backend.chat.domain;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Assembles the transcript for a single turn from the caller-owned history and the new user
 * message.
 */
@Component
public class TranscriptBuilder {

  /**
   * Builds the transcript, treating an empty {@code priorHistory} as the first turn of the
   * conversation. The system directive is only prepended on the first turn.
   */
  public Transcript buildTranscript(
      List<ChatMessage> priorHistory, String newUserText, String systemDirective) {
    boolean firstTurn = priorHistory == null || priorHistory.isEmpty();
    return buildTranscript(priorHistory, newUserText, systemDirective, firstTurn);
  }

  public Transcript buildTranscript(
      List<ChatMessage> priorHistory,
      String newUserText,
      String systemDirective,
      boolean injectDirective) {
    List<ChatMessage> history = priorHistory != null ? priorHistory : List.of();
    List<ChatMessage> messages = new ArrayList<>(history.size() + 2);
    if (injectDirective && StringUtils.hasText(systemDirective)) {
      messages.add(ChatMessage.system(systemDirective));
    }
    messages.addAll(history);
    messages.add(ChatMessage.user(newUserText));
    return Transcript.of(messages);
  }
}
