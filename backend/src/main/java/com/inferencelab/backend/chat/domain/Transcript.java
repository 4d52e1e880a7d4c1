package com.inferencelab.backend.chat.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Immutable, ordered context window sent to the assistant on every turn.
 *
 * <p>Ordering and roles are taken as given: a transcript carrying several system messages, or a
 * system message in the middle, is passed through unchanged.
 */
public final class Transcript {

  private static final Transcript EMPTY = new Transcript(List.of());

  private final List<ChatMessage> messages;

  private Transcript(List<ChatMessage> messages) {
    this.messages = messages;
  }

  public static Transcript empty() {
    return EMPTY;
  }

  public static Transcript of(List<ChatMessage> messages) {
    if (messages == null || messages.isEmpty()) {
      return EMPTY;
    }
    return new Transcript(List.copyOf(messages));
  }

  public static Transcript of(ChatMessage... messages) {
    return of(List.of(messages));
  }

  public Transcript append(ChatMessage message) {
    List<ChatMessage> next = new ArrayList<>(messages.size() + 1);
    next.addAll(messages);
    next.add(message);
    return new Transcript(Collections.unmodifiableList(next));
  }

  public List<ChatMessage> messages() {
    return messages;
  }

  public int size() {
    return messages.size();
  }

  public boolean isEmpty() {
    return messages.isEmpty();
  }

  public ChatMessage lastMessage() {
    if (messages.isEmpty()) {
      throw new NoSuchElementException("Transcript is empty");
    }
    return messages.get(messages.size() - 1);
  }

  public boolean hasSystemDirective() {
    return !messages.isEmpty() && messages.get(0).isSystem();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof Transcript transcript && messages.equals(transcript.messages);
  }

  @Override
  public int hashCode() {
    return messages.hashCode();
  }

  @Override
  public String toString() {
    return "Transcript" + messages;
  }
}
