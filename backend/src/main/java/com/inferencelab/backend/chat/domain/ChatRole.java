package com.inferencelab.backend.chat.domain;

import java.util.Locale;

public enum ChatRole {
  SYSTEM("system"),
  USER("user"),
  ASSISTANT("assistant");

  private final String wireValue;

  ChatRole(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  /**
   * Resolves a role from its wire value, ignoring case and surrounding whitespace.
   *
   * @throws IllegalArgumentException when the value does not name a known role
   */
  public static ChatRole from(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Message role must not be empty");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ChatRole role : values()) {
      if (role.wireValue.equals(normalized)) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unsupported message role: " + value);
  }
}
