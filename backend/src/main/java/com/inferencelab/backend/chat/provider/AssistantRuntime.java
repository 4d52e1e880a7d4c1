package com.inferencelab.backend.chat.provider;

import com.inferencelab.backend.chat.graph.TurnGraph;
import java.util.Optional;

/**
 * Startup-time snapshot of the chat backend. Either both the assistant and its turn graph are
 * present, or the service runs in the unavailable state. Never mutated after construction.
 */
public final class AssistantRuntime {

  private final AssistantCapability assistant;
  private final TurnGraph graph;
  private final boolean credentialConfigured;

  private AssistantRuntime(
      AssistantCapability assistant, TurnGraph graph, boolean credentialConfigured) {
    this.assistant = assistant;
    this.graph = graph;
    this.credentialConfigured = credentialConfigured;
  }

  public static AssistantRuntime ready(AssistantCapability assistant, TurnGraph graph) {
    return new AssistantRuntime(assistant, graph, true);
  }

  public static AssistantRuntime unavailable(boolean credentialConfigured) {
    return new AssistantRuntime(null, null, credentialConfigured);
  }

  public Optional<AssistantCapability> assistant() {
    return Optional.ofNullable(assistant);
  }

  public Optional<TurnGraph> graph() {
    return Optional.ofNullable(graph);
  }

  public boolean isModelLoaded() {
    return assistant != null;
  }

  public boolean isGraphReady() {
    return graph != null;
  }

  public boolean isAvailable() {
    return isModelLoaded() && isGraphReady();
  }

  public boolean isCredentialConfigured() {
    return credentialConfigured;
  }
}
