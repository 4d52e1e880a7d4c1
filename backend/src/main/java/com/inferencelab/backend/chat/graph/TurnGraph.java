package com.inferencelab.backend.chat.graph;

import com.inferencelab.backend.chat.domain.Transcript;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Compiled, immutable topology executed once per chat turn.
 *
 * <p>Nodes run in insertion order, each one receiving the transcript emitted by its predecessor.
 * Today the graph holds a single {@link AssistantReplyNode}; moderation or tool-use stages are
 * added as extra nodes without changing {@link #run(Transcript)}.
 */
public final class TurnGraph {

  private final List<TurnNode> nodes;

  private TurnGraph(List<TurnNode> nodes) {
    this.nodes = List.copyOf(nodes);
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<String> nodeNames() {
    return nodes.stream().map(TurnNode::name).toList();
  }

  public TurnExecution execute(Transcript transcript) {
    return new TurnExecution(transcript, nodes);
  }

  /** Runs the graph and emits the input transcript extended with every node's output. */
  public Mono<Transcript> run(Transcript transcript) {
    return execute(transcript).result();
  }

  public static final class Builder {

    private final List<TurnNode> nodes = new ArrayList<>();
    private final Set<String> names = new HashSet<>();

    private Builder() {}

    public Builder addNode(TurnNode node) {
      Assert.notNull(node, "node must not be null");
      Assert.hasText(node.name(), "node name must not be empty");
      Assert.isTrue(names.add(node.name()), () -> "Duplicate node name: " + node.name());
      nodes.add(node);
      return this;
    }

    public TurnGraph compile() {
      Assert.state(!nodes.isEmpty(), "Turn graph requires at least one node");
      return new TurnGraph(nodes);
    }
  }
}
