package com.inferencelab.backend.chat.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.inferencelab.backend.chat.domain.ChatMessage;
import com.inferencelab.backend.chat.domain.Transcript;
import com.inferencelab.backend.chat.support.ScriptedAssistant;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class TurnGraphTest {

  @Test
  void singleNodeGraphAppendsAssistantReply() {
    ScriptedAssistant assistant = ScriptedAssistant.replying("hey");
    TurnGraph graph = TurnGraph.builder().addNode(new AssistantReplyNode(assistant)).compile();
    Transcript input = Transcript.of(ChatMessage.user("hi"));

    TurnExecution execution = graph.execute(input);
    assertThat(execution.state()).isEqualTo(TurnState.READY);

    StepVerifier.create(execution.result())
        .assertNext(
            output ->
                assertThat(output.messages())
                    .containsExactly(ChatMessage.user("hi"), ChatMessage.assistant("hey")))
        .verifyComplete();

    assertThat(execution.state()).isEqualTo(TurnState.COMPLETED);
    assertThat(execution.transitions())
        .containsExactly(TurnState.READY, TurnState.INVOKING, TurnState.COMPLETED);
    assertThat(assistant.transcripts()).containsExactly(input);
    assertThat(graph.nodeNames()).containsExactly(AssistantReplyNode.NAME);
  }

  @Test
  void assistantErrorPropagatesUnmodified() {
    IllegalStateException upstream = new IllegalStateException("upstream unavailable");
    TurnGraph graph =
        TurnGraph.builder()
            .addNode(new AssistantReplyNode(ScriptedAssistant.failing(upstream)))
            .compile();

    TurnExecution execution = graph.execute(Transcript.of(ChatMessage.user("hi")));

    StepVerifier.create(execution.result())
        .expectErrorSatisfies(error -> assertThat(error).isSameAs(upstream))
        .verify();
    assertThat(execution.state()).isEqualTo(TurnState.FAILED);
    assertThat(execution.transitions())
        .containsExactly(TurnState.READY, TurnState.INVOKING, TurnState.FAILED);
  }

  @Test
  void emptyTranscriptFailsWithoutInvokingAssistant() {
    ScriptedAssistant assistant = ScriptedAssistant.replying("unused");
    TurnGraph graph = TurnGraph.builder().addNode(new AssistantReplyNode(assistant)).compile();

    TurnExecution execution = graph.execute(Transcript.empty());

    StepVerifier.create(execution.result()).expectError(IllegalStateException.class).verify();
    assertThat(execution.transitions()).containsExactly(TurnState.READY, TurnState.FAILED);
    assertThat(assistant.transcripts()).isEmpty();
  }

  @Test
  void emptyAssistantReplyFailsTheTurn() {
    TurnGraph graph =
        TurnGraph.builder()
            .addNode(new AssistantReplyNode(new ScriptedAssistant(transcript -> Mono.empty())))
            .compile();

    StepVerifier.create(graph.run(Transcript.of(ChatMessage.user("hi"))))
        .expectErrorMessage("Assistant returned no reply")
        .verify();
  }

  @Test
  void nodesRunInInsertionOrder() {
    ScriptedAssistant assistant = ScriptedAssistant.replying("filtered answer");
    TurnNode annotate =
        new TurnNode() {
          @Override
          public String name() {
            return "annotate";
          }

          @Override
          public Mono<Transcript> apply(Transcript transcript) {
            return Mono.just(transcript.append(ChatMessage.system("answer briefly")));
          }
        };

    TurnGraph graph =
        TurnGraph.builder().addNode(annotate).addNode(new AssistantReplyNode(assistant)).compile();

    StepVerifier.create(graph.run(Transcript.of(ChatMessage.user("hi"))))
        .assertNext(output -> assertThat(output.size()).isEqualTo(3))
        .verifyComplete();

    assertThat(graph.nodeNames()).containsExactly("annotate", AssistantReplyNode.NAME);
    assertThat(assistant.lastTranscript().lastMessage())
        .isEqualTo(ChatMessage.system("answer briefly"));
  }

  @Test
  void secondSubscriptionIsRejected() {
    TurnGraph graph =
        TurnGraph.builder()
            .addNode(new AssistantReplyNode(ScriptedAssistant.replying("hey")))
            .compile();
    TurnExecution execution = graph.execute(Transcript.of(ChatMessage.user("hi")));

    StepVerifier.create(execution.result()).expectNextCount(1).verifyComplete();
    StepVerifier.create(execution.result()).expectError(IllegalStateException.class).verify();
    assertThat(execution.state()).isEqualTo(TurnState.COMPLETED);
  }

  @Test
  void builderRejectsInvalidTopologies() {
    assertThatThrownBy(() -> TurnGraph.builder().compile())
        .isInstanceOf(IllegalStateException.class);

    TurnGraph.Builder builder =
        TurnGraph.builder().addNode(new AssistantReplyNode(ScriptedAssistant.replying("a")));
    assertThatThrownBy(
            () -> builder.addNode(new AssistantReplyNode(ScriptedAssistant.replying("b"))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining(AssistantReplyNode.NAME);
  }
}
