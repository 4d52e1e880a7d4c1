package com.inferencelab.backend.chat.support;

import com.inferencelab.backend.chat.domain.Transcript;
import com.inferencelab.backend.chat.provider.AssistantCapability;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import reactor.core.publisher.Mono;

/** Assistant double that answers with a scripted publisher and records every transcript. */
public class ScriptedAssistant implements AssistantCapability {

  private final List<Transcript> transcripts = new CopyOnWriteArrayList<>();
  private final Function<Transcript, Mono<String>> script;

  public ScriptedAssistant(Function<Transcript, Mono<String>> script) {
    this.script = script;
  }

  public static ScriptedAssistant replying(String reply) {
    return new ScriptedAssistant(transcript -> Mono.just(reply));
  }

  public static ScriptedAssistant failing(RuntimeException error) {
    return new ScriptedAssistant(transcript -> Mono.error(error));
  }

  @Override
  public String modelId() {
    return "scripted-model";
  }

  @Override
  public Mono<String> reply(Transcript transcript) {
    return Mono.defer(
        () -> {
          transcripts.add(transcript);
          return script.apply(transcript);
        });
  }

  public List<Transcript> transcripts() {
    return List.copyOf(transcripts);
  }

  public Transcript lastTranscript() {
    return transcripts.get(transcripts.size() - 1);
  }
}
