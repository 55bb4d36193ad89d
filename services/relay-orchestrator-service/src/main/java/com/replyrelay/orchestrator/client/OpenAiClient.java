package com.replyrelay.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.replyrelay.orchestrator.common.RelayErrorKind;
import com.replyrelay.orchestrator.common.RelayException;
import com.replyrelay.orchestrator.config.OpenAiProperties;
import com.replyrelay.orchestrator.draft.AiBackend;
import com.replyrelay.orchestrator.draft.PromptMessage;
import java.net.SocketTimeoutException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/** OpenAI over plain REST: chat completions, assistants threads and audio transcription. */
@Component
@Slf4j
public class OpenAiClient implements AiBackend {

  private static final String BETA_HEADER = "OpenAI-Beta";
  private static final String BETA_ASSISTANTS = "assistants=v2";
  private static final Set<String> RUN_FAILED = Set.of("failed", "cancelled", "expired");

  private final RestClient rest;
  private final OpenAiProperties properties;

  public OpenAiClient(RestClient openAiRestClient, OpenAiProperties properties) {
    this.rest = openAiRestClient;
    this.properties = properties;
  }

  @Override
  public boolean isConfigured() {
    return !properties.apiKey().isBlank();
  }

  @Override
  public String complete(List<PromptMessage> prompt) {
    List<Map<String, String>> messages = new ArrayList<>();
    for (PromptMessage m : prompt) {
      messages.add(Map.of("role", m.role(), "content", m.content()));
    }
    Map<String, Object> body = new HashMap<>();
    body.put("model", properties.model());
    body.put("messages", messages);

    JsonNode resp =
        call(
            "chat completion",
            () -> rest.post().uri("/chat/completions").body(body).retrieve().body(JsonNode.class));
    String text = resp.path("choices").path(0).path("message").path("content").asText("");
    if (text.isBlank()) {
      throw new RelayException(RelayErrorKind.TRANSIENT_IO, "chat completion returned no content");
    }
    return text;
  }

  @Override
  public String createSession() {
    JsonNode resp =
        call(
            "create thread",
            () ->
                rest.post()
                    .uri("/threads")
                    .header(BETA_HEADER, BETA_ASSISTANTS)
                    .body(Map.of())
                    .retrieve()
                    .body(JsonNode.class));
    String id = resp.path("id").asText("");
    if (id.isBlank()) {
      throw new RelayException(RelayErrorKind.TRANSIENT_IO, "thread creation returned no id");
    }
    return id;
  }

  @Override
  public String continueSession(String threadId, String text) {
    String assistantId = properties.assistantId();
    if (assistantId == null || assistantId.isBlank()) {
      throw new RelayException(
          RelayErrorKind.TRANSIENT_IO, "relay.openai.assistant-id is not configured");
    }
    call(
        "add thread message",
        () ->
            rest.post()
                .uri("/threads/{thread}/messages", threadId)
                .header(BETA_HEADER, BETA_ASSISTANTS)
                .body(Map.of("role", "user", "content", text))
                .retrieve()
                .body(JsonNode.class));

    JsonNode run =
        call(
            "create run",
            () ->
                rest.post()
                    .uri("/threads/{thread}/runs", threadId)
                    .header(BETA_HEADER, BETA_ASSISTANTS)
                    .body(Map.of("assistant_id", assistantId))
                    .retrieve()
                    .body(JsonNode.class));
    awaitRun(threadId, run.path("id").asText(""));

    JsonNode messages =
        call(
            "list thread messages",
            () ->
                rest.get()
                    .uri("/threads/{thread}/messages?limit=1&order=desc", threadId)
                    .header(BETA_HEADER, BETA_ASSISTANTS)
                    .retrieve()
                    .body(JsonNode.class));
    JsonNode latest = messages.path("data").path(0);
    if (!"assistant".equals(latest.path("role").asText())) {
      throw new RelayException(RelayErrorKind.TRANSIENT_IO, "no assistant reply in thread");
    }
    return latest.path("content").path(0).path("text").path("value").asText("");
  }

  @Override
  public String transcribe(Path audioFile) {
    MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
    form.add("file", new FileSystemResource(audioFile));
    form.add("model", properties.transcriptionModel());
    form.add("response_format", "text");
    String language = properties.transcriptionLanguage();
    if (language != null && !language.isBlank() && !"none".equalsIgnoreCase(language)) {
      form.add("language", language);
    }
    String text =
        call(
            "transcription",
            () ->
                rest.post()
                    .uri("/audio/transcriptions")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(form)
                    .retrieve()
                    .body(String.class));
    return text == null ? "" : text.trim();
  }

  /** Polls the run until it completes; the caller's timeout interrupts this thread. */
  private void awaitRun(String threadId, String runId) {
    if (runId.isBlank()) {
      throw new RelayException(RelayErrorKind.TRANSIENT_IO, "run creation returned no id");
    }
    while (true) {
      JsonNode run =
          call(
              "retrieve run",
              () ->
                  rest.get()
                      .uri("/threads/{thread}/runs/{run}", threadId, runId)
                      .header(BETA_HEADER, BETA_ASSISTANTS)
                      .retrieve()
                      .body(JsonNode.class));
      String status = run.path("status").asText("");
      if ("completed".equals(status)) {
        return;
      }
      if (RUN_FAILED.contains(status)) {
        throw new RelayException(RelayErrorKind.TRANSIENT_IO, "assistant run " + status);
      }
      try {
        Thread.sleep(properties.runPollInterval().toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RelayException(RelayErrorKind.TIMEOUT, "interrupted while awaiting run", e);
      }
    }
  }

  private <T> T call(String what, Supplier<T> request) {
    try {
      T result = request.get();
      if (result == null) {
        throw new RelayException(RelayErrorKind.TRANSIENT_IO, what + " returned empty body");
      }
      return result;
    } catch (RestClientResponseException e) {
      log.warn("OpenAI {} failed: {} {}", what, e.getStatusCode(), e.getResponseBodyAsString());
      throw new RelayException(
          RelayErrorKind.TRANSIENT_IO, what + " failed with " + e.getStatusCode(), e);
    } catch (ResourceAccessException e) {
      RelayErrorKind kind =
          e.getCause() instanceof SocketTimeoutException
              ? RelayErrorKind.TIMEOUT
              : RelayErrorKind.TRANSIENT_IO;
      throw new RelayException(kind, what + " failed: " + e.getMessage(), e);
    } catch (RestClientException e) {
      throw new RelayException(RelayErrorKind.TRANSIENT_IO, what + " failed: " + e.getMessage(), e);
    }
  }
}
