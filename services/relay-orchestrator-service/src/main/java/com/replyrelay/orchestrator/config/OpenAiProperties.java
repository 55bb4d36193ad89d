package com.replyrelay.orchestrator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "relay.openai")
public record OpenAiProperties(
    String baseUrl,
    String apiKey,
    String model,
    String assistantId,
    String transcriptionModel,
    String transcriptionLanguage,
    Duration runPollInterval) {

  public OpenAiProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.openai.com/v1" : baseUrl;
    apiKey = apiKey == null ? "" : apiKey.trim();
    model = model == null || model.isBlank() ? "gpt-4o-mini" : model;
    transcriptionModel =
        transcriptionModel == null || transcriptionModel.isBlank()
            ? "whisper-1"
            : transcriptionModel;
    runPollInterval = runPollInterval == null ? Duration.ofSeconds(1) : runPollInterval;
  }
}
