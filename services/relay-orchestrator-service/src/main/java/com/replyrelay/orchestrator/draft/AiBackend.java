package com.replyrelay.orchestrator.draft;

import java.nio.file.Path;
import java.util.List;

/**
 * External AI backend. Implementations convert transport failures into {@link
 * com.replyrelay.orchestrator.common.RelayException}.
 */
public interface AiBackend {

  boolean isConfigured();

  /** Stateless completion over a fully built prompt. */
  String complete(List<PromptMessage> prompt);

  /** Creates a server-side conversation and returns its handle. */
  String createSession();

  /** Adds {@code text} to the session and returns the backend's reply. */
  String continueSession(String sessionHandle, String text);

  String transcribe(Path audioFile);
}
