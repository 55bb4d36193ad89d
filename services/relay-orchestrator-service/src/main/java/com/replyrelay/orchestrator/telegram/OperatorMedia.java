package com.replyrelay.orchestrator.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * A photo, video or document the operator sent as a reply. {@code label} is what the record and
 * the audit show instead of text.
 */
record OperatorMedia(String fileId, String fileName, String label) {

  static Optional<OperatorMedia> from(JsonNode message) {
    JsonNode photos = message.path("photo");
    if (photos.isArray() && !photos.isEmpty()) {
      // sizes come smallest first
      JsonNode largest = photos.get(photos.size() - 1);
      return of(largest.path("file_id").asText(""), null, "[Photo]");
    }
    JsonNode video = message.path("video");
    if (video.isObject()) {
      return of(video.path("file_id").asText(""), video.path("file_name").asText(null), "[Video]");
    }
    JsonNode document = message.path("document");
    if (document.isObject()) {
      String name = document.path("file_name").asText(null);
      String label = name == null || name.isBlank() ? "[Document]" : "[Document: " + name + "]";
      return of(document.path("file_id").asText(""), name, label);
    }
    return Optional.empty();
  }

  private static Optional<OperatorMedia> of(String fileId, String fileName, String label) {
    return fileId.isBlank()
        ? Optional.empty()
        : Optional.of(new OperatorMedia(fileId, fileName, label));
  }
}
