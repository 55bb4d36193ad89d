package com.replyrelay.orchestrator.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.replyrelay.orchestrator.RelayIntegrationTestBase;
import com.replyrelay.orchestrator.api.dto.InternalOperatorDtos;
import com.replyrelay.orchestrator.domain.ApprovalState;
import com.replyrelay.orchestrator.polling.IngestionPoller;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class InternalOperatorApiTest extends RelayIntegrationTestBase {

  @LocalServerPort int port;

  @Autowired TestRestTemplate http;
  @Autowired IngestionPoller poller;

  @Test
  void missingToken_isUnauthorized() {
    ResponseEntity<String> resp = http.getForEntity(url("/internal/blacklist"), String.class);

    assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
  }

  @Test
  void blockListAndUnblock() {
    ResponseEntity<InternalOperatorDtos.BlockResponse> blocked =
        call(
            HttpMethod.POST,
            "/internal/conversations/troll/block",
            new InternalOperatorDtos.BlockRequest("spam"),
            InternalOperatorDtos.BlockResponse.class);
    assertThat(blocked.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(blocked.getBody().changed()).isTrue();

    ResponseEntity<InternalOperatorDtos.BlacklistResponse> list =
        call(
            HttpMethod.GET,
            "/internal/blacklist",
            null,
            InternalOperatorDtos.BlacklistResponse.class);
    assertThat(list.getBody().entries())
        .extracting(InternalOperatorDtos.BlacklistEntryDto::conversationId)
        .containsExactly("troll");

    ResponseEntity<InternalOperatorDtos.BlockResponse> unblocked =
        call(
            HttpMethod.DELETE,
            "/internal/conversations/troll/block",
            null,
            InternalOperatorDtos.BlockResponse.class);
    assertThat(unblocked.getBody().changed()).isTrue();
    assertThat(store.isBlacklisted("troll")).isFalse();
  }

  @Test
  void tagAndConversationView() {
    when(ai.complete(anyList())).thenReturn("hi there");
    inbound("uma", "m1", 1, "hello");
    poller.tick();

    ResponseEntity<InternalOperatorDtos.SetTagResponse> tagged =
        call(
            HttpMethod.PUT,
            "/internal/conversations/uma/tag",
            new InternalOperatorDtos.SetTagRequest("premium"),
            InternalOperatorDtos.SetTagResponse.class);
    assertThat(tagged.getBody().tag()).isEqualTo("premium");

    ResponseEntity<JsonNode> view =
        call(HttpMethod.GET, "/internal/conversations/uma", null, JsonNode.class);
    assertThat(view.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(view.getBody().path("subscriptionTag").asText()).isEqualTo("PREMIUM");
    assertThat(view.getBody().path("openApprovalState").asText())
        .isEqualTo(ApprovalState.PENDING.name());

    ResponseEntity<InternalOperatorDtos.OpenApprovalsResponse> open =
        call(
            HttpMethod.GET,
            "/internal/approvals/open",
            null,
            InternalOperatorDtos.OpenApprovalsResponse.class);
    assertThat(open.getBody().approvals())
        .extracting(InternalOperatorDtos.ApprovalDto::conversationId)
        .containsExactly("uma");
  }

  @Test
  void errorsUseStableCodes() {
    ResponseEntity<JsonNode> unknown =
        call(HttpMethod.GET, "/internal/conversations/nobody", null, JsonNode.class);
    assertThat(unknown.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(unknown.getBody().path("code").asText()).isEqualTo("NOT_FOUND");

    ResponseEntity<JsonNode> badTag =
        call(
            HttpMethod.PUT,
            "/internal/conversations/uma/tag",
            new InternalOperatorDtos.SetTagRequest("gold"),
            JsonNode.class);
    assertThat(badTag.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);

    ResponseEntity<JsonNode> retry =
        call(HttpMethod.POST, "/internal/approvals/31337/retry", null, JsonNode.class);
    assertThat(retry.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  private <T> ResponseEntity<T> call(HttpMethod method, String path, Object body, Class<T> type) {
    HttpHeaders headers = new HttpHeaders();
    headers.set("X-Internal-Token", "test-token");
    headers.setContentType(MediaType.APPLICATION_JSON);
    return http.exchange(url(path), method, new HttpEntity<>(body, headers), type);
  }

  private String url(String path) {
    return "http://localhost:" + port + path;
  }
}
