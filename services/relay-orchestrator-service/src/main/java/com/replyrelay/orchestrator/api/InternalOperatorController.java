package com.replyrelay.orchestrator.api;

import com.replyrelay.orchestrator.api.dto.InternalOperatorDtos;
import com.replyrelay.orchestrator.operator.ConversationSummary;
import com.replyrelay.orchestrator.operator.OperatorService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operator commands over HTTP, guarded by the internal token filter. */
@RestController
@RequestMapping("/internal")
public class InternalOperatorController {

  private final OperatorService operator;

  public InternalOperatorController(OperatorService operator) {
    this.operator = operator;
  }

  @GetMapping("/conversations/{id}")
  public ConversationSummary conversation(@PathVariable("id") String conversationId) {
    return operator.conversation(conversationId);
  }

  @PutMapping("/conversations/{id}/tag")
  public InternalOperatorDtos.SetTagResponse setTag(
      @PathVariable("id") String conversationId,
      @Valid @RequestBody InternalOperatorDtos.SetTagRequest req) {
    return new InternalOperatorDtos.SetTagResponse(
        conversationId, operator.setTag(conversationId, req.tag()).label());
  }

  @PostMapping("/conversations/{id}/block")
  public InternalOperatorDtos.BlockResponse block(
      @PathVariable("id") String conversationId,
      @RequestBody(required = false) InternalOperatorDtos.BlockRequest req) {
    boolean changed = operator.block(conversationId, req == null ? null : req.reason());
    return new InternalOperatorDtos.BlockResponse(conversationId, true, changed);
  }

  @DeleteMapping("/conversations/{id}/block")
  public InternalOperatorDtos.BlockResponse unblock(@PathVariable("id") String conversationId) {
    boolean changed = operator.unblock(conversationId);
    return new InternalOperatorDtos.BlockResponse(conversationId, false, changed);
  }

  @GetMapping("/blacklist")
  public InternalOperatorDtos.BlacklistResponse blacklist() {
    return new InternalOperatorDtos.BlacklistResponse(
        operator.blacklist().stream().map(InternalOperatorDtos.BlacklistEntryDto::of).toList());
  }

  @GetMapping("/approvals/open")
  public InternalOperatorDtos.OpenApprovalsResponse openApprovals() {
    return new InternalOperatorDtos.OpenApprovalsResponse(
        operator.openApprovals().stream().map(InternalOperatorDtos.ApprovalDto::of).toList());
  }

  @PostMapping("/approvals/{id}/retry")
  public InternalOperatorDtos.RetryResponse retry(@PathVariable("id") Long approvalId) {
    operator.retry(approvalId);
    return new InternalOperatorDtos.RetryResponse(approvalId, true);
  }
}
