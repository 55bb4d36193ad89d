package com.replyrelay.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "relay.executor")
public record ExecutorProperties(
    int workerThreads, int draftThreads, int deliveryThreads, int auditThreads) {

  public ExecutorProperties {
    workerThreads = workerThreads <= 0 ? 8 : workerThreads;
    draftThreads = draftThreads <= 0 ? 8 : draftThreads;
    deliveryThreads = deliveryThreads <= 0 ? 4 : deliveryThreads;
    auditThreads = auditThreads <= 0 ? 2 : auditThreads;
  }
}
