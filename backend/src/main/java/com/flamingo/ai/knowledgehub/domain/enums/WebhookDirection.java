package com.flamingo.ai.knowledgehub.domain.enums;

/** Direction of a logged webhook exchange. */
public enum WebhookDirection {
  INBOUND,
  OUTBOUND
}
