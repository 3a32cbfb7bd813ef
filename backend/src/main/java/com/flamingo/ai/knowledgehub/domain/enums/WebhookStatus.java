package com.flamingo.ai.knowledgehub.domain.enums;

/** Delivery state of a logged webhook exchange. */
public enum WebhookStatus {
  /** Recorded before the outcome is known. */
  PENDING,

  /** The endpoint accepted the event. */
  SUCCESS,

  /** Every attempt failed. */
  ERROR
}
