package com.flamingo.ai.knowledgehub.service.webhook.event;

/** Known event types and the automation endpoint path each one is posted to. */
public enum OutboundEventType {
  NEW_DOCUMENT("new_document", "/webhook/document"),
  CHAT_QUERY("chat_query", "/webhook/chat"),
  CONTENT_GENERATED("content_generated", "/webhook/content"),
  MEETING_SYNCED("meeting_synced", "/webhook/meeting"),
  AIRTABLE_UPDATED("airtable_updated", "/webhook/airtable");

  public static final String GENERAL_PATH = "/webhook/general";

  private final String wireName;
  private final String path;

  OutboundEventType(String wireName, String path) {
    this.wireName = wireName;
    this.path = path;
  }

  public String getWireName() {
    return wireName;
  }

  public String getPath() {
    return path;
  }

  /** Endpoint path for a wire name; unknown names go to the general endpoint. */
  public static String pathFor(String wireName) {
    for (OutboundEventType type : values()) {
      if (type.wireName.equals(wireName)) {
        return type.path;
      }
    }
    return GENERAL_PATH;
  }
}
