package com.flamingo.ai.knowledgehub.service.webhook.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A meeting transcript was synced and indexed. */
public record MeetingSyncedEvent(
    String partnerId,
    Instant timestamp,
    String meetingId,
    String externalMeetingId,
    String title,
    List<String> participants,
    Integer durationMinutes)
    implements OutboundEvent {

  @Override
  public String type() {
    return OutboundEventType.MEETING_SYNCED.getWireName();
  }

  @Override
  public Map<String, Object> data() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("meeting_id", meetingId);
    data.put("fireflies_id", externalMeetingId);
    data.put("title", title);
    data.put("participants", participants == null ? List.of() : participants);
    data.put("duration_minutes", durationMinutes);
    return data;
  }
}
