package com.presales.outreach.voice;

import com.presales.outreach.domain.Lead;

import java.util.Optional;

public interface VoiceGateway {
  /** Never throws for provider rejections; those come back as a failed result. */
  CallInitiationResult initiate(Lead lead, String assistantId, String phoneNumberId);

  Optional<CallStatusSnapshot> getStatus(String callId);

  Optional<String> getTranscript(String callId);
}
