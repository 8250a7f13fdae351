package com.presales.outreach.voice;

public record CallStatusSnapshot(String callId, String status, String endedReason) {
}
