package com.presales.outreach.messaging;

import java.util.Map;

public interface EmailGateway {
  MessageSendResult send(String to, String subject, String body, Map<String, String> headers);
}
