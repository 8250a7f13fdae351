package com.presales.outreach.messaging;

import java.util.List;

public interface WhatsAppGateway {
  MessageSendResult sendTemplate(String to, String templateName, String languageCode, List<String> bodyParameters);
}
