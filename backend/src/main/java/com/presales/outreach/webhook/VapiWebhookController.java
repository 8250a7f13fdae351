package com.presales.outreach.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.presales.outreach.common.OutreachException;
import com.presales.outreach.engine.CallEvent;
import com.presales.outreach.engine.CallEventParser;
import com.presales.outreach.engine.CallStatusStateMachine;
import com.presales.outreach.engine.EventOutcome;
import com.presales.outreach.voice.VapiProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/** Receives Vapi server messages. Unknown leads and untracked event types are acknowledged and dropped. */
@RestController
@RequestMapping("/webhook")
public class VapiWebhookController {
  private static final Logger log = LoggerFactory.getLogger(VapiWebhookController.class);
  static final String SECRET_HEADER = "x-vapi-secret";

  private final CallEventParser parser;
  private final CallStatusStateMachine stateMachine;
  private final VapiProperties properties;

  public VapiWebhookController(CallEventParser parser, CallStatusStateMachine stateMachine, VapiProperties properties) {
    this.parser = parser;
    this.stateMachine = stateMachine;
    this.properties = properties;
  }

  @PostMapping("/vapi")
  public Map<String, Object> vapi(@RequestBody JsonNode payload,
                                  @RequestHeader(value = SECRET_HEADER, required = false) String secret) {
    verifySecret(secret);
    CallEvent event = parser.parse(payload);
    if (properties.isDebug()) {
      log.info("Vapi webhook type={} leadId={} callId={} status={}", event.type(), event.leadId(), event.callId(), event.status());
    }
    EventOutcome outcome = stateMachine.handle(event);
    return outcome.toBody();
  }

  private void verifySecret(String provided) {
    String expected = properties.getWebhookSecret();
    if (!StringUtils.hasText(expected)) {
      return;
    }
    boolean matches = provided != null && MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
    if (!matches) {
      log.warn("Vapi webhook rejected: shared secret mismatch");
      throw new OutreachException(HttpStatus.UNAUTHORIZED, "WEBHOOK_SECRET_INVALID", "Webhook secret missing or invalid");
    }
  }
}
