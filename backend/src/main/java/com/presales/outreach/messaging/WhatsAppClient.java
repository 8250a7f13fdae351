package com.presales.outreach.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.time.Duration;
import java.util.*;

/** WhatsApp Cloud API template sender. */
@Component
public class WhatsAppClient implements WhatsAppGateway {
  private static final Logger log = LoggerFactory.getLogger(WhatsAppClient.class);
  static final String DRY_RUN_MESSAGE_ID = "wamid.DRY_RUN_MESSAGE";

  private final WhatsAppProperties properties;
  private final ObjectMapper mapper = new ObjectMapper();
  private final Duration connectTimeout;
  private final Duration readTimeout;

  public WhatsAppClient(
      WhatsAppProperties properties,
      @Value("${app.whatsapp.http.connect-timeout-ms:4000}") long connectTimeoutMs,
      @Value("${app.whatsapp.http.read-timeout-ms:12000}") long readTimeoutMs
  ) {
    this.properties = properties;
    this.connectTimeout = Duration.ofMillis(connectTimeoutMs);
    this.readTimeout = Duration.ofMillis(readTimeoutMs);
  }

  @Override
  public MessageSendResult sendTemplate(String to, String templateName, String languageCode, List<String> bodyParameters) {
    if (!StringUtils.hasText(to)) {
      return MessageSendResult.failed("WHATSAPP_RECIPIENT_MISSING: no phone number to message");
    }
    Map<String, Object> payload = buildTemplatePayload(to, templateName, languageCode, bodyParameters);
    if (properties.isDryRun()) {
      log.info("WhatsApp dry-run to={} template={} params={}", to, templateName, bodyParameters);
      return MessageSendResult.dryRun(DRY_RUN_MESSAGE_ID);
    }
    if (!properties.isConfigured()) {
      return MessageSendResult.failed("WHATSAPP_CONFIG_MISSING: access token and phone number id are required");
    }

    try {
      var result = client()
          .post()
          .uri("/" + properties.getPhoneNumberId() + "/messages")
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue(payload)
          .exchangeToMono(resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
              .map(body -> new WhatsAppHttpResult(resp.statusCode().value(), body)))
          .timeout(readTimeout)
          .blockOptional()
          .orElse(new WhatsAppHttpResult(0, ""));
      if (result.statusCode() < 200 || result.statusCode() >= 300) {
        log.warn("WhatsApp send rejected to={} status={} body={}", to, result.statusCode(), result.snippet());
        return MessageSendResult.failed("HTTP " + result.statusCode() + ": " + result.snippet());
      }
      String messageId = messageId(result.body());
      log.info("WhatsApp template sent to={} template={} messageId={}", to, templateName, messageId);
      return MessageSendResult.sent(messageId);
    } catch (Exception ex) {
      Throwable root = Exceptions.unwrap(ex);
      log.warn("WhatsApp send failed to={} cause={} error={}", to, root.getClass().getSimpleName(), root.getMessage());
      return MessageSendResult.failed("WHATSAPP_UNREACHABLE: " + root.getMessage());
    }
  }

  Map<String, Object> buildTemplatePayload(String to, String templateName, String languageCode, List<String> bodyParameters) {
    Map<String, Object> template = new LinkedHashMap<>();
    template.put("name", templateName);
    template.put("language", Map.of("code", StringUtils.hasText(languageCode) ? languageCode : "en"));
    if (bodyParameters != null && !bodyParameters.isEmpty()) {
      List<Map<String, Object>> parameters = new ArrayList<>();
      for (String value : bodyParameters) {
        parameters.add(Map.of("type", "text", "text", Objects.toString(value, "")));
      }
      template.put("components", List.of(Map.of("type", "body", "parameters", parameters)));
    }

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("messaging_product", "whatsapp");
    payload.put("to", to.replaceAll("[^0-9]", ""));
    payload.put("type", "template");
    payload.put("template", template);
    return payload;
  }

  private String messageId(String body) {
    try {
      JsonNode json = mapper.readTree(body);
      return json.path("messages").path(0).path("id").asText("");
    } catch (IOException ex) {
      log.debug("WhatsApp response without message id: {}", ex.getMessage());
      return "";
    }
  }

  private WebClient client() {
    var httpClient = HttpClient.create()
        .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(connectTimeout.toMillis()))
        .responseTimeout(readTimeout);
    return WebClient.builder()
        .baseUrl(properties.getApiBaseUrl())
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getAccessToken())
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .build();
  }

  private record WhatsAppHttpResult(int statusCode, String body) {
    String snippet() {
      String safeBody = Optional.ofNullable(body).orElse("");
      return safeBody.substring(0, Math.min(safeBody.length(), 200));
    }
  }
}
