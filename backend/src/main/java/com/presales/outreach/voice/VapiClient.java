package com.presales.outreach.voice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.presales.outreach.common.OutreachException;
import com.presales.outreach.domain.Lead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

@Component
public class VapiClient implements VoiceGateway {
  private static final Logger log = LoggerFactory.getLogger(VapiClient.class);
  private static final DateTimeFormatter HUMAN_DATE = DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy", Locale.ENGLISH);

  private final VapiProperties properties;
  private final Clock clock;
  private final ObjectMapper mapper = new ObjectMapper();
  private final Duration connectTimeout;
  private final Duration readTimeout;

  public VapiClient(
      VapiProperties properties,
      Clock clock,
      @Value("${app.vapi.http.connect-timeout-ms:4000}") long connectTimeoutMs,
      @Value("${app.vapi.http.read-timeout-ms:15000}") long readTimeoutMs
  ) {
    this.properties = properties;
    this.clock = clock;
    this.connectTimeout = Duration.ofMillis(connectTimeoutMs);
    this.readTimeout = Duration.ofMillis(readTimeoutMs);
  }

  @Override
  public CallInitiationResult initiate(Lead lead, String assistantId, String phoneNumberId) {
    if (!StringUtils.hasText(properties.getApiKey()) || !StringUtils.hasText(assistantId) || !StringUtils.hasText(phoneNumberId)) {
      return CallInitiationResult.failure("VAPI_CONFIG_MISSING: api key, assistant id and phone number id are required");
    }
    if (!lead.hasPhone()) {
      return CallInitiationResult.failure("LEAD_PHONE_MISSING: lead has no phone number");
    }

    Map<String, Object> payload = buildCallPayload(lead, assistantId, phoneNumberId);
    VapiHttpResult result;
    try {
      result = executePost("/call", payload);
    } catch (OutreachException ex) {
      log.warn("Vapi call initiation unreachable leadId={} code={} message={}", lead.id(), ex.code(), ex.getMessage());
      return CallInitiationResult.failure(ex.code() + ": " + ex.getMessage());
    } catch (RuntimeException ex) {
      log.warn("Vapi call initiation error leadId={} error={}", lead.id(), ex.getMessage());
      return CallInitiationResult.failure("VAPI_ERROR: " + ex.getMessage());
    }

    if (properties.isDebug()) {
      log.info("Vapi call response leadId={} status={} body={}", lead.id(), result.statusCode(), result.snippet());
    }
    if (result.statusCode() < 200 || result.statusCode() >= 300) {
      log.warn("Vapi rejected call leadId={} status={} body={}", lead.id(), result.statusCode(), result.snippet());
      return CallInitiationResult.failure("HTTP " + result.statusCode() + ": " + result.snippet());
    }

    String callId = readTree(result.body()).map(json -> json.path("id").asText("")).orElse("");
    if (callId.isBlank()) {
      return CallInitiationResult.failure("VAPI_NO_CALL_ID: response did not include a call id");
    }
    log.info("Vapi call initiated leadId={} callId={}", lead.id(), callId);
    return CallInitiationResult.success(callId);
  }

  /** Empty when the provider does not know the call. Unreachable provider raises {@link OutreachException}. */
  @Override
  public Optional<CallStatusSnapshot> getStatus(String callId) {
    VapiHttpResult result = executeGet("/call/" + callId);
    if (result.statusCode() == 404) {
      return Optional.empty();
    }
    if (result.statusCode() < 200 || result.statusCode() >= 300) {
      throw new OutreachException(HttpStatus.BAD_GATEWAY, "VAPI_STATUS_FAILED",
          "Vapi returned HTTP " + result.statusCode() + " for call " + callId, null,
          Map.of("callId", callId, "body", result.snippet()));
    }
    return readTree(result.body()).map(json -> new CallStatusSnapshot(
        callId,
        json.path("status").asText(""),
        json.path("endedReason").asText("")));
  }

  @Override
  public Optional<String> getTranscript(String callId) {
    try {
      VapiHttpResult result = executeGet("/call/" + callId);
      if (result.statusCode() < 200 || result.statusCode() >= 300) {
        return Optional.empty();
      }
      return readTree(result.body())
          .map(json -> json.path("artifact").path("transcript").asText(json.path("transcript").asText("")))
          .filter(StringUtils::hasText);
    } catch (RuntimeException ex) {
      log.debug("Vapi transcript unavailable callId={} error={}", callId, ex.getMessage());
      return Optional.empty();
    }
  }

  Map<String, Object> buildCallPayload(Lead lead, String assistantId, String phoneNumberId) {
    OffsetDateTime now = OffsetDateTime.now(clock);
    Map<String, Object> customer = new LinkedHashMap<>();
    customer.put("number", e164(lead.phone()));
    if (StringUtils.hasText(lead.displayName())) {
      customer.put("name", lead.displayName());
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("lead_uuid", lead.id());
    metadata.put("initiated_at", now.toString());
    metadata.put("today_iso", now.toLocalDate().toString());
    metadata.put("today_human", now.format(HUMAN_DATE));

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("assistantId", assistantId);
    payload.put("phoneNumberId", phoneNumberId);
    payload.put("customer", customer);
    payload.put("metadata", metadata);
    return payload;
  }

  static String e164(String phone) {
    String digits = phone.trim().replaceAll("[\\s()-]", "");
    return digits.startsWith("+") ? digits : "+" + digits;
  }

  private Optional<JsonNode> readTree(String body) {
    if (!StringUtils.hasText(body)) {
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readTree(body));
    } catch (IOException ex) {
      log.warn("Vapi response is not JSON: {}", ex.getMessage());
      return Optional.empty();
    }
  }

  private VapiHttpResult executeGet(String path) {
    try {
      return client()
          .get()
          .uri(path)
          .exchangeToMono(resp -> resp.bodyToMono(String.class).defaultIfEmpty("").map(body -> new VapiHttpResult(resp.statusCode().value(), body)))
          .timeout(readTimeout)
          .blockOptional()
          .orElse(new VapiHttpResult(0, ""));
    } catch (Exception ex) {
      throw mapClientException(ex);
    }
  }

  private VapiHttpResult executePost(String path, Map<String, Object> payload) {
    try {
      return client()
          .post()
          .uri(path)
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue(payload)
          .exchangeToMono(resp -> resp.bodyToMono(String.class).defaultIfEmpty("").map(body -> new VapiHttpResult(resp.statusCode().value(), body)))
          .timeout(readTimeout)
          .blockOptional()
          .orElse(new VapiHttpResult(0, ""));
    } catch (Exception ex) {
      throw mapClientException(ex);
    }
  }

  private WebClient client() {
    var httpClient = HttpClient.create()
        .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(connectTimeout.toMillis()))
        .responseTimeout(readTimeout);
    return WebClient.builder()
        .baseUrl(properties.getBaseUrl())
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .build();
  }

  private RuntimeException mapClientException(Exception ex) {
    Throwable root = networkCause(Exceptions.unwrap(ex));
    if (root instanceof TimeoutException) {
      return new OutreachException(HttpStatus.SERVICE_UNAVAILABLE,
          "VAPI_UNREACHABLE",
          "Vapi did not answer within the expected time.",
          "Check connectivity to app.vapi.base-url.",
          Map.of("cause", "TimeoutException"));
    }
    if (root instanceof ConnectException || root instanceof UnknownHostException) {
      return new OutreachException(HttpStatus.SERVICE_UNAVAILABLE,
          "VAPI_UNREACHABLE",
          "Could not connect to Vapi.",
          "Check app.vapi.base-url, DNS and network route.",
          Map.of("cause", root.getClass().getSimpleName()));
    }
    return new RuntimeException(root.getMessage(), root);
  }

  /** WebClient wraps connect failures in a request exception; the network cause sits further down. */
  private static Throwable networkCause(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof TimeoutException || t instanceof ConnectException || t instanceof UnknownHostException) {
        return t;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return error;
  }

  public record VapiHttpResult(int statusCode, String body) {
    public String snippet() {
      String safeBody = Optional.ofNullable(body).orElse("");
      return safeBody.substring(0, Math.min(safeBody.length(), 200));
    }
  }
}
