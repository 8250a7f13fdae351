package com.presales.outreach.engine;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Looks for a callback request in the call analysis. Returns the text the time parser should read: an
 * explicit {@code callback_time} value when the assistant extracted one, the summary otherwise.
 */
@Component
public class CallbackIntentDetector {
  private final CallEventProperties properties;

  public CallbackIntentDetector(CallEventProperties properties) {
    this.properties = properties;
  }

  public Optional<String> detect(String summary, Map<String, Object> structuredData) {
    Map<String, Object> structured = structuredData == null ? Map.of() : structuredData;
    String explicitTime = findValue(structured, "callback_time", "callbacktime", "callback_at");
    boolean flagged = Boolean.parseBoolean(findValue(structured, "callback_requested", "callbackrequested"));

    if (StringUtils.hasText(explicitTime)) {
      return Optional.of(explicitTime);
    }
    if (flagged) {
      return Optional.of(Objects.toString(summary, ""));
    }
    if (StringUtils.hasText(summary) && mentionsCallback(summary)) {
      return Optional.of(summary);
    }
    return Optional.empty();
  }

  boolean mentionsCallback(String text) {
    String normalized = text.toLowerCase(Locale.ROOT);
    return properties.getCallbackKeywords().stream()
        .filter(StringUtils::hasText)
        .anyMatch(keyword -> normalized.contains(keyword.toLowerCase(Locale.ROOT)));
  }

  private static String findValue(Map<String, Object> structured, String... keys) {
    for (Map.Entry<String, Object> entry : structured.entrySet()) {
      String key = entry.getKey().toLowerCase(Locale.ROOT).replace(" ", "_");
      for (String candidate : keys) {
        if (key.equals(candidate) && entry.getValue() != null) {
          return entry.getValue().toString();
        }
      }
    }
    return "";
  }
}
