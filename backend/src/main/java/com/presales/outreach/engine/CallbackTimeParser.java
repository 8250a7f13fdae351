package com.presales.outreach.engine;

import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free text such as "tomorrow at 5pm" or "in 2 hours" into a callback time. Rules are tried in
 * order and the first match wins; text with no recognizable time falls back to 24 hours from now.
 */
@Component
public class CallbackTimeParser {
  private static final Pattern TOMORROW_AT = Pattern.compile("\\btomorrow\\b.*?\\b(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)\\b");
  private static final Pattern CLOCK_TIME = Pattern.compile("\\b(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)\\b");
  private static final Pattern IN_DURATION = Pattern.compile("\\bin\\s+(\\d{1,3})\\s*(hours?|hrs?|minutes?|mins?)\\b");
  private static final Pattern WEEKDAY = Pattern.compile("\\b(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b");
  private static final LocalTime WEEKDAY_DEFAULT_TIME = LocalTime.of(10, 0);
  private static final Duration DEFAULT_DELAY = Duration.ofHours(24);

  public ZonedDateTime parse(String text, ZonedDateTime now) {
    String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);

    Optional<LocalTime> tomorrow = clockTime(TOMORROW_AT.matcher(normalized));
    if (tomorrow.isPresent()) {
      return atTime(now.plusDays(1), tomorrow.get());
    }

    Optional<LocalTime> clock = clockTime(CLOCK_TIME.matcher(normalized));
    if (clock.isPresent()) {
      ZonedDateTime candidate = atTime(now, clock.get());
      return candidate.isAfter(now) ? candidate : candidate.plusDays(1);
    }

    Matcher duration = IN_DURATION.matcher(normalized);
    if (duration.find()) {
      long amount = Long.parseLong(duration.group(1));
      ChronoUnit unit = duration.group(2).startsWith("h") ? ChronoUnit.HOURS : ChronoUnit.MINUTES;
      return now.plus(amount, unit);
    }

    Matcher weekday = WEEKDAY.matcher(normalized);
    if (weekday.find()) {
      DayOfWeek target = DayOfWeek.valueOf(weekday.group(1).toUpperCase(Locale.ROOT));
      int days = (target.getValue() - now.getDayOfWeek().getValue() + 7) % 7;
      return atTime(now.plusDays(days == 0 ? 7 : days), WEEKDAY_DEFAULT_TIME);
    }

    return now.plus(DEFAULT_DELAY);
  }

  private static Optional<LocalTime> clockTime(Matcher matcher) {
    while (matcher.find()) {
      int hour = Integer.parseInt(matcher.group(1));
      int minute = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
      if (hour < 1 || hour > 12 || minute > 59) {
        continue;
      }
      boolean pm = "pm".equals(matcher.group(3));
      if (pm && hour != 12) {
        hour += 12;
      } else if (!pm && hour == 12) {
        hour = 0;
      }
      return Optional.of(LocalTime.of(hour, minute));
    }
    return Optional.empty();
  }

  private static ZonedDateTime atTime(ZonedDateTime day, LocalTime time) {
    return day.with(time).truncatedTo(ChronoUnit.MINUTES);
  }
}
