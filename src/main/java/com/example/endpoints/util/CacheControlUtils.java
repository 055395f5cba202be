package com.example.endpoints.util;

import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP freshness header parsing for the certificate cache.
 */
@UtilityClass
public class CacheControlUtils {

  private static final Pattern MAX_AGE =
      Pattern.compile("\\s*max-age\\s*=\\s*(\\d+)\\s*", Pattern.CASE_INSENSITIVE);
  // anything longer may overflow a long
  private static final int MAX_SECONDS_DIGITS = 18;

  /**
   * Returns the max-age directive of a Cache-Control header in seconds, or 0 when it is absent
   * or unparseable.
   */
  public static long maxAge(String cacheControl) {
    if (cacheControl == null || cacheControl.isEmpty()) {
      return 0;
    }
    for (String directive : cacheControl.split(",")) {
      Matcher matcher = MAX_AGE.matcher(directive);
      if (matcher.find() && matcher.group(1).length() <= MAX_SECONDS_DIGITS) {
        return Long.parseLong(matcher.group(1));
      }
    }
    return 0;
  }

  /**
   * How long a response may still be cached: max-age minus Age. Zero means do not cache.
   */
  public static Duration remainingFreshness(String cacheControl, String age) {
    long maxAge = maxAge(cacheControl);
    if (maxAge == 0 || age == null) {
      return Duration.ZERO;
    }
    long ageSeconds;
    try {
      ageSeconds = Long.parseLong(age.trim());
    } catch (NumberFormatException e) {
      return Duration.ZERO;
    }
    long remaining = maxAge - ageSeconds;
    return remaining > 0 ? Duration.ofSeconds(remaining) : Duration.ZERO;
  }
}
