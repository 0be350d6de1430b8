package com.ospicorp.sensorapi.readings.service;

import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Contiguous slice of an ordered result set, addressed by a 1-based page number and a page
 * size.
 */
public record PageWindow(int page, int limit) {
  public static final int DEFAULT_PAGE = 1;

  private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*\\+?(\\d+)");
  private static final BigInteger MAX_PAGE = BigInteger.valueOf(Integer.MAX_VALUE);

  public PageWindow {
    if (page < 1 || limit < 1) {
      throw new IllegalArgumentException("page and limit must be positive");
    }
  }

  /**
   * Builds a window from raw query values. A value that does not start with a positive integer
   * falls back to its default instead of failing the request; {@code "12abc"} and
   * {@code "12.5"} both read as 12. A limit above {@code maxLimit} or a page beyond the int
   * range is rejected with {@link IllegalArgumentException}, never clamped.
   */
  public static PageWindow parse(String rawPage, String rawLimit, int defaultLimit,
      int maxLimit) {
    BigInteger page = parsePositive(rawPage, DEFAULT_PAGE);
    BigInteger limit = parsePositive(rawLimit, defaultLimit);
    if (limit.compareTo(BigInteger.valueOf(maxLimit)) > 0) {
      throw new IllegalArgumentException(
          "Invalid limit parameter. Supported range: 1-" + maxLimit + ".");
    }
    if (page.compareTo(MAX_PAGE) > 0) {
      throw new IllegalArgumentException(
          "Invalid page parameter. Supported range: 1-" + Integer.MAX_VALUE + ".");
    }
    return new PageWindow(page.intValueExact(), limit.intValueExact());
  }

  public long offset() {
    return (long) (page - 1) * limit;
  }

  private static BigInteger parsePositive(String raw, int fallback) {
    if (raw == null) {
      return BigInteger.valueOf(fallback);
    }
    Matcher matcher = LEADING_INTEGER.matcher(raw);
    if (!matcher.find()) {
      return BigInteger.valueOf(fallback);
    }
    BigInteger value = new BigInteger(matcher.group(1));
    return value.signum() > 0 ? value : BigInteger.valueOf(fallback);
  }
}
