package com.ospicorp.planningcube.fact.service;

import com.ospicorp.planningcube.error.ErrorCodes;
import com.ospicorp.planningcube.error.ValidationException;
import java.time.YearMonth;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/** Calendar-month tokens ({@code YYYY-MM}) used as the period of every fact. */
public final class Periods {
  private static final Pattern TOKEN = Pattern.compile("^\\d{4}-(0[1-9]|1[0-2])$");

  private Periods() {
  }

  public static YearMonth parse(String token) {
    if (token == null || !TOKEN.matcher(token.trim()).matches()) {
      throw new ValidationException("Invalid period '" + token + "'. Expected YYYY-MM.",
          ErrorCodes.MALFORMED_PERIOD);
    }
    return YearMonth.parse(token.trim());
  }

  /** Parses a period filter; null or empty means "all periods" and yields an empty set. */
  public static Set<YearMonth> parseAll(Collection<String> tokens) {
    Set<YearMonth> out = new LinkedHashSet<>();
    if (tokens == null) {
      return out;
    }
    for (String token : tokens) {
      out.add(parse(token));
    }
    return out;
  }
}
