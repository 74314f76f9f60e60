package com.ospicorp.planningcube.fact.service;

import com.ospicorp.planningcube.error.ErrorCodes;
import com.ospicorp.planningcube.error.ValidationException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Conversion of caller-supplied numbers into fixed-scale decimals. Nothing is rounded: a
 * value that cannot be represented at the configured scale is rejected.
 */
public final class Amounts {
  private Amounts() {
  }

  public static BigDecimal toAmount(Number value, int scale) {
    if (value == null) {
      throw new ValidationException("value is required", ErrorCodes.MISSING_FIELD);
    }
    BigDecimal decimal = toDecimal(value);
    try {
      return decimal.setScale(scale, RoundingMode.UNNECESSARY);
    } catch (ArithmeticException ex) {
      throw new ValidationException("value " + decimal.toPlainString() + " has more than "
          + scale + " decimal places", ErrorCodes.INVALID_AMOUNT, ex);
    }
  }

  public static BigDecimal average(BigDecimal total, int count, int scale) {
    if (count == 0) {
      return BigDecimal.ZERO.setScale(scale);
    }
    return total.divide(BigDecimal.valueOf(count), Math.max(scale, total.scale()),
        RoundingMode.HALF_EVEN);
  }

  private static BigDecimal toDecimal(Number value) {
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    if (value instanceof BigInteger integer) {
      return new BigDecimal(integer);
    }
    if (value instanceof Double || value instanceof Float) {
      double d = value.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new ValidationException("value must be a finite number", ErrorCodes.INVALID_AMOUNT);
      }
      return value instanceof Float ? new BigDecimal(value.toString()) : BigDecimal.valueOf(d);
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short
        || value instanceof Byte) {
      return BigDecimal.valueOf(value.longValue());
    }
    try {
      return new BigDecimal(value.toString());
    } catch (NumberFormatException ex) {
      throw new ValidationException("value " + value + " is not a decimal number",
          ErrorCodes.INVALID_AMOUNT, ex);
    }
  }
}
