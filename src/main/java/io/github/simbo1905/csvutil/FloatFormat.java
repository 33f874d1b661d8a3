// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;

/// How floating point cells are rendered on write. Set via system property `no.framework.csvutil.FloatFormat`.
/// The default is FIXED_ZERO.
///
/// **FIXED_ZERO** renders fixed-point with zero fraction digits, rounding the exact binary value half-to-even.
/// `3.7` is written as `4` and `2.5` as `2`. Fractions are lost, so a write then read does not give back the
/// original value. It stays the default so that written files keep their existing format.
///
/// **SHORTEST** renders the shortest decimal that reads back to the identical value, e.g. `3.7` or `1.0E10`.
///
/// Both render non-finite values as `NaN`, `+Inf` and `-Inf` which the reader accepts.
enum FloatFormat {
  FIXED_ZERO {
    @Override
    String format(double value) {
      final String special = nonFinite(value);
      if (special != null) {
        return special;
      }
      final String digits = new BigDecimal(value).setScale(0, RoundingMode.HALF_EVEN).toPlainString();
      // BigDecimal has no negative zero
      if ("0".equals(digits) && Math.copySign(1.0, value) < 0) {
        return "-0";
      }
      return digits;
    }

    @Override
    String format(float value) {
      return format((double) value);
    }
  },

  SHORTEST {
    @Override
    String format(double value) {
      final String special = nonFinite(value);
      return special != null ? special : Double.toString(value);
    }

    @Override
    String format(float value) {
      final String special = nonFinite(value);
      return special != null ? special : Float.toString(value);
    }
  };

  static final String PROPERTY = "no.framework.csvutil.FloatFormat";

  abstract String format(double value);

  abstract String format(float value);

  private static String nonFinite(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    return null;
  }

  static FloatFormat current() {
    final String mode = System.getProperty(PROPERTY, FIXED_ZERO.name()).toUpperCase();
    try {
      return FloatFormat.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid float format: " + mode + ". Must be one of: " + Arrays.toString(FloatFormat.values()), e);
    }
  }
}
