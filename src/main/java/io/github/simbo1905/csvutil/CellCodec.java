// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import org.jetbrains.annotations.NotNull;

import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/// Text to value and value to text conversion for each [ScalarKind].
final class CellCodec {

  static final Set<String> TRUE_TOKENS = Set.of("1", "t", "T", "TRUE", "true", "True");
  static final Set<String> FALSE_TOKENS = Set.of("0", "f", "F", "FALSE", "false", "False");

  // ASCII only. The JDK parsers also accept other Unicode digits, whitespace and type suffixes.
  private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
  private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");
  private static final Pattern INFINITY = Pattern.compile("([+-]?)(?:inf|infinity)", Pattern.CASE_INSENSITIVE);
  private static final Pattern NAN = Pattern.compile("nan", Pattern.CASE_INSENSITIVE);

  private CellCodec() {
  }

  /// Parses one cell
  /// @param kind the declared kind of the field
  /// @param field the field name, used in error reports
  /// @param raw the cell text
  /// @return the boxed value ready to pass to a record constructor
  static @NotNull Object decode(ScalarKind kind, String field, String raw) {
    return switch (kind) {
      case BOOLEAN -> decodeBoolean(field, raw);
      case BYTE -> decodeInteger(field, raw, Byte::valueOf);
      case SHORT -> decodeInteger(field, raw, Short::valueOf);
      case INTEGER -> decodeInteger(field, raw, Integer::valueOf);
      case LONG -> decodeInteger(field, raw, Long::valueOf);
      case FLOAT -> (float) decodeFloating(field, raw, true);
      case DOUBLE -> decodeFloating(field, raw, false);
      case STRING -> raw;
    };
  }

  /// Renders one value
  /// @param kind the declared kind of the field
  /// @param value the boxed component value
  /// @param floatFormat rendering used for FLOAT and DOUBLE
  static @NotNull String encode(ScalarKind kind, Object value, FloatFormat floatFormat) {
    return switch (kind) {
      case BOOLEAN -> Boolean.toString((Boolean) value);
      case BYTE, SHORT, INTEGER, LONG -> Long.toString(((Number) value).longValue());
      case FLOAT -> floatFormat.format((float) (Float) value);
      case DOUBLE -> floatFormat.format((double) (Double) value);
      case STRING -> value == null ? "" : (String) value;
    };
  }

  static Boolean decodeBoolean(String field, String raw) {
    if (TRUE_TOKENS.contains(raw)) {
      return Boolean.TRUE;
    }
    if (FALSE_TOKENS.contains(raw)) {
      return Boolean.FALSE;
    }
    throw new CsvMappingException.InvalidBool(field, raw);
  }

  /// Parses base 10 at the width of the parser given. Overflow of that width is an error.
  static <N extends Number> N decodeInteger(String field, String raw, Function<String, N> parser) {
    if (!INTEGER.matcher(raw).matches()) {
      throw new CsvMappingException.InvalidInt(field, raw, null);
    }
    try {
      return parser.apply(raw);
    } catch (NumberFormatException e) {
      throw new CsvMappingException.InvalidInt(field, raw, e);
    }
  }

  /// Parses a decimal or exponential literal, or one of the tokens inf, infinity, nan in any case.
  /// A finite literal that overflows the target width is an error.
  static double decodeFloating(String field, String raw, boolean singlePrecision) {
    if (NAN.matcher(raw).matches()) {
      return Double.NaN;
    }
    final var infinity = INFINITY.matcher(raw);
    if (infinity.matches()) {
      return "-".equals(infinity.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    if (!DECIMAL.matcher(raw).matches()) {
      throw new CsvMappingException.InvalidFloat(field, raw, null);
    }
    final double value;
    try {
      value = singlePrecision ? Float.parseFloat(raw) : Double.parseDouble(raw);
    } catch (NumberFormatException e) {
      throw new CsvMappingException.InvalidFloat(field, raw, e);
    }
    if (Double.isInfinite(value)) {
      throw new CsvMappingException.InvalidFloat(field, raw, null);
    }
    return value;
  }
}
