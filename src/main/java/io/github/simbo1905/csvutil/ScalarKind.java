// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import java.util.Optional;

/// The closed set of value shapes that can live in a single cell.
enum ScalarKind {
  BOOLEAN, BYTE, SHORT, INTEGER, LONG, FLOAT, DOUBLE, STRING;

  /// Classifies a component type. Boxed primitives are not cell values and yield empty.
  static Optional<ScalarKind> classify(Class<?> clazz) {
    if (clazz == boolean.class) {
      return Optional.of(BOOLEAN);
    }
    if (clazz == byte.class) {
      return Optional.of(BYTE);
    }
    if (clazz == short.class) {
      return Optional.of(SHORT);
    }
    if (clazz == int.class) {
      return Optional.of(INTEGER);
    }
    if (clazz == long.class) {
      return Optional.of(LONG);
    }
    if (clazz == float.class) {
      return Optional.of(FLOAT);
    }
    if (clazz == double.class) {
      return Optional.of(DOUBLE);
    }
    if (clazz == String.class) {
      return Optional.of(STRING);
    }
    return Optional.empty();
  }
}
