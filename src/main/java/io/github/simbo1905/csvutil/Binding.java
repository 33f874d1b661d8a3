// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import java.util.*;

import static io.github.simbo1905.csvutil.CsvMapper.LOGGER;

/// Field name to zero-based column index for one concrete header row. Only valid for that header.
record Binding(Map<String, Integer> columnIndices) {

  Binding {
    columnIndices = Collections.unmodifiableMap(new LinkedHashMap<>(columnIndices));
  }

  /// Resolves every column of the schema against a header row. The header may list columns in any order and may
  /// carry extra columns. When a column name repeats in the header the right-most position wins.
  /// @throws CsvMappingException.ColumnNotFound for the first schema column missing from the header
  static Binding bind(Schema schema, List<String> headerRow) {
    Objects.requireNonNull(schema, "schema must not be null");
    Objects.requireNonNull(headerRow, "headerRow must not be null");

    final Map<String, Integer> positions = new HashMap<>();
    for (int i = 0; i < headerRow.size(); i++) {
      positions.put(headerRow.get(i), i);
    }

    final Map<String, Integer> indices = new LinkedHashMap<>();
    for (ColumnField field : schema.fields()) {
      final Integer index = positions.get(field.column());
      if (index == null) {
        throw new CsvMappingException.ColumnNotFound(field.column());
      }
      indices.put(field.fieldName(), index);
    }

    final Binding binding = new Binding(indices);
    LOGGER.fine(() -> "Bound " + schema.recordType().getSimpleName() + " to header " + headerRow + ": " + indices);
    return binding;
  }

  /// @throws IllegalArgumentException if the field was not part of the schema this binding came from
  int indexOf(String fieldName) {
    final Integer index = columnIndices.get(fieldName);
    if (index == null) {
      throw new IllegalArgumentException("No column bound for field " + fieldName + " in " + columnIndices.keySet());
    }
    return index;
  }
}
