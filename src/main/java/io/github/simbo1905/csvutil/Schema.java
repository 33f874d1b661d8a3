// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import java.lang.reflect.RecordComponent;
import java.util.*;
import java.util.stream.Collectors;

import static io.github.simbo1905.csvutil.CsvMapper.LOGGER;

/// One annotated record component and the column it maps to
/// @param componentIndex position of the component in the canonical constructor
/// @param fieldName the record component name
/// @param column the column name from [Col]
/// @param type the declared component type
record ColumnField(int componentIndex, String fieldName, String column, Class<?> type) {
  ColumnField {
    Objects.requireNonNull(fieldName, "fieldName must not be null");
    Objects.requireNonNull(column, "column must not be null");
    Objects.requireNonNull(type, "type must not be null");
  }
}

/// The field to column name mapping declared on a record type. The fields are kept in declaration order
/// which is also the order of the header written out.
record Schema(Class<?> recordType, List<ColumnField> fields) {

  Schema {
    Objects.requireNonNull(recordType, "recordType must not be null");
    fields = List.copyOf(fields);
  }

  /// Reads the [Col] annotations of a record type. Components without an annotation are skipped.
  /// Duplicate column names are accepted and logged.
  /// @throws CsvMappingException.NotARecordType if the type is not a record
  static Schema resolve(Class<?> type) {
    Objects.requireNonNull(type, "type must not be null");
    if (!type.isRecord()) {
      throw new CsvMappingException.NotARecordType(type);
    }
    final RecordComponent[] components = type.getRecordComponents();
    final List<ColumnField> fields = new ArrayList<>();
    for (int i = 0; i < components.length; i++) {
      final Col col = components[i].getAnnotation(Col.class);
      if (col != null && !col.value().isBlank()) {
        fields.add(new ColumnField(i, components[i].getName(), col.value(), components[i].getType()));
      }
    }

    final var duplicates = fields.stream()
        .collect(Collectors.groupingBy(ColumnField::column, LinkedHashMap::new, Collectors.counting()))
        .entrySet().stream()
        .filter(e -> e.getValue() > 1)
        .map(Map.Entry::getKey)
        .toList();
    if (!duplicates.isEmpty()) {
      LOGGER.warning(() -> "Record " + type.getName() + " maps more than one component to columns " + duplicates +
          "; those components will read the same cell");
    }

    final Schema schema = new Schema(type, fields);
    LOGGER.fine(() -> "Resolved schema for " + type.getSimpleName() + ": " + schema.columnsByField() +
        " (" + (components.length - fields.size()) + " unannotated components skipped)");
    return schema;
  }

  /// @return the column names in declaration order
  List<String> header() {
    return fields.stream().map(ColumnField::column).toList();
  }

  /// @return field name to column name in declaration order
  Map<String, String> columnsByField() {
    final Map<String, String> result = new LinkedHashMap<>();
    fields.forEach(f -> result.put(f.fieldName(), f.column()));
    return Collections.unmodifiableMap(result);
  }
}
