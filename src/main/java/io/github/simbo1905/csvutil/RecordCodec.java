// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.csvutil.CsvMapper.LOGGER;

/// Builds records from rows and rows from records for one record type. The kind of every annotated component is
/// resolved once at construction, so the per-row work is a fixed table of method handles and kinds.
final class RecordCodec<T> {

  /// An annotated component with its resolved kind and accessor
  record FieldCodec(ColumnField field, ScalarKind kind, MethodHandle accessor) {
  }

  final Class<T> recordType;
  final Schema schema;
  final FloatFormat floatFormat;
  final MethodHandle recordConstructor;
  final Object[] defaults;
  final FieldCodec[] fieldCodecs;

  /// @throws CsvMappingException.UnsupportedFieldKind if an annotated component has no [ScalarKind]
  RecordCodec(Class<T> recordType, Schema schema, FloatFormat floatFormat) {
    this.recordType = Objects.requireNonNull(recordType);
    this.schema = Objects.requireNonNull(schema);
    this.floatFormat = Objects.requireNonNull(floatFormat);
    assert recordType.equals(schema.recordType()) : "Schema is for " + schema.recordType() + " not " + recordType;

    final RecordComponent[] components = recordType.getRecordComponents();
    final List<FieldCodec> codecs = new ArrayList<>();
    for (ColumnField field : schema.fields()) {
      final ScalarKind kind = ScalarKind.classify(field.type())
          .orElseThrow(() -> new CsvMappingException.UnsupportedFieldKind(field.fieldName(), field.type()));
      codecs.add(new FieldCodec(field, kind, accessor(components[field.componentIndex()])));
    }
    this.fieldCodecs = codecs.toArray(FieldCodec[]::new);

    try {
      final Class<?>[] parameterTypes = Arrays.stream(components)
          .map(RecordComponent::getType)
          .toArray(Class<?>[]::new);
      final Constructor<?> constructor = recordType.getDeclaredConstructor(parameterTypes);
      constructor.setAccessible(true);
      this.recordConstructor = MethodHandles.lookup().unreflectConstructor(constructor);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to create constructor handle for " + recordType, e);
    }

    this.defaults = Arrays.stream(components)
        .map(c -> defaultValue(c.getType()))
        .toArray();
  }

  private static MethodHandle accessor(RecordComponent component) {
    try {
      final Method method = component.getAccessor();
      method.setAccessible(true);
      return MethodHandles.lookup().unreflect(method);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to create accessor for " + component.getName(), e);
    }
  }

  /// Builds one record from one data row. Unannotated components get their type's default value.
  /// @throws CsvMappingException.RowTooShort if a bound column index is past the end of the row
  /// @throws CsvMappingException.InvalidCell if a cell does not parse as the field's kind
  /// @throws NullPointerException if a bound cell is null
  T decodeRow(Binding binding, List<String> row) {
    Objects.requireNonNull(binding);
    Objects.requireNonNull(row);
    final Object[] components = defaults.clone();
    for (FieldCodec codec : fieldCodecs) {
      final String fieldName = codec.field().fieldName();
      final int index = binding.indexOf(fieldName);
      if (index >= row.size()) {
        throw new CsvMappingException.RowTooShort(fieldName, index, row.size());
      }
      final String cell = row.get(index);
      if (cell == null) {
        throw new NullPointerException("row has a null cell at column index " + index + " for field " + fieldName);
      }
      components[codec.field().componentIndex()] = CellCodec.decode(codec.kind(), fieldName, cell);
    }

    LOGGER.finer(() -> "[" + recordType.getSimpleName() + ".decodeRow] " + row + " -> " + Arrays.toString(components));
    try {
      @SuppressWarnings("unchecked") final var result = (T) recordConstructor.invokeWithArguments(components);
      return result;
    } catch (Throwable e) {
      throw new IllegalStateException("Constructor of " + recordType.getName() + " failed for row " + row + ": " + e.getMessage(), e);
    }
  }

  /// Renders records as a header row in declaration order followed by one row per record.
  Table encodeRecords(List<T> records) {
    Objects.requireNonNull(records);
    final List<List<String>> rows = new ArrayList<>(records.size());
    for (T record : records) {
      rows.add(encodeRecord(record));
    }
    return new Table(schema.header(), rows);
  }

  List<String> encodeRecord(T record) {
    Objects.requireNonNull(record, "records must not contain null");
    final String[] cells = new String[fieldCodecs.length];
    for (int i = 0; i < fieldCodecs.length; i++) {
      final FieldCodec codec = fieldCodecs[i];
      final Object value;
      try {
        value = codec.accessor().invoke(record);
      } catch (Throwable e) {
        throw new IllegalStateException("Accessor " + codec.field().fieldName() + " of " + recordType.getName() + " failed: " + e.getMessage(), e);
      }
      cells[i] = CellCodec.encode(codec.kind(), value, floatFormat);
    }
    LOGGER.finer(() -> "[" + recordType.getSimpleName() + ".encodeRecord] " + record + " -> " + Arrays.toString(cells));
    return List.of(cells);
  }

  static Object defaultValue(Class<?> type) {
    if (type.isPrimitive()) {
      if (type == boolean.class) {
        return false;
      } else if (type == byte.class) {
        return (byte) 0;
      } else if (type == short.class) {
        return (short) 0;
      } else if (type == int.class) {
        return 0;
      } else if (type == long.class) {
        return 0L;
      } else if (type == float.class) {
        return 0.0f;
      } else if (type == double.class) {
        return 0.0;
      } else if (type == char.class) {
        return '\u0000';
      }
    }
    return null;
  }
}
