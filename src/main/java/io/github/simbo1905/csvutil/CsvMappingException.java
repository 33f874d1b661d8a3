// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import java.util.Objects;

/// Base of every failure raised while mapping between rows and records.
/// The first failure aborts the whole read or write; there is no partial result.
public abstract sealed class CsvMappingException extends RuntimeException permits
    CsvMappingException.NotARecordType,
    CsvMappingException.ColumnNotFound,
    CsvMappingException.RowTooShort,
    CsvMappingException.InvalidCell,
    CsvMappingException.UnsupportedFieldKind,
    CsvMappingException.SourceReadError,
    CsvMappingException.SinkWriteError {

  /// Marker for errors that are not tied to a data row
  public static final int NO_ROW = -1;

  private int rowNumber = NO_ROW;

  CsvMappingException(String message) {
    super(message);
  }

  CsvMappingException(String message, Throwable cause) {
    super(message, cause);
  }

  /// @return the 1-based data row (header excluded) that failed, or [#NO_ROW]
  public int rowNumber() {
    return rowNumber;
  }

  CsvMappingException atRow(int dataRowNumber) {
    this.rowNumber = dataRowNumber;
    return this;
  }

  @Override
  public String getMessage() {
    final String message = super.getMessage();
    return rowNumber == NO_ROW ? message : message + " (data row " + rowNumber + ")";
  }

  /// The mapped type is not a Java record
  public static final class NotARecordType extends CsvMappingException {
    private final Class<?> type;

    NotARecordType(Class<?> type) {
      super(type.getName() + " is not a record");
      this.type = type;
    }

    public Class<?> type() {
      return type;
    }
  }

  /// An annotated column is missing from the header row
  public static final class ColumnNotFound extends CsvMappingException {
    private final String column;

    ColumnNotFound(String column) {
      super("column " + column + " does not exist");
      this.column = column;
    }

    public String column() {
      return column;
    }
  }

  /// A data row ends before the column bound to a field
  public static final class RowTooShort extends CsvMappingException {
    private final String field;
    private final int columnIndex;
    private final int rowLength;

    RowTooShort(String field, int columnIndex, int rowLength) {
      super("field " + field + " is bound to column index " + columnIndex + " but the row has only " + rowLength + " cells");
      this.field = field;
      this.columnIndex = columnIndex;
      this.rowLength = rowLength;
    }

    public String field() {
      return field;
    }

    public int columnIndex() {
      return columnIndex;
    }

    public int rowLength() {
      return rowLength;
    }
  }

  /// A cell holds text that does not parse as the field's kind
  public abstract static sealed class InvalidCell extends CsvMappingException permits InvalidBool, InvalidInt, InvalidFloat {
    private final String field;
    private final String rawValue;

    InvalidCell(String kind, String field, String rawValue, Throwable cause) {
      super("field " + kind + " " + field + " invalid: \"" + rawValue + "\"", cause);
      this.field = Objects.requireNonNull(field);
      this.rawValue = Objects.requireNonNull(rawValue);
    }

    public String field() {
      return field;
    }

    public String rawValue() {
      return rawValue;
    }
  }

  public static final class InvalidBool extends InvalidCell {
    InvalidBool(String field, String rawValue) {
      super("bool", field, rawValue, null);
    }
  }

  public static final class InvalidInt extends InvalidCell {
    InvalidInt(String field, String rawValue, Throwable cause) {
      super("int", field, rawValue, cause);
    }
  }

  public static final class InvalidFloat extends InvalidCell {
    InvalidFloat(String field, String rawValue, Throwable cause) {
      super("float", field, rawValue, cause);
    }
  }

  /// An annotated component has a type that has no cell representation
  public static final class UnsupportedFieldKind extends CsvMappingException {
    private final String field;
    private final Class<?> kind;

    UnsupportedFieldKind(String field, Class<?> kind) {
      super("field " + field + " has unsupported type " + kind.getTypeName());
      this.field = field;
      this.kind = kind;
    }

    public String field() {
      return field;
    }

    public Class<?> kind() {
      return kind;
    }
  }

  /// The row source failed to deliver rows
  public static final class SourceReadError extends CsvMappingException {
    SourceReadError(String message, Throwable cause) {
      super("read error " + message, cause);
    }
  }

  /// The row sink failed to persist rows
  public static final class SinkWriteError extends CsvMappingException {
    SinkWriteError(String message, Throwable cause) {
      super("write error " + message, cause);
    }
  }
}
