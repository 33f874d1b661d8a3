// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.csvutil;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Maps rows of text cells to records and back, driven by [Col] annotations on the record components.
///
/// ```java
/// record Person(@Col("name") String name, @Col("active") boolean active) {}
///
/// final var mapper = CsvMapper.forClass(Person.class);
/// final List<Person> people = mapper.read(CsvFiles.source(Path.of("people.csv")));
/// mapper.write(people, CsvFiles.sink(Path.of("copy.csv")));
/// ```
///
/// On read the header row is matched by column name, so columns may come in any order and unknown columns are
/// ignored. On write the header is the annotated columns in component declaration order.
/// A mapper holds no mutable state and may be shared between threads.
public sealed interface CsvMapper<T> permits RecordCsvMapper {

  Logger LOGGER = Logger.getLogger(CsvMapper.class.getName());

  /// @return the record class this mapper reads and writes
  Class<T> recordType();

  /// @return the header written by [#write(List)], the annotated columns in declaration order
  List<String> header();

  /// Decodes a document whose first row is the header
  /// @param rows header row followed by data rows
  /// @return one record per data row, in row order
  /// @throws CsvMappingException.ColumnNotFound if an annotated column is not in the header
  /// @throws CsvMappingException.RowTooShort if a data row ends before a bound column
  /// @throws CsvMappingException.InvalidCell if a cell does not parse as its field's kind
  List<T> read(List<List<String>> rows);

  /// Reads the whole document from the source, then decodes it as [#read(List)] does
  /// @throws CsvMappingException.SourceReadError if the source fails
  List<T> read(RowSource source);

  /// Encodes records as a header row and one data row per record
  Table write(List<T> records);

  /// Encodes records and hands header and data rows to the sink in a single call
  /// @throws CsvMappingException.SinkWriteError if the sink fails
  void write(List<T> records, RowSink sink);

  /// Creates a mapper for a record type. The annotations are read and every annotated component's kind is checked here,
  /// so an unusable type fails before any row is touched.
  /// @param clazz a record class
  /// @return a mapper for the record class
  /// @throws CsvMappingException.NotARecordType if the class is not a record
  /// @throws CsvMappingException.UnsupportedFieldKind if an annotated component is not boolean, byte, short, int, long,
  /// float, double or String
  static <T> CsvMapper<T> forClass(Class<T> clazz) {
    Objects.requireNonNull(clazz, "Class must not be null");
    final Schema schema = Schema.resolve(clazz);
    final FloatFormat floatFormat = FloatFormat.current();
    LOGGER.fine(() -> "Creating RecordCsvMapper for " + clazz.getName() + " with float format " + floatFormat);
    return new RecordCsvMapper<>(new RecordCodec<>(clazz, schema, floatFormat));
  }
}
