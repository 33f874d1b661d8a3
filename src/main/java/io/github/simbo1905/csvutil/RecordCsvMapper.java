// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

final class RecordCsvMapper<T> implements CsvMapper<T> {
  final RecordCodec<T> codec;

  RecordCsvMapper(RecordCodec<T> codec) {
    this.codec = Objects.requireNonNull(codec);
  }

  @Override
  public Class<T> recordType() {
    return codec.recordType;
  }

  @Override
  public List<String> header() {
    return codec.schema.header();
  }

  @Override
  public List<T> read(List<List<String>> rows) {
    Objects.requireNonNull(rows);
    // A document without any row has an empty header
    final List<String> headerRow = rows.isEmpty() ? List.of() : rows.get(0);
    final Binding binding = Binding.bind(codec.schema, headerRow);

    final List<T> result = new ArrayList<>(Math.max(0, rows.size() - 1));
    for (int i = 1; i < rows.size(); i++) {
      try {
        result.add(codec.decodeRow(binding, rows.get(i)));
      } catch (CsvMappingException e) {
        throw e.atRow(i);
      }
    }
    LOGGER.fine(() -> "[" + codec.recordType.getSimpleName() + ".read] Decoded " + result.size() + " records");
    return result;
  }

  @Override
  public List<T> read(RowSource source) {
    Objects.requireNonNull(source);
    final List<List<String>> rows;
    try {
      rows = source.readAll();
    } catch (IOException e) {
      throw new CsvMappingException.SourceReadError(e.getMessage(), e);
    } catch (UncheckedIOException e) {
      throw new CsvMappingException.SourceReadError(e.getMessage(), e.getCause());
    }
    return read(rows);
  }

  @Override
  public Table write(List<T> records) {
    final Table table = codec.encodeRecords(records);
    LOGGER.fine(() -> "[" + codec.recordType.getSimpleName() + ".write] Encoded " + table.rows().size() +
        " records under header " + table.header());
    return table;
  }

  @Override
  public void write(List<T> records, RowSink sink) {
    Objects.requireNonNull(sink);
    final Table table = write(records);
    try {
      sink.writeAll(table.allRows());
    } catch (IOException e) {
      throw new CsvMappingException.SinkWriteError(e.getMessage(), e);
    } catch (UncheckedIOException e) {
      throw new CsvMappingException.SinkWriteError(e.getMessage(), e.getCause());
    }
  }

  @Override
  public String toString() {
    return "RecordCsvMapper{recordType=" + codec.recordType.getName() + ", header=" + header() + "}";
  }
}
