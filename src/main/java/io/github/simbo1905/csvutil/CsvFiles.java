// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static io.github.simbo1905.csvutil.CsvMapper.LOGGER;

/// Comma separated files on disk as a [RowSource] and [RowSink], using RFC 4180 quoting, UTF-8 and `\n` line ends.
/// Rows may have differing lengths and blank lines are skipped.
public final class CsvFiles {

  static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
      .setRecordSeparator('\n')
      .build();

  /// Mode of a newly created file where the file system has POSIX permissions
  static final Set<PosixFilePermission> NEW_FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

  private CsvFiles() {
  }

  /// Reads every record of a CSV file into a list, matching columns to [Col] annotations by header name
  /// @throws CsvMappingException.SourceReadError if the file cannot be opened or parsed
  public static <T> List<T> readToRecords(Path path, Class<T> clazz) {
    return CsvMapper.forClass(clazz).read(source(path));
  }

  /// Writes records to a CSV file, header first, replacing any existing file
  /// @throws CsvMappingException.SinkWriteError if the file cannot be written
  public static <T> void writeFromRecords(Path path, Class<T> clazz, List<T> records) {
    CsvMapper.forClass(clazz).write(records, sink(path));
  }

  /// @return a source that parses the whole file on each [RowSource#readAll()]
  public static @NotNull RowSource source(Path path) {
    Objects.requireNonNull(path, "path must not be null");
    return () -> readRows(path);
  }

  /// @return a sink that writes to a temporary file beside the target and then moves it over the target
  public static @NotNull RowSink sink(Path path) {
    Objects.requireNonNull(path, "path must not be null");
    return rows -> writeRows(path, rows);
  }

  static List<List<String>> readRows(Path path) throws IOException {
    final List<List<String>> rows = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
         CSVParser parser = FORMAT.parse(reader)) {
      for (CSVRecord record : parser) {
        rows.add(List.copyOf(record.toList()));
      }
    } catch (UncheckedIOException e) {
      // the parser iterator reports malformed text this way
      throw new IOException("unable to parse " + path + " as CSV: " + e.getCause().getMessage(), e.getCause());
    }
    LOGGER.fine(() -> "Read " + rows.size() + " rows from " + path);
    return rows;
  }

  static void writeRows(Path path, List<List<String>> rows) throws IOException {
    final Path target = path.toAbsolutePath();
    final Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
    try {
      try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
           CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
        printer.printRecords(rows);
      }
      copyPermissions(target, temp);
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        LOGGER.fine(() -> "Atomic move not supported for " + target + ", replacing in place");
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException | RuntimeException e) {
      try {
        Files.deleteIfExists(temp);
      } catch (IOException suppressed) {
        e.addSuppressed(suppressed);
      }
      throw e;
    }
    LOGGER.fine(() -> "Wrote " + rows.size() + " rows to " + target);
  }

  /// The temporary file is created owner-only. Give it the target's mode, or [#NEW_FILE_PERMISSIONS] for a new file.
  static void copyPermissions(Path target, Path temp) throws IOException {
    if (!temp.getFileSystem().supportedFileAttributeViews().contains("posix")) {
      return;
    }
    final Set<PosixFilePermission> permissions = Files.exists(target)
        ? Files.getPosixFilePermissions(target)
        : NEW_FILE_PERMISSIONS;
    Files.setPosixFilePermissions(temp, permissions);
  }
}
