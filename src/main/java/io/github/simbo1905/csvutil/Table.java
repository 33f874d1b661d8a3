// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A header row and the data rows beneath it, all as text cells.
/// @param header the column names
/// @param rows the data rows, each aligned with the header
public record Table(List<String> header, List<List<String>> rows) {

  public Table {
    header = List.copyOf(Objects.requireNonNull(header, "header must not be null"));
    rows = Objects.requireNonNull(rows, "rows must not be null").stream()
        .map(List::copyOf)
        .toList();
  }

  /// @return the header followed by the data rows, the shape a [RowSink] persists
  public List<List<String>> allRows() {
    final List<List<String>> all = new ArrayList<>(rows.size() + 1);
    all.add(header);
    all.addAll(rows);
    return List.copyOf(all);
  }
}
