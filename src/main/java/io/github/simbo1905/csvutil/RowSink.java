// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import java.io.IOException;
import java.util.List;

/// Persists a whole tabular document, header row first, in one call.
@FunctionalInterface
public interface RowSink {

  void writeAll(List<List<String>> rows) throws IOException;
}
