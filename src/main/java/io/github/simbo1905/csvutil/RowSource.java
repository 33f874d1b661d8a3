// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import java.io.IOException;
import java.util.List;

/// Delivers a whole tabular document as rows of text cells. The first row is the header.
@FunctionalInterface
public interface RowSource {

  /// @return every row of the document in order
  /// @throws IOException if the document cannot be read or is not well formed
  List<List<String>> readAll() throws IOException;
}
