// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Binds a record component to a named CSV column.
///
/// ```java
/// record Person(@Col("name") String name, @Col("active") boolean active, long internalId) {}
/// ```
///
/// Components without this annotation, or with a blank column name, are never read from or written to a cell.
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Col {

  /// The column name as it appears in the header row
  String value();
}
