// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.csvutil;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SchemaTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record Mixed(@Col("id") long id, String note, @Col("name") String name, @Col("") int blank, @Col("score") double score) {
  }

  public record Unannotated(String a, int b) {
  }

  public record Duplicated(@Col("x") int first, @Col("x") int second) {
  }

  public static class NotARecord {
    @SuppressWarnings("unused")
    String name;
  }

  public enum Colour {RED}

  @Test
  void annotatedComponentsInDeclarationOrder() {
    final Schema schema = Schema.resolve(Mixed.class);
    assertThat(schema.header()).containsExactly("id", "name", "score");
    assertThat(schema.columnsByField()).containsExactly(
        Map.entry("id", "id"), Map.entry("name", "name"), Map.entry("score", "score"));
    assertThat(schema.fields())
        .extracting(ColumnField::componentIndex)
        .containsExactly(0, 2, 4);
    assertThat(schema.fields())
        .extracting(ColumnField::type)
        .containsExactly(long.class, String.class, double.class);
  }

  @Test
  void noAnnotationsGivesEmptySchema() {
    final Schema schema = Schema.resolve(Unannotated.class);
    assertThat(schema.fields()).isEmpty();
    assertThat(schema.header()).isEmpty();
  }

  @Test
  void duplicateColumnsAreKept() {
    final Schema schema = Schema.resolve(Duplicated.class);
    assertThat(schema.header()).containsExactly("x", "x");
  }

  @Test
  void rejectsTypesThatAreNotRecords() {
    for (Class<?> type : List.of(NotARecord.class, Colour.class, Runnable.class, int.class, String[].class)) {
      assertThatThrownBy(() -> Schema.resolve(type))
          .isInstanceOf(CsvMappingException.NotARecordType.class)
          .hasMessageContaining(type.getName())
          .satisfies(e -> assertThat(((CsvMappingException.NotARecordType) e).type()).isEqualTo(type));
    }
  }
}
