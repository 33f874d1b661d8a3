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

public class BindingTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record Person(@Col("name") String name, @Col("age") int age, String nickname) {
  }

  public record Nothing(String ignored) {
  }

  private static final Schema PERSON = Schema.resolve(Person.class);

  @Test
  void bindsByNameRegardlessOfOrder() {
    final Binding binding = Binding.bind(PERSON, List.of("age", "name"));
    assertThat(binding.columnIndices()).containsExactly(Map.entry("name", 1), Map.entry("age", 0));
    assertThat(binding.indexOf("name")).isEqualTo(1);
    assertThat(binding.indexOf("age")).isEqualTo(0);
  }

  @Test
  void ignoresExtraColumns() {
    final Binding binding = Binding.bind(PERSON, List.of("city", "name", "zip", "age", "country"));
    assertThat(binding.columnIndices()).containsExactly(Map.entry("name", 1), Map.entry("age", 3));
  }

  @Test
  void repeatedHeaderColumnBindsRightMost() {
    final Binding binding = Binding.bind(PERSON, List.of("name", "age", "name"));
    assertThat(binding.indexOf("name")).isEqualTo(2);
  }

  @Test
  void missingColumnFailsWithTheColumnName() {
    assertThatThrownBy(() -> Binding.bind(PERSON, List.of("name", "nickname")))
        .isInstanceOf(CsvMappingException.ColumnNotFound.class)
        .hasMessage("column age does not exist")
        .satisfies(e -> assertThat(((CsvMappingException.ColumnNotFound) e).column()).isEqualTo("age"));
  }

  @Test
  void emptyHeaderFailsOnFirstColumn() {
    assertThatThrownBy(() -> Binding.bind(PERSON, List.of()))
        .isInstanceOf(CsvMappingException.ColumnNotFound.class)
        .satisfies(e -> assertThat(((CsvMappingException.ColumnNotFound) e).column()).isEqualTo("name"));
  }

  @Test
  void columnMatchIsCaseSensitive() {
    assertThatThrownBy(() -> Binding.bind(PERSON, List.of("Name", "age")))
        .isInstanceOf(CsvMappingException.ColumnNotFound.class);
  }

  @Test
  void schemaWithoutColumnsBindsToAnyHeader() {
    final Binding binding = Binding.bind(Schema.resolve(Nothing.class), List.of());
    assertThat(binding.columnIndices()).isEmpty();
  }

  @Test
  void unknownFieldIsAProgrammingError() {
    final Binding binding = Binding.bind(PERSON, List.of("name", "age"));
    assertThatThrownBy(() -> binding.indexOf("nickname"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
