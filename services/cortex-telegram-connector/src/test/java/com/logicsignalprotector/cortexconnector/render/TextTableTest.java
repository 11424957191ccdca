package com.logicsignalprotector.cortexconnector.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextTableTest {

  @Test
  void emptyTableRendersNothing() {
    assertThat(new TextTable().render()).isEmpty();
  }

  @Test
  void raggedRowsArePadded() {
    TextTable t = new TextTable();
    t.startRow();
    cell(t, "k");
    t.endRow();
    t.startRow();
    cell(t, "long");
    cell(t, "v");
    t.endRow();

    assertThat(t.render()).isEqualTo("| k    |   |\n|------+---|\n| long | v |");
  }

  @Test
  void cellsAreStrippedAndSingleLine() {
    TextTable t = new TextTable();
    t.startRow();
    cell(t, "  multi\nline  ");
    t.endRow();

    assertThat(t.rows()).containsExactly(List.of("multi line"));
  }

  @Test
  void widthCountsCodePoints() {
    TextTable t = new TextTable();
    t.startRow();
    cell(t, "😀");
    t.endRow();
    t.startRow();
    cell(t, "ab");
    t.endRow();

    assertThat(t.render()).isEqualTo("| 😀  |\n|----|\n| ab |");
  }

  @Test
  void textOutsideCellIsIgnored() {
    TextTable t = new TextTable();
    t.append("stray");
    t.startCell();
    t.append("x");

    assertThat(t.render()).isEqualTo("| x |\n|---|");
  }

  private static void cell(TextTable t, String text) {
    t.startCell();
    t.append(text);
    t.endCell();
  }
}
