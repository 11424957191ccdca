package com.logicsignalprotector.cortexconnector.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates table cells while the converter walks an HTML table, then lays them out as a
 * fixed-width grid:
 *
 * <pre>
 * | Name  | Qty |
 * |-------+-----|
 * | apple | 3   |
 * </pre>
 *
 * <p>Rows may be ragged; missing cells are rendered empty so every row has the same columns.
 */
public class TextTable {

  private final List<List<String>> rows = new ArrayList<>();
  private List<String> currentRow;
  private StringBuilder currentCell;

  public void startRow() {
    if (currentRow != null) {
      endRow();
    }
    currentRow = new ArrayList<>();
  }

  public void startCell() {
    if (currentRow == null) {
      startRow();
    }
    if (currentCell != null) {
      endCell();
    }
    currentCell = new StringBuilder();
  }

  public boolean inCell() {
    return currentCell != null;
  }

  public void append(String text) {
    if (currentCell != null && text != null) {
      currentCell.append(text);
    }
  }

  public void endCell() {
    if (currentCell == null) {
      return;
    }
    if (currentRow == null) {
      currentRow = new ArrayList<>();
    }
    currentRow.add(normalizeCell(currentCell.toString()));
    currentCell = null;
  }

  public void endRow() {
    if (currentCell != null) {
      endCell();
    }
    if (currentRow != null) {
      rows.add(currentRow);
      currentRow = null;
    }
  }

  List<List<String>> rows() {
    return rows;
  }

  /** Plain-text grid; empty when no rows were collected. Separator follows the first row. */
  public String render() {
    endRow();
    if (rows.isEmpty()) {
      return "";
    }

    int cols = 0;
    for (List<String> row : rows) {
      cols = Math.max(cols, row.size());
    }
    int[] widths = new int[cols];
    for (List<String> row : rows) {
      for (int i = 0; i < row.size(); i++) {
        widths[i] = Math.max(widths[i], width(row.get(i)));
      }
    }

    List<String> lines = new ArrayList<>(rows.size() + 1);
    for (int r = 0; r < rows.size(); r++) {
      lines.add(row(rows.get(r), widths));
      if (r == 0) {
        lines.add(separator(widths));
      }
    }
    return String.join("\n", lines);
  }

  private static String row(List<String> row, int[] widths) {
    StringBuilder sb = new StringBuilder("| ");
    for (int i = 0; i < widths.length; i++) {
      String val = i < row.size() ? row.get(i) : "";
      if (i > 0) sb.append(" | ");
      sb.append(padRight(val, widths[i]));
    }
    return sb.append(" |").toString();
  }

  private static String separator(int[] widths) {
    StringBuilder sb = new StringBuilder("|-");
    for (int i = 0; i < widths.length; i++) {
      if (i > 0) sb.append("-+-");
      sb.append(repeat("-", widths[i]));
    }
    return sb.append("-|").toString();
  }

  private static String normalizeCell(String raw) {
    return raw.replace('\n', ' ').strip();
  }

  private static int width(String s) {
    return s.codePointCount(0, s.length());
  }

  private static String padRight(String s, int width) {
    int w = width(s);
    if (w >= width) return s;
    return s + repeat(" ", width - w);
  }

  private static String repeat(String s, int count) {
    if (count <= 0) return "";
    return s.repeat(count);
  }
}
