package com.logicsignalprotector.cortexconnector.render;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts a stream of HTML start/end/text events into the subset Telegram accepts with {@code
 * parse_mode=HTML}: b, i, u, s, code, pre, a, blockquote. Tables become a monospace grid inside
 * {@code <pre>}.
 *
 * <p>Each open element is a frame on an explicit stack holding the closer that was promised for
 * it. End events unwind to the nearest matching frame and stray end events are ignored, so the
 * output is balanced whatever the input looks like. One instance converts one document.
 */
public class TelegramHtmlConverter {

  private static final Set<String> HEADINGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6");
  private static final Set<String> VOID_TAGS = Set.of("br", "hr", "img", "input", "wbr");
  private static final Pattern EXTRA_NEWLINES = Pattern.compile("\n{3,}");

  private final StringBuilder out = new StringBuilder();
  private final Deque<Frame> stack = new ArrayDeque<>();
  private TextTable table;
  private int nestedTables;

  public void start(String rawTag, Map<String, String> attrs) {
    String tag = normalize(rawTag);
    if (tag.isEmpty()) {
      return;
    }
    if (VOID_TAGS.contains(tag)) {
      if ("br".equals(tag)) {
        if (table != null) {
          table.append(" ");
        } else {
          out.append('\n');
        }
      }
      return;
    }

    if (table != null) {
      startInTable(tag);
      return;
    }

    String opener = "";
    String closer = "";
    Kind kind = Kind.INLINE;
    if (HEADINGS.contains(tag)) {
      opener = "<b>";
      closer = "</b>\n\n";
    } else if (tag.equals("strong") || tag.equals("b")) {
      opener = "<b>";
      closer = "</b>";
    } else if (tag.equals("em") || tag.equals("i")) {
      opener = "<i>";
      closer = "</i>";
    } else if (tag.equals("u") || tag.equals("ins")) {
      opener = "<u>";
      closer = "</u>";
    } else if (tag.equals("s") || tag.equals("del") || tag.equals("strike")) {
      opener = "<s>";
      closer = "</s>";
    } else if (tag.equals("code")) {
      if (!isOpen("pre")) {
        opener = "<code>";
        closer = "</code>";
      }
    } else if (tag.equals("pre")) {
      opener = "<pre>";
      closer = "</pre>\n";
    } else if (tag.equals("a")) {
      String href = attrs == null ? null : attrs.get("href");
      if (href != null && !href.isBlank()) {
        opener = "<a href=\"" + escapeAttribute(href) + "\">";
        closer = "</a>";
      }
    } else if (tag.equals("blockquote")) {
      opener = "<blockquote>";
      closer = "</blockquote>\n";
    } else if (tag.equals("p")) {
      closer = "\n\n";
    } else if (tag.equals("ul") || tag.equals("ol")) {
      kind = Kind.LIST;
    } else if (tag.equals("li")) {
      opener = listItemPrefix();
    } else if (tag.equals("table")) {
      kind = Kind.TABLE;
      table = new TextTable();
    }
    out.append(opener);
    stack.push(new Frame(tag, closer, kind));
  }

  public void end(String rawTag) {
    String tag = normalize(rawTag);
    if (tag.isEmpty() || VOID_TAGS.contains(tag) || !isOpen(tag)) {
      return;
    }
    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      close(frame);
      if (frame.tag.equals(tag)) {
        return;
      }
    }
  }

  public void text(String data) {
    if (data == null || data.isEmpty()) {
      return;
    }
    if (table != null) {
      if (table.inCell()) {
        table.append(data);
      }
      return;
    }
    out.append(escapeText(data));
  }

  /** Closes anything left open and applies whitespace post-processing. */
  public String result() {
    while (!stack.isEmpty()) {
      close(stack.pop());
    }
    return EXTRA_NEWLINES.matcher(out).replaceAll("\n\n").strip();
  }

  private void startInTable(String tag) {
    Kind kind = Kind.INLINE;
    if (tag.equals("table")) {
      nestedTables++;
      kind = Kind.NESTED_TABLE;
    } else if (nestedTables == 0 && tag.equals("tr")) {
      table.startRow();
      kind = Kind.ROW;
    } else if (nestedTables == 0 && (tag.equals("th") || tag.equals("td"))) {
      table.startCell();
      kind = Kind.CELL;
    }
    stack.push(new Frame(tag, "", kind));
  }

  private void close(Frame frame) {
    if (frame.kind == Kind.CELL) {
      table.endCell();
    } else if (frame.kind == Kind.ROW) {
      table.endRow();
    } else if (frame.kind == Kind.NESTED_TABLE) {
      nestedTables--;
    } else if (frame.kind == Kind.TABLE) {
      String grid = table.render();
      table = null;
      if (!grid.isEmpty()) {
        out.append("<pre>").append(escapeText(grid)).append("</pre>\n\n");
      }
    } else {
      out.append(frame.closer);
    }
  }

  private String listItemPrefix() {
    int depth = 0;
    Frame list = null;
    for (Frame frame : stack) {
      if (frame.kind == Kind.LIST) {
        if (list == null) {
          list = frame;
        }
        depth++;
      }
    }
    StringBuilder prefix = new StringBuilder();
    if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
      prefix.append('\n');
    }
    prefix.append("  ".repeat(Math.max(0, depth - 1)));
    if (list != null && "ol".equals(list.tag)) {
      prefix.append(++list.items).append(". ");
    } else {
      prefix.append("• ");
    }
    return prefix.toString();
  }

  private boolean isOpen(String tag) {
    for (Frame frame : stack) {
      if (frame.tag.equals(tag)) {
        return true;
      }
    }
    return false;
  }

  private static String normalize(String tag) {
    return tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
  }

  static String escapeText(String s) {
    if (s == null) return "";
    String out = s;
    out = out.replace("&", "&amp;");
    out = out.replace("<", "&lt;");
    out = out.replace(">", "&gt;");
    return out;
  }

  static String escapeAttribute(String s) {
    return escapeText(s).replace("\"", "&quot;");
  }

  private enum Kind {
    INLINE,
    LIST,
    TABLE,
    NESTED_TABLE,
    ROW,
    CELL
  }

  private static final class Frame {
    private final String tag;
    private final String closer;
    private final Kind kind;
    private int items;

    private Frame(String tag, String closer, Kind kind) {
      this.tag = tag;
      this.closer = closer;
      this.kind = kind;
    }
  }
}
