package com.logicsignalprotector.cortexconnector.render;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.commonmark.Extension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

/**
 * Markdown from Cortex-M to Telegram HTML.
 *
 * <p>CommonMark (with GFM tables) renders the Markdown to HTML, jsoup parses that HTML leniently,
 * and a non-recursive traversal feeds the nodes to a {@link TelegramHtmlConverter}.
 */
@Component
public class TelegramMarkupRenderer {

  private final Parser parser;
  private final HtmlRenderer htmlRenderer;

  public TelegramMarkupRenderer() {
    List<Extension> extensions = List.of(TablesExtension.create());
    this.parser = Parser.builder().extensions(extensions).build();
    this.htmlRenderer = HtmlRenderer.builder().extensions(extensions).build();
  }

  public String render(String markdown) {
    if (markdown == null || markdown.isBlank()) {
      return "";
    }
    return convertHtml(htmlRenderer.render(parser.parse(markdown)));
  }

  public String convertHtml(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    Element body = Jsoup.parseBodyFragment(html).body();
    TelegramHtmlConverter converter = new TelegramHtmlConverter();
    NodeVisitor visitor =
        new NodeVisitor() {
          @Override
          public void head(Node node, int depth) {
            if (node instanceof TextNode text) {
              converter.text(text.getWholeText());
            } else if (node instanceof Element el && el != body) {
              converter.start(el.normalName(), attributes(el));
            }
          }

          @Override
          public void tail(Node node, int depth) {
            if (node instanceof Element el && el != body) {
              converter.end(el.normalName());
            }
          }
        };
    NodeTraversor.traverse(visitor, body);
    return converter.result();
  }

  private static Map<String, String> attributes(Element el) {
    Map<String, String> attrs = new LinkedHashMap<>();
    for (Attribute attr : el.attributes()) {
      attrs.put(attr.getKey(), attr.getValue());
    }
    return attrs;
  }
}
