package de.bsommerfeld.repoindex.core.text;

import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the lightweight markup of app descriptions to HTML.
 *
 * <h3>Supported markup</h3>
 * <ul>
 * <li>blank lines separate paragraphs ({@code <p>})</li>
 * <li>lines starting with {@code * } form a bullet list, lines starting
 * with {@code # } a numbered list</li>
 * <li>{@code [[app.id]]} links to another app of the catalog</li>
 * <li>{@code [https://host/path text]} links to a web page; the text is
 * optional</li>
 * <li>{@code '''bold'''} and {@code ''italic''}</li>
 * </ul>
 * Everything else is HTML-escaped.
 */
public final class DescriptionFormatter {

    private static final Escaper HTML = HtmlEscapers.htmlEscaper();
    private static final Pattern INLINE = Pattern.compile(
            "\\[\\[([^\\]\\s]+)]]"                  // app link
                    + "|\\[(https?://[^\\]\\s]+)(?: ([^\\]]+))?]" // web link
                    + "|'''(.+?)'''"                // bold
                    + "|''(.+?)''");                // italic

    private final LinkResolver linkResolver;

    public DescriptionFormatter(LinkResolver linkResolver) {
        this.linkResolver = linkResolver;
    }

    /**
     * Converts a description to HTML. {@code null} and blank input yield an
     * empty string.
     */
    public String toHtml(String description) {
        if (description == null || description.isBlank()) {
            return "";
        }
        StringBuilder html = new StringBuilder();
        for (String block : description.strip().split("\\R\\s*\\R")) {
            renderBlock(block.strip().lines().toList(), html);
        }
        return html.toString();
    }

    /**
     * Renders one block. A block may mix paragraph text and list items;
     * consecutive items of the same kind share one list element.
     */
    private void renderBlock(List<String> lines, StringBuilder html) {
        List<String> paragraph = new ArrayList<>();
        String openList = null;
        for (String line : lines) {
            String listTag = line.startsWith("* ") ? "ul" : line.startsWith("# ") ? "ol" : null;
            if (listTag == null) {
                if (openList != null) {
                    html.append("</").append(openList).append('>');
                    openList = null;
                }
                paragraph.add(line.strip());
                continue;
            }
            flushParagraph(paragraph, html);
            if (!listTag.equals(openList)) {
                if (openList != null) {
                    html.append("</").append(openList).append('>');
                }
                html.append('<').append(listTag).append('>');
                openList = listTag;
            }
            html.append("<li>").append(renderInline(line.substring(2).strip())).append("</li>");
        }
        if (openList != null) {
            html.append("</").append(openList).append('>');
        }
        flushParagraph(paragraph, html);
    }

    private void flushParagraph(List<String> paragraph, StringBuilder html) {
        if (paragraph.isEmpty()) {
            return;
        }
        html.append("<p>").append(renderInline(String.join(" ", paragraph))).append("</p>");
        paragraph.clear();
    }

    private String renderInline(String text) {
        StringBuilder out = new StringBuilder();
        Matcher matcher = INLINE.matcher(text);
        int last = 0;
        while (matcher.find()) {
            out.append(HTML.escape(text.substring(last, matcher.start())));
            if (matcher.group(1) != null) {
                LinkResolver.Link link = linkResolver.resolve(matcher.group(1));
                appendLink(out, link.href(), link.text());
            } else if (matcher.group(2) != null) {
                String label = matcher.group(3) != null ? matcher.group(3) : matcher.group(2);
                appendLink(out, matcher.group(2), label);
            } else if (matcher.group(4) != null) {
                out.append("<b>").append(HTML.escape(matcher.group(4))).append("</b>");
            } else {
                out.append("<i>").append(HTML.escape(matcher.group(5))).append("</i>");
            }
            last = matcher.end();
        }
        out.append(HTML.escape(text.substring(last)));
        return out.toString();
    }

    private static void appendLink(StringBuilder out, String href, String text) {
        out.append("<a href=\"").append(HTML.escape(href)).append("\">")
                .append(HTML.escape(text == null ? href : text)).append("</a>");
    }
}
