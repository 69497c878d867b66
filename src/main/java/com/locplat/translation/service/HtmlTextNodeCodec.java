package com.locplat.translation.service;

import com.locplat.translation.model.HtmlTextRun;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Splits an HTML fragment into its text runs and writes translated runs back
 * without touching tags or attributes.
 * <p>
 * Runs are matched by their trimmed text, not by position, so two identical runs
 * always receive the same translation.
 */
@Component
public class HtmlTextNodeCodec {

    private static final Pattern HTML_TAG_PATTERN = Pattern.compile("<[^>]+>");

    public boolean isHtml(String text) {
        return text != null && HTML_TAG_PATTERN.matcher(text).find();
    }

    /**
     * Returns the non-blank text runs of {@code html} in document order.
     */
    public List<HtmlTextRun> decode(String html) {
        List<HtmlTextRun> runs = new ArrayList<>();
        if (html == null || html.isEmpty()) {
            return runs;
        }
        Document document = parse(html);
        forEachTextNode(document.body(), textNode -> {
            String text = textNode.getWholeText().strip();
            if (text.isEmpty()) {
                return;
            }
            Node parent = textNode.parent();
            String parentTag = parent instanceof Element element ? element.tagName() : null;
            Map<String, String> attributes = new LinkedHashMap<>();
            if (parent != null) {
                for (Attribute attribute : parent.attributes()) {
                    attributes.put(attribute.getKey(), attribute.getValue());
                }
            }
            runs.add(new HtmlTextRun(text, parentTag, attributes));
        });
        return runs;
    }

    /**
     * Replaces every text run whose trimmed content is a key of {@code translations}.
     * Surrounding whitespace of the original run is kept.
     */
    public String encode(String html, Map<String, String> translations) {
        if (html == null || html.isEmpty() || translations == null || translations.isEmpty()) {
            return html;
        }
        Document document = parse(html);
        forEachTextNode(document.body(), textNode -> {
            String whole = textNode.getWholeText();
            String trimmed = whole.strip();
            if (trimmed.isEmpty()) {
                return;
            }
            String replacement = translations.get(trimmed);
            if (replacement == null) {
                return;
            }
            int start = whole.indexOf(trimmed);
            String leading = whole.substring(0, start);
            String trailing = whole.substring(start + trimmed.length());
            textNode.text(leading + replacement + trailing);
        });
        return document.body().html();
    }

    /**
     * Describes the markup of a fragment: tag names in document order, CSS classes,
     * and the non-class attribute names per tag.
     */
    public Map<String, Object> structure(String html) {
        List<String> tags = new ArrayList<>();
        List<String> classes = new ArrayList<>();
        Map<String, List<String>> attributes = new LinkedHashMap<>();
        Document document = parse(html == null ? "" : html);
        for (Element element : document.body().getAllElements()) {
            if (element == document.body()) {
                continue;
            }
            tags.add(element.tagName());
            classes.addAll(element.classNames());
            List<String> names = new ArrayList<>();
            for (Attribute attribute : element.attributes()) {
                if (!"class".equals(attribute.getKey())) {
                    names.add(attribute.getKey());
                }
            }
            if (!names.isEmpty()) {
                attributes.put(element.tagName(), names);
            }
        }
        Map<String, Object> structure = new LinkedHashMap<>();
        structure.put("tags", tags);
        structure.put("classes", classes);
        structure.put("attributes", attributes);
        return structure;
    }

    Document parse(String html) {
        Document document = Jsoup.parseBodyFragment(html);
        document.outputSettings().prettyPrint(false);
        return document;
    }

    private void forEachTextNode(Element root, Consumer<TextNode> action) {
        List<TextNode> textNodes = new ArrayList<>();
        NodeTraversor.traverse((NodeVisitor) (node, depth) -> {
            if (node instanceof TextNode textNode) {
                textNodes.add(textNode);
            }
        }, root);
        textNodes.forEach(action);
    }
}
