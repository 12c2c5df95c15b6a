package com.example.reviewsearch.page;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link PageNode} over a Jsoup element or document.
 */
public class JsoupPageNode implements PageNode {

    private final Element element;

    public JsoupPageNode(Element element) {
        this.element = element;
    }

    public static JsoupPageNode parse(String html, String baseUri) {
        return new JsoupPageNode(Jsoup.parse(html, baseUri == null ? "" : baseUri));
    }

    @Override
    public List<PageNode> selectAll(String selector) {
        List<PageNode> out = new ArrayList<>();
        for (Element e : element.select(selector)) {
            out.add(new JsoupPageNode(e));
        }
        return out;
    }

    @Override
    public Optional<PageNode> selectFirst(String selector) {
        return Optional.ofNullable(element.selectFirst(selector)).map(JsoupPageNode::new);
    }

    @Override
    public String text() {
        return element.text().trim();
    }

    @Override
    public Optional<String> attr(String name) {
        return element.hasAttr(name) ? Optional.of(element.attr(name)) : Optional.empty();
    }
}
