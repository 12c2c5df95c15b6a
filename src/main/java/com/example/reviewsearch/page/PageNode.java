package com.example.reviewsearch.page;

import java.util.List;
import java.util.Optional;

/**
 * The slice of a DOM the extractor works against: CSS queries scoped to this node,
 * its normalized text and its attributes.
 */
public interface PageNode {

    /**
     * All descendants matching the selector, in document order.
     */
    List<PageNode> selectAll(String selector);

    /**
     * First descendant matching the selector.
     */
    Optional<PageNode> selectFirst(String selector);

    /**
     * Visible text with whitespace collapsed and trimmed.
     */
    String text();

    /**
     * Attribute value, empty when the attribute is absent.
     */
    Optional<String> attr(String name);
}
