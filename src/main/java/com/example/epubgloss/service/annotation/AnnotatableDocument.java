package com.example.epubgloss.service.annotation;

import org.jsoup.nodes.Element;

import java.util.List;

/**
 * A document seen as an ordered set of markup fragments (chapters), plus a single
 * document-wide stylesheet slot.
 */
public interface AnnotatableDocument {

    /**
     * Fragment identifiers in reading order.
     */
    List<String> fragmentIds();

    /**
     * Parses and returns the fragment. Each call returns a fresh tree.
     */
    Element fragment(String id);

    void replaceFragment(String id, Element fragment);

    /**
     * Associates {@code css} with the whole document. May be called once.
     */
    void attachStylesheet(String css);
}
