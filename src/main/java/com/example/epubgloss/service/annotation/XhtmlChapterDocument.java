package com.example.epubgloss.service.annotation;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory set of XHTML chapters keyed by file name, in reading order.
 *
 * <p>Chapters are parsed with the XML parser and written back without pretty printing, so
 * everything outside rewritten text survives the round trip.</p>
 */
public class XhtmlChapterDocument implements AnnotatableDocument {

    private static final Logger logger = LoggerFactory.getLogger(XhtmlChapterDocument.class);

    public static final String STYLESHEET_HREF = "style/annotation.css";

    private final Map<String, String> chapters;
    private String stylesheet;

    public XhtmlChapterDocument(Map<String, String> chapters) {
        this.chapters = new LinkedHashMap<>(Objects.requireNonNull(chapters, "chapters"));
    }

    @Override
    public List<String> fragmentIds() {
        return new ArrayList<>(chapters.keySet());
    }

    @Override
    public Element fragment(String id) {
        String content = chapters.get(id);
        if (content == null) {
            throw new IllegalArgumentException("Unknown chapter: " + id);
        }
        return parse(content);
    }

    @Override
    public void replaceFragment(String id, Element fragment) {
        if (!chapters.containsKey(id)) {
            throw new IllegalArgumentException("Unknown chapter: " + id);
        }
        chapters.put(id, serialize(fragment));
    }

    @Override
    public void attachStylesheet(String css) {
        Objects.requireNonNull(css, "css");
        if (stylesheet != null) {
            throw new IllegalStateException("Stylesheet already attached");
        }
        stylesheet = css;

        int linked = 0;
        for (Map.Entry<String, String> entry : chapters.entrySet()) {
            Document doc = parse(entry.getValue());
            Element head = doc.selectFirst("head");
            if (head == null) {
                logger.warn("Chapter {} has no <head>, stylesheet not linked", entry.getKey());
                continue;
            }
            if (head.selectFirst("link[href=" + STYLESHEET_HREF + "]") == null) {
                head.appendElement("link")
                    .attr("rel", "stylesheet")
                    .attr("type", "text/css")
                    .attr("href", STYLESHEET_HREF);
                linked++;
            }
            entry.setValue(serialize(doc));
        }
        logger.info("Linked {} to {} chapters", STYLESHEET_HREF, linked);
    }

    public String getChapter(String id) {
        return chapters.get(id);
    }

    public Map<String, String> getChapters() {
        return Collections.unmodifiableMap(chapters);
    }

    /**
     * The attached stylesheet, or null if none has been attached yet.
     */
    public String getStylesheet() {
        return stylesheet;
    }

    static Document parse(String xhtml) {
        Document doc = Jsoup.parse(xhtml, "", Parser.xmlParser());
        doc.outputSettings().syntax(Document.OutputSettings.Syntax.xml);
        doc.outputSettings().escapeMode(Entities.EscapeMode.xhtml);
        doc.outputSettings().prettyPrint(false);
        return doc;
    }

    private static String serialize(Element fragment) {
        if (fragment instanceof Document) {
            Document doc = (Document) fragment;
            doc.outputSettings().syntax(Document.OutputSettings.Syntax.xml);
            doc.outputSettings().escapeMode(Entities.EscapeMode.xhtml);
            doc.outputSettings().prettyPrint(false);
            return doc.html();
        }
        return fragment.outerHtml();
    }
}
