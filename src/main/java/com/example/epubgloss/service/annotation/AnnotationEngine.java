package com.example.epubgloss.service.annotation;

import com.example.epubgloss.dto.WordMatch;
import com.example.epubgloss.service.dictionary.DictionaryResolver;
import com.example.epubgloss.service.difficulty.DifficultyClassifier;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites the text of a markup fragment so that every difficult word that has a gloss is
 * paired with it.
 *
 * <p>Only text leaves change. Each annotated leaf is replaced, at the same sibling position,
 * by plain text for the gaps and one wrapper per glossed word:</p>
 * <pre>
 * INLINE:   &lt;span class="annotated-word"&gt;word&lt;span class="annotation"&gt; (gloss)&lt;/span&gt;&lt;/span&gt;
 * WORDWISE: &lt;ruby class="annotated-word"&gt;word&lt;rt class="annotation"&gt;gloss&lt;/rt&gt;&lt;/ruby&gt;
 * </pre>
 *
 * <p>Leaves whose parent is a skipped tag or a text-only element such as {@code title}, and
 * leaves inside an existing annotation wrapper, are left alone, so running the engine twice adds nothing. A leaf with nothing to annotate is
 * not touched at all.</p>
 *
 * <p>Instances hold no per-fragment state and may be shared between threads as long as the
 * classifier and resolver can be.</p>
 */
public class AnnotationEngine {

    private static final Logger logger = LoggerFactory.getLogger(AnnotationEngine.class);

    public static final Set<String> DEFAULT_SKIP_TAGS = Set.of("script", "style", "pre", "code");

    /** Elements whose content model is plain text only; wrappers inside them are invalid XHTML. */
    private static final Set<String> TEXT_ONLY_TAGS = Set.of("title", "textarea");

    private static final Set<String> WRAPPER_TAGS = Set.of("span", "ruby");

    private final DifficultyClassifier classifier;
    private final DictionaryResolver resolver;
    private final AnnotationStyle style;
    private final Set<String> skipTags;

    public AnnotationEngine(DifficultyClassifier classifier, DictionaryResolver resolver, AnnotationStyle style) {
        this(classifier, resolver, style, DEFAULT_SKIP_TAGS);
    }

    public AnnotationEngine(DifficultyClassifier classifier, DictionaryResolver resolver,
                            AnnotationStyle style, Collection<String> skipTags) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.style = Objects.requireNonNull(style, "style");
        Set<String> tags = new LinkedHashSet<>();
        for (String tag : skipTags) {
            if (StringUtils.isNotBlank(tag)) {
                tags.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.skipTags = Collections.unmodifiableSet(tags);
    }

    /**
     * Annotates {@code fragment} in place and returns it.
     */
    public Element process(Element fragment) {
        if (fragment == null) {
            return null;
        }

        // Collect first: splicing while traversing would shift the walk
        List<TextNode> leaves = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode && !(node instanceof CDataNode)) {
                leaves.add((TextNode) node);
            }
        }, fragment);

        int modified = 0;
        for (TextNode leaf : leaves) {
            if (isEligible(leaf) && annotateLeaf(leaf)) {
                modified++;
            }
        }

        if (modified > 0) {
            logger.debug("Annotated {} of {} text nodes", modified, leaves.size());
        }
        return fragment;
    }

    public AnnotationStyle getStyle() {
        return style;
    }

    public Set<String> getSkipTags() {
        return skipTags;
    }

    private boolean isEligible(TextNode leaf) {
        Node parent = leaf.parent();
        if (!(parent instanceof Element)) {
            return false;
        }
        String tag = ((Element) parent).normalName();
        if (skipTags.contains(tag) || TEXT_ONLY_TAGS.contains(tag)) {
            return false;
        }
        if (StringUtils.isBlank(leaf.getWholeText())) {
            return false;
        }
        return !insideAnnotation((Element) parent);
    }

    /**
     * True when {@code element} is, or sits inside, a wrapper this engine produced. The gloss
     * element is always a child of its wrapper, so matching the wrapper covers both. Author
     * markup that merely reuses the class names on other elements is still annotated.
     */
    private boolean insideAnnotation(Element element) {
        for (Element current = element; current != null; current = current.parent()) {
            if (isWrapper(current)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWrapper(Element element) {
        return WRAPPER_TAGS.contains(element.normalName())
            && element.hasClass(AnnotationStylesheet.WRAPPER_CLASS);
    }

    /**
     * @return true if the leaf was replaced
     */
    private boolean annotateLeaf(TextNode leaf) {
        String text = leaf.getWholeText();
        List<Node> replacement = new ArrayList<>();
        int lastIndex = 0;
        int annotated = 0;

        for (WordMatch match : classifier.extractWords(text)) {
            Optional<String> gloss = glossFor(match.getText());
            if (gloss.isEmpty()) {
                continue;
            }

            if (match.getStart() > lastIndex) {
                replacement.add(new TextNode(text.substring(lastIndex, match.getStart())));
            }
            replacement.add(buildWrapper(match.getText(), gloss.get()));
            lastIndex = match.getEnd();
            annotated++;
        }

        if (annotated == 0) {
            return false;
        }
        if (lastIndex < text.length()) {
            replacement.add(new TextNode(text.substring(lastIndex)));
        }

        Element parent = (Element) leaf.parent();
        int index = leaf.siblingIndex();
        leaf.remove();
        parent.insertChildren(index, replacement);
        return true;
    }

    /**
     * Gloss for a difficult, resolvable word. A collaborator failure only skips this word.
     */
    private Optional<String> glossFor(String word) {
        try {
            if (!classifier.isDifficult(word)) {
                return Optional.empty();
            }
        } catch (RuntimeException e) {
            logger.debug("Difficulty check failed for '{}', treating as common: {}", word, e.getMessage());
            return Optional.empty();
        }

        try {
            Optional<String> gloss = resolver.lookup(word);
            if (gloss == null) {
                return Optional.empty();
            }
            return gloss.filter(StringUtils::isNotBlank);
        } catch (RuntimeException e) {
            logger.debug("Dictionary lookup failed for '{}', skipping: {}", word, e.getMessage());
            return Optional.empty();
        }
    }

    private Element buildWrapper(String word, String gloss) {
        Element wrapper;
        Element annotation;
        if (style == AnnotationStyle.WORDWISE) {
            wrapper = new Element("ruby");
            annotation = new Element("rt").text(gloss);
        } else {
            wrapper = new Element("span");
            annotation = new Element("span").text(" (" + gloss + ")");
        }
        wrapper.addClass(AnnotationStylesheet.WRAPPER_CLASS).appendText(word);
        annotation.addClass(AnnotationStylesheet.GLOSS_CLASS);
        wrapper.appendChild(annotation);
        return wrapper;
    }
}
