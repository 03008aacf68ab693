package com.example.epubgloss.service.annotation;

/**
 * CSS shipped with annotated documents, one variant per {@link AnnotationStyle}.
 */
public final class AnnotationStylesheet {

    public static final String WRAPPER_CLASS = "annotated-word";
    public static final String GLOSS_CLASS = "annotation";

    private static final String INLINE_CSS = """
        .annotated-word { display: inline; }
        .annotation {
            font-size: 0.75em;
            color: #7f8c8d;
            background-color: #f0f3f4;
            padding: 0 4px;
            margin: 0 2px;
            border-radius: 4px;
            font-family: sans-serif;
        }
        """;

    private static final String WORDWISE_CSS = """
        ruby.annotated-word {
            ruby-position: under;
            -webkit-ruby-position: after;
            ruby-align: start;
        }
        rt.annotation {
            font-size: 0.55em;
            line-height: 1.1;
            color: #7f8c8d;
            font-family: sans-serif;
            white-space: nowrap;
        }
        rt.annotation::before {
            content: "\\23A9";
            margin-right: 1px;
        }
        """;

    private AnnotationStylesheet() {
    }

    public static String forStyle(AnnotationStyle style) {
        switch (style) {
            case WORDWISE:
                return WORDWISE_CSS;
            case INLINE:
            default:
                return INLINE_CSS;
        }
    }
}
