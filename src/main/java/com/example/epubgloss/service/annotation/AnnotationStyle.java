package com.example.epubgloss.service.annotation;

/**
 * How a gloss is laid out next to its word.
 */
public enum AnnotationStyle {
    /** "word (gloss)" in the normal text flow. */
    INLINE,
    /** Gloss on a smaller line stacked under the word (ruby markup). */
    WORDWISE
}
