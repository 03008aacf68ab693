package com.example.epubgloss.dto;

import lombok.Value;

/**
 * A candidate word found in a text block. {@code end} is exclusive.
 */
@Value
public class WordMatch {
    int start;
    int end;
    String text;
}
