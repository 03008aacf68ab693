package com.example.epubgloss.service.difficulty;

import java.util.List;

/**
 * Coarse grammatical categories used when looking for a word's base form. Each category
 * lists the Penn Treebank tags it covers.
 */
public enum PartOfSpeech {
    VERB("VB", "VBD", "VBG", "VBN", "VBP", "VBZ"),
    NOUN("NN", "NNS", "NNP", "NNPS"),
    ADJECTIVE("JJ", "JJR", "JJS"),
    ADVERB("RB", "RBR", "RBS");

    private final List<String> pennTags;

    PartOfSpeech(String... pennTags) {
        this.pennTags = List.of(pennTags);
    }

    public List<String> getPennTags() {
        return pennTags;
    }
}
