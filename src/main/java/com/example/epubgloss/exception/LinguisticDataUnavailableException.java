package com.example.epubgloss.exception;

/**
 * Thrown while wiring the classifier or resolver when their backing data (frequency list,
 * lemma dictionary, lexical store) is missing or unreadable.
 */
public class LinguisticDataUnavailableException extends RuntimeException {
    public LinguisticDataUnavailableException(String message) {
        super(message);
    }

    public LinguisticDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
