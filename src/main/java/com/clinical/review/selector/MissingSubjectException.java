package com.clinical.review.selector;

/**
 * Thrown when a bundle has no Patient resource. Selection cannot proceed without a subject.
 */
public class MissingSubjectException extends RuntimeException {

    public MissingSubjectException(String message) {
        super(message);
    }
}
