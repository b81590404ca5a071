package com.clinical.review.fhir;

/**
 * Raised when a bundle cannot be read or is not a FHIR R4 Bundle.
 */
public class BundleReadException extends RuntimeException {

    public BundleReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
