package com.clinical.review.fhir;

import ca.uhn.fhir.context.FhirContext;
import ca.uhn.fhir.parser.DataFormatException;
import ca.uhn.fhir.parser.IParser;
import org.hl7.fhir.r4.model.Bundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * BundleReader turns FHIR R4 JSON into a HAPI {@link Bundle}.
 * It only parses; it does not validate the bundle against the FHIR profiles.
 */
public class BundleReader {
    private static final Logger logger = LoggerFactory.getLogger(BundleReader.class);

    private final FhirContext fhirContext;

    /**
     * Create a BundleReader with a new R4 context
     */
    public BundleReader() {
        this(FhirContext.forR4());
    }

    /**
     * Create a BundleReader sharing an existing context (contexts are expensive to build)
     * @param fhirContext An R4 FHIR context
     */
    public BundleReader(FhirContext fhirContext) {
        if (fhirContext == null) {
            throw new IllegalArgumentException("FhirContext cannot be null");
        }
        this.fhirContext = fhirContext;
    }

    /**
     * Read a bundle from a JSON file
     * @param path The bundle file
     * @return The parsed bundle
     */
    public Bundle read(Path path) {
        logger.debug("Reading bundle from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        } catch (IOException e) {
            throw new BundleReadException("Unable to read bundle file " + path, e);
        }
    }

    /**
     * Read a bundle from a UTF-8 JSON stream. The stream is not closed.
     */
    public Bundle read(InputStream inputStream) {
        return parse(new InputStreamReader(inputStream, StandardCharsets.UTF_8), "stream");
    }

    /**
     * Parse a bundle from a JSON string
     */
    public Bundle parse(String json) {
        return parse(new StringReader(json), "string");
    }

    private Bundle parse(Reader reader, String source) {
        // Parsers are not thread-safe, the context is
        IParser parser = fhirContext.newJsonParser();
        try {
            Bundle bundle = parser.parseResource(Bundle.class, reader);
            logger.debug("Parsed bundle from {} with {} entries", source, bundle.getEntry().size());
            return bundle;
        } catch (DataFormatException e) {
            throw new BundleReadException("Invalid FHIR bundle in " + source + ": " + e.getMessage(), e);
        }
    }
}
