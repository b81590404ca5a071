package com.clinical.review.report;

import com.clinical.review.model.ReviewItem;
import com.clinical.review.model.SelectionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;

/**
 * Serializes review results to JSON for the rendering and summarization layers.
 * Instants are written as ISO-8601 strings and enums as their wire values.
 */
public class ReviewItemWriter {

    private final ObjectMapper objectMapper;

    public ReviewItemWriter() {
        this(new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ReviewItemWriter(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("ObjectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * Write review items as a JSON array
     */
    public String writeItems(List<ReviewItem> items) {
        return toJson(objectMapper.valueToTree(items));
    }

    /**
     * Write the result for one bundle: source, patient id, processing stats and review items
     * @param source Where the bundle came from (file name)
     * @param selection The selection the items were computed from
     * @param items The review items
     * @return JSON object
     */
    public String writeReport(String source, SelectionResult selection, List<ReviewItem> items) {
        return toJson(reportNode(source, selection, items));
    }

    /**
     * Write a failed bundle as {"source": ..., "error": ...}
     */
    public String writeError(String source, String message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("source", source);
        node.put("error", message);
        return toJson(node);
    }

    private ObjectNode reportNode(String source, SelectionResult selection, List<ReviewItem> items) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("source", source);
        if (selection.getPatient() != null && selection.getPatient().hasIdElement()) {
            node.put("patientId", selection.getPatient().getIdElement().getIdPart());
        }
        node.set("processingStats", objectMapper.valueToTree(selection.getProcessingStats()));
        node.set("reviewItems", objectMapper.valueToTree(items));
        return node;
    }

    private String toJson(Object node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize review output: " + e.getMessage(), e);
        }
    }
}
