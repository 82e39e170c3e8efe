package dev.asclepius.document;

import java.util.Map;

/**
 * Full content of one document.
 *
 * @param documentId the document identifier
 * @param text decoded document text
 * @param metadata every metadata key stored with the document
 */
public record DocumentDetails(String documentId, String text, Map<String, Object> metadata) {}
