package com.advocacypacket.core.model;

public record ConfidenceAnnotation(String source, String lastUpdated, double score, ConfidenceLevel level) {
}
