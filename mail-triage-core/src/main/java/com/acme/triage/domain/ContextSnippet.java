package com.acme.triage.domain;

/** Retrieved context passed to the classifier. */
public record ContextSnippet(String id, String text, double score) {}
