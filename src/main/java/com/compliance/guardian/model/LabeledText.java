package com.compliance.guardian.model;

/**
 * A training sample for the classifier.
 */
public record LabeledText(String text, Category label) {}
