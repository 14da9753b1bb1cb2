package com.compliance.guardian.model;

public record NormalizedRow(int rowNumber, Email email) {}
