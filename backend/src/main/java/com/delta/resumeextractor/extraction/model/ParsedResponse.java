package com.delta.resumeextractor.extraction.model;

public record ParsedResponse(ParsedFieldSet fields, ParseDiagnostics diagnostics) {
}
