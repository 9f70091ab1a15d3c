package com.delta.resumeextractor.extraction.model;

public record CategoryScore(String name, double score) {
}
