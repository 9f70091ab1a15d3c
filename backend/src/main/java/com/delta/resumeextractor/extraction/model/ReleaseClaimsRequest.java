package com.delta.resumeextractor.extraction.model;

import java.util.List;

public record ReleaseClaimsRequest(List<Long> recordIds) {
}
