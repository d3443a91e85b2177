package com.expensesnap.core.domain;

public record NormalizedImage(byte[] bytes, String mediaType) {
}
