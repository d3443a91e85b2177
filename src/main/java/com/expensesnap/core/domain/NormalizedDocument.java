package com.expensesnap.core.domain;

import java.util.List;

/**
 * Output of document normalization: the pages to send for extraction, in order, and the
 * single image kept as the receipt preview.
 */
public record NormalizedDocument(List<NormalizedImage> pages, byte[] previewBytes, String previewExtension) {

    public NormalizedDocument {
        if (pages == null || pages.isEmpty()) {
            throw new IllegalArgumentException("A normalized document has at least one page");
        }
        pages = List.copyOf(pages);
    }

    public int pageCount() {
        return pages.size();
    }
}
