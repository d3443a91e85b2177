package com.expensesnap.core.domain.ports;

import com.expensesnap.core.domain.NormalizedDocument;

public interface DocumentNormalizer {

    /**
     * Turns uploaded bytes into extraction-ready images.
     *
     * @throws com.expensesnap.core.exception.ConversionFailedException when a HEIC/HEIF file cannot be decoded
     * @throws com.expensesnap.core.exception.DocumentUnreadableException when a PDF cannot be opened or has no pages
     */
    NormalizedDocument normalize(byte[] content, String filename);
}
