package com.expensesnap.core.domain.ports;

import com.expensesnap.core.domain.ExtractedReceipt;
import com.expensesnap.core.domain.NormalizedImage;

import java.util.List;

public interface ReceiptExtractor {

    /**
     * Sends every page, in order, in a single request and returns the parsed receipt.
     *
     * @throws com.expensesnap.core.exception.ExtractionUnavailableException on transport failure, timeout or non-2xx
     * @throws com.expensesnap.core.exception.ExtractionParseFailedException when the reply is not a JSON object
     */
    ExtractedReceipt extract(List<NormalizedImage> pages);
}
