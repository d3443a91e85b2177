package com.expensesnap.core.domain.ports;

import java.util.UUID;

public interface ReceiptImageStoragePort {

    /**
     * Writes the preview image under the company's directory.
     *
     * @return reference to store on the expense, relative to the storage root
     */
    String store(UUID companyId, byte[] bytes, String extension);

    void delete(String reference);
}
