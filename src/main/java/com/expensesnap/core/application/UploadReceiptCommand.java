package com.expensesnap.core.application;

import com.expensesnap.core.domain.access.CallerIdentity;

import java.util.UUID;

public class UploadReceiptCommand {
    public final CallerIdentity caller;
    // Null means the caller's own company; naming another company is denied unless the caller is a super admin
    public final UUID targetCompanyId;
    public final String originalFilename;
    public final byte[] content;

    public UploadReceiptCommand(CallerIdentity caller, UUID targetCompanyId, String originalFilename, byte[] content) {
        this.caller = caller;
        this.targetCompanyId = targetCompanyId;
        this.originalFilename = originalFilename;
        this.content = content;
    }
}
