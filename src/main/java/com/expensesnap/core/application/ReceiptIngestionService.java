package com.expensesnap.core.application;

import com.expensesnap.core.domain.Company;
import com.expensesnap.core.domain.CurrencyCode;
import com.expensesnap.core.domain.Expense;
import com.expensesnap.core.domain.ExtractedReceipt;
import com.expensesnap.core.domain.NormalizedDocument;
import com.expensesnap.core.domain.access.DataScope;
import com.expensesnap.core.domain.access.TenantAccessPolicy;
import com.expensesnap.core.domain.access.TenantOperation;
import com.expensesnap.core.domain.ports.CompanyRepository;
import com.expensesnap.core.domain.ports.DocumentNormalizer;
import com.expensesnap.core.domain.ports.ReceiptExtractor;
import com.expensesnap.core.domain.ports.ReceiptImageStoragePort;
import com.expensesnap.core.exception.NotFoundException;
import com.expensesnap.core.infrastructure.security.UploadValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Upload pipeline: access check, content validation, normalization, extraction, conversion,
 * then a single ledger write. Nothing is written to disk or database until extraction has
 * succeeded, and the extraction call runs outside any transaction.
 */
@Service
public class ReceiptIngestionService {

    private static final Logger log = LoggerFactory.getLogger(ReceiptIngestionService.class);

    private final UploadValidationService uploadValidation;
    private final DocumentNormalizer normalizer;
    private final ReceiptExtractor extractor;
    private final CurrencyConversionService currency;
    private final ExpenseLedgerService ledger;
    private final CompanyRepository companies;
    private final ReceiptImageStoragePort storage;
    private final Clock clock;

    private final TenantAccessPolicy policy = new TenantAccessPolicy();

    public ReceiptIngestionService(UploadValidationService uploadValidation, DocumentNormalizer normalizer,
                                   ReceiptExtractor extractor, CurrencyConversionService currency,
                                   ExpenseLedgerService ledger, CompanyRepository companies,
                                   ReceiptImageStoragePort storage, Clock clock) {
        this.uploadValidation = uploadValidation;
        this.normalizer = normalizer;
        this.extractor = extractor;
        this.currency = currency;
        this.ledger = ledger;
        this.companies = companies;
        this.storage = storage;
        this.clock = clock;
    }

    public Expense ingest(UploadReceiptCommand cmd) {
        DataScope scope = policy.require(cmd.caller, TenantOperation.WRITE_EXPENSES, cmd.targetCompanyId);
        // A super admin without a target company creates an unassigned row
        UUID companyId = scope.getCompanyId();
        CurrencyCode home = CurrencyCode.USD;
        if (companyId != null) {
            home = companies.findById(companyId)
                    .map(Company::getHomeCurrency)
                    .orElseThrow(() -> new NotFoundException("Company not found"));
        }

        log.info("Receipt upload '{}' ({} bytes) by {} for company {}",
                cmd.originalFilename, cmd.content == null ? 0 : cmd.content.length, cmd.caller.userId(), companyId);
        uploadValidation.validate(cmd.originalFilename, cmd.content);

        NormalizedDocument document = normalizer.normalize(cmd.content, cmd.originalFilename);
        log.debug("Normalized into {} page(s)", document.pageCount());

        ExtractedReceipt receipt = extractor.extract(document.pages());
        log.info("Extracted receipt - vendor: '{}', total: {} {}, category: {}",
                receipt.vendor(), receipt.total(), receipt.currency(), receipt.category().label());

        BigDecimal totalHome = currency.convert(receipt.total(), receipt.currency(), home);
        BigDecimal totalUsd = currency.convert(receipt.total(), receipt.currency(), CurrencyCode.USD);

        String imageRef = storage.store(companyId, document.previewBytes(), document.previewExtension());
        Expense expense = new Expense(
                UUID.randomUUID(),
                receipt.date(),
                receipt.vendor(),
                receipt.location(),
                receipt.category(),
                receipt.subtotal(),
                receipt.tax(),
                receipt.tip(),
                receipt.total(),
                receipt.paymentMethod(),
                receipt.currency(),
                totalHome,
                totalUsd,
                receipt.items(),
                cmd.caller.name(),
                companyId,
                imageRef,
                OffsetDateTime.now(clock));
        try {
            return ledger.record(expense);
        } catch (RuntimeException e) {
            log.error("Failed to record expense {}, removing stored image {}", expense.getId(), imageRef);
            storage.delete(imageRef);
            throw e;
        }
    }
}
