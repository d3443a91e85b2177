package com.expensesnap.core.api;

import com.expensesnap.core.api.dto.ExpenseResponse;
import com.expensesnap.core.api.dto.UpdateExpenseRequest;
import com.expensesnap.core.application.ExpenseLedgerService;
import com.expensesnap.core.application.ReceiptIngestionService;
import com.expensesnap.core.application.UploadReceiptCommand;
import com.expensesnap.core.domain.Expense;
import com.expensesnap.core.domain.access.CallerIdentity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/expenses")
@Tag(name = "Expenses", description = "Receipt upload and the expense ledger")
@SecurityRequirement(name = "Bearer Authentication")
public class ExpenseController {

    private static final Logger log = LoggerFactory.getLogger(ExpenseController.class);

    private final ReceiptIngestionService ingestion;
    private final ExpenseLedgerService ledger;

    public ExpenseController(ReceiptIngestionService ingestion, ExpenseLedgerService ledger) {
        this.ingestion = ingestion;
        this.ledger = ledger;
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a receipt image or PDF",
            description = "Normalizes the document, extracts fields, converts totals and stores a new expense.")
    public ResponseEntity<ExpenseResponse> upload(@AuthenticationPrincipal CallerIdentity caller,
                                                  @RequestPart("receipt") MultipartFile receipt,
                                                  @RequestParam(value = "companyId", required = false) UUID companyId)
            throws IOException {
        log.info("Receipt upload from {} - filename: {}, size: {} bytes",
                caller.email(), receipt.getOriginalFilename(), receipt.getSize());
        Expense saved = ingestion.ingest(new UploadReceiptCommand(caller, companyId,
                receipt.getOriginalFilename(), receipt.getBytes()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(saved));
    }

    @GetMapping
    @Operation(summary = "List expenses in scope, newest date first")
    public List<ExpenseResponse> list(@AuthenticationPrincipal CallerIdentity caller,
                                      @RequestParam(value = "companyId", required = false) UUID companyId) {
        return ledger.list(caller, companyId).stream().map(ExpenseResponse::from).toList();
    }

    @PutMapping("/{id}")
    @Operation(summary = "Edit the extracted fields of an expense")
    public ExpenseResponse update(@AuthenticationPrincipal CallerIdentity caller,
                                  @PathVariable("id") UUID id,
                                  @RequestBody UpdateExpenseRequest req) {
        return ExpenseResponse.from(ledger.update(caller, id, req.toUpdate()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete an expense and its stored receipt image")
    public Map<String, Object> delete(@AuthenticationPrincipal CallerIdentity caller, @PathVariable("id") UUID id) {
        ledger.delete(caller, id);
        return Map.of("deleted", id);
    }

    @PostMapping("/recalculate")
    @Operation(summary = "Recompute converted totals with the current exchange rates")
    public Map<String, Object> recalculate(@AuthenticationPrincipal CallerIdentity caller,
                                           @RequestParam(value = "companyId", required = false) UUID companyId) {
        return Map.of("updated", ledger.recalculate(caller, companyId));
    }
}
