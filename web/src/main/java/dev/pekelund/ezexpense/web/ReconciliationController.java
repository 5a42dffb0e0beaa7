package dev.pekelund.ezexpense.web;

import dev.pekelund.ezexpense.reconciliation.ContainerRef;
import dev.pekelund.ezexpense.reconciliation.ExpenseSnapshot;
import dev.pekelund.ezexpense.reconciliation.ExportSnapshot;
import dev.pekelund.ezexpense.reconciliation.InvoiceDetails;
import dev.pekelund.ezexpense.reconciliation.MatchOutcome;
import dev.pekelund.ezexpense.reconciliation.MoveReceipt;
import dev.pekelund.ezexpense.reconciliation.MoveResult;
import dev.pekelund.ezexpense.reconciliation.ReceiptContent;
import dev.pekelund.ezexpense.reconciliation.ReceiptSnapshot;
import dev.pekelund.ezexpense.reconciliation.ReconciliationService;
import dev.pekelund.ezexpense.reconciliation.RemoveReceipt;
import dev.pekelund.ezexpense.reconciliation.RunBulkMatch;
import dev.pekelund.ezexpense.reconciliation.UploadOutcome;
import dev.pekelund.ezexpense.reconciliation.UploadReceipts;
import dev.pekelund.ezexpense.reconciliation.ValidationReport;
import dev.pekelund.ezexpense.storage.ReceiptUpload;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    public ReconciliationController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @PostMapping("/expenses/import")
    public List<ExpenseSnapshot> importExpenses(@RequestBody List<Map<String, Object>> rows) {
        return reconciliationService.importExpenses(rows.stream().map(ReconciliationController::toFields).toList());
    }

    @PostMapping("/expenses")
    @ResponseStatus(HttpStatus.CREATED)
    public ExpenseSnapshot addExpense(@RequestBody(required = false) Map<String, Object> fields) {
        return reconciliationService.addExpense(toFields(fields));
    }

    @PatchMapping("/expenses/{id}")
    public ExpenseSnapshot editExpense(@PathVariable("id") long id, @RequestBody Map<String, Object> changes) {
        return reconciliationService.editFields(id, toFields(changes));
    }

    @DeleteMapping("/expenses")
    public List<Long> deleteExpenses(@Valid @RequestBody DeleteExpensesRequest request) {
        return reconciliationService.deleteExpenses(request.ids()).stream().map(ExpenseSnapshot::id).toList();
    }

    @PostMapping(value = "/receipts/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UploadOutcome uploadReceipts(@RequestParam("files") List<MultipartFile> files,
        @RequestParam(value = "expenseId", required = false) Long expenseId) throws IOException {
        List<ReceiptUpload> uploads = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            uploads.add(new ReceiptUpload(file.getOriginalFilename(), file.getContentType(), file.getBytes()));
        }
        return reconciliationService.upload(new UploadReceipts(uploads, expenseId));
    }

    @PostMapping("/receipts/move")
    public MoveResult moveReceipt(@Valid @RequestBody MoveReceiptRequest request) {
        return reconciliationService.move(new MoveReceipt(request.name(), ContainerRef.of(request.fromExpenseId()),
            ContainerRef.of(request.toExpenseId())));
    }

    @DeleteMapping("/receipts/{name}")
    public ReceiptSnapshot removeReceipt(@PathVariable("name") String name,
        @RequestParam(value = "expenseId", required = false) Long expenseId) {
        return reconciliationService.remove(new RemoveReceipt(name, ContainerRef.of(expenseId)));
    }

    @PutMapping("/receipts/{name}/details")
    public ReceiptSnapshot recordInvoiceDetails(@PathVariable("name") String name,
        @RequestBody InvoiceDetails details) {
        return reconciliationService.recordInvoiceDetails(name, details);
    }

    @GetMapping("/receipts/{name}/content")
    public ResponseEntity<byte[]> receiptContent(@PathVariable("name") String name) {
        ReceiptContent content = reconciliationService.loadContent(name);
        MediaType mediaType = StringUtils.hasText(content.receipt().contentType())
            ? MediaType.parseMediaType(content.receipt().contentType())
            : MediaType.APPLICATION_OCTET_STREAM;
        return ResponseEntity.ok()
            .contentType(mediaType)
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.inline().filename(name, StandardCharsets.UTF_8).build().toString())
            .body(content.bytes());
    }

    @PostMapping("/receipts/match-bulk")
    public MatchOutcome matchBulk() {
        return reconciliationService.runBulkMatch(new RunBulkMatch());
    }

    @GetMapping("/reconciliation")
    public ReconciliationView reconciliation() {
        return new ReconciliationView(reconciliationService.snapshot(), reconciliationService.statistics());
    }

    @PostMapping("/reconciliation/validate")
    public ValidationReport validate(@RequestBody(required = false) ValidateRequest request) {
        List<String> editable = request != null ? request.editableFields() : null;
        return reconciliationService.validate(editable != null ? new LinkedHashSet<>(editable) : null);
    }

    @GetMapping("/reconciliation/export")
    public ExportSnapshot export() {
        return reconciliationService.export();
    }

    private static Map<String, String> toFields(Map<String, Object> values) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (values == null) {
            return fields;
        }
        values.forEach((name, value) -> fields.put(name, value != null ? String.valueOf(value) : ""));
        return fields;
    }
}
