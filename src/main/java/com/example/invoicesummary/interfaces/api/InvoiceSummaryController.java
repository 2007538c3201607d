package com.example.invoicesummary.interfaces.api;

import com.example.invoicesummary.application.service.DocumentCatalogService;
import com.example.invoicesummary.application.service.DocumentSummaryService;
import com.example.invoicesummary.application.service.ProductSummaryService;
import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.domain.model.DocumentFilter;
import com.example.invoicesummary.domain.model.DocumentSummaryRow;
import com.example.invoicesummary.domain.model.ProductSummary;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Interfaces-layer REST controller for registering documents and reading their summaries.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class InvoiceSummaryController {

    private final DocumentCatalogService documentCatalogService;
    private final DocumentSummaryService documentSummaryService;
    private final ProductSummaryService productSummaryService;

    /**
     * Creates the controller with the required application services.
     *
     * @param documentCatalogService service storing submitted documents
     * @param documentSummaryService service producing the document-level summary
     * @param productSummaryService  service producing the per-product breakdown
     */
    public InvoiceSummaryController(DocumentCatalogService documentCatalogService,
                                    DocumentSummaryService documentSummaryService,
                                    ProductSummaryService productSummaryService) {
        this.documentCatalogService = documentCatalogService;
        this.documentSummaryService = documentSummaryService;
        this.productSummaryService = productSummaryService;
    }

    /**
     * Registers parsed invoices and credit notes.
     *
     * @param documents documents in the order they should be summarized
     * @return number of stored documents
     */
    @PostMapping(value = "/documents", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RegistrationResponse> registerDocuments(@RequestBody List<Document> documents) {
        int registered = documentCatalogService.register(documents);
        return ResponseEntity.status(HttpStatus.CREATED).body(new RegistrationResponse(registered));
    }

    /**
     * Lists the matching documents with their payable totals.
     *
     * @param supplierName  optional supplier wildcard pattern
     * @param invoiceNumber optional document number wildcard pattern
     * @param startDate     inclusive start of the date range, required together with {@code endDate}
     * @param endDate       inclusive end of the date range, required together with {@code startDate}
     * @return document summary rows
     */
    @GetMapping("/documents")
    public List<DocumentSummaryRow> listDocuments(@RequestParam(required = false) String supplierName,
                                                  @RequestParam(required = false) String invoiceNumber,
                                                  @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                                  @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return documentSummaryService.summarize(new DocumentFilter(supplierName, invoiceNumber, startDate, endDate));
    }

    /**
     * Returns the per-product breakdown of the matching documents.
     *
     * @param supplierName  optional supplier wildcard pattern
     * @param invoiceNumber optional document number wildcard pattern
     * @param startDate     inclusive start of the date range, required together with {@code endDate}
     * @param endDate       inclusive end of the date range, required together with {@code startDate}
     * @return product rows, reconciliation warnings and per-document failures
     */
    @GetMapping("/product-summary")
    public ProductSummary productSummary(@RequestParam(required = false) String supplierName,
                                         @RequestParam(required = false) String invoiceNumber,
                                         @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                         @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return productSummaryService.summarize(new DocumentFilter(supplierName, invoiceNumber, startDate, endDate));
    }
}
