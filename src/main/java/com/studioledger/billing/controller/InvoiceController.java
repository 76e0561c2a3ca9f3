package com.studioledger.billing.controller;

import com.studioledger.billing.dto.*;
import com.studioledger.billing.model.Invoice;
import com.studioledger.billing.service.InvoiceService;
import com.studioledger.billing.service.PaymentLedger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

    private final InvoiceService invoiceService;
    private final PaymentLedger paymentLedger;

    public InvoiceController(InvoiceService invoiceService, PaymentLedger paymentLedger) {
        this.invoiceService = invoiceService;
        this.paymentLedger = paymentLedger;
    }

    @PostMapping
    public ResponseEntity<InvoiceDetails> create(@RequestBody CreateInvoiceRequest request) {
        Invoice invoice = invoiceService.createInvoice(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(invoiceService.getInvoiceDetails(invoice.getId()));
    }

    @GetMapping("/{id}")
    public InvoiceDetails get(@PathVariable Long id) {
        return invoiceService.getInvoiceDetails(id);
    }

    @PutMapping("/{id}")
    public InvoiceDetails update(@PathVariable Long id, @RequestBody InvoicePatch patch) {
        invoiceService.updateInvoice(id, patch);
        return invoiceService.getInvoiceDetails(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        invoiceService.deleteInvoice(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/send")
    public InvoiceDetails send(@PathVariable Long id) {
        invoiceService.sendInvoice(id);
        return invoiceService.getInvoiceDetails(id);
    }

    @PostMapping("/{id}/cancel")
    public InvoiceDetails cancel(@PathVariable Long id) {
        paymentLedger.cancelInvoice(id);
        return invoiceService.getInvoiceDetails(id);
    }

    @PutMapping("/{id}/terms")
    public InvoiceDetails scheduleTerms(@PathVariable Long id, @RequestBody List<TermRequest> terms) {
        invoiceService.scheduleTerms(id, terms);
        return invoiceService.getInvoiceDetails(id);
    }

    @PostMapping("/{id}/payments")
    public ResponseEntity<PaymentReceipt> pay(@PathVariable Long id, @RequestBody PaymentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(paymentLedger.applyPayment(id, request));
    }
}
