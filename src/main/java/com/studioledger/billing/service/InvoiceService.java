package com.studioledger.billing.service;

import com.studioledger.billing.config.LedgerProperties;
import com.studioledger.billing.dto.*;
import com.studioledger.billing.exception.InvalidTransitionException;
import com.studioledger.billing.exception.ResourceNotFoundException;
import com.studioledger.billing.exception.ValidationException;
import com.studioledger.billing.model.*;
import com.studioledger.billing.repository.CreditNoteRepository;
import com.studioledger.billing.repository.InvoiceRepository;
import com.studioledger.billing.repository.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final CreditNoteRepository creditNoteRepository;
    private final InvoiceCalculator calculator;
    private final TermScheduler termScheduler;
    private final DocumentNumberGenerator numberGenerator;
    private final ClientDirectory clientDirectory;
    private final LedgerProperties properties;
    private final Clock clock;

    public InvoiceService(InvoiceRepository invoiceRepository, PaymentRepository paymentRepository,
            CreditNoteRepository creditNoteRepository, InvoiceCalculator calculator, TermScheduler termScheduler, DocumentNumberGenerator numberGenerator,
            ClientDirectory clientDirectory, LedgerProperties properties, Clock clock) {
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.creditNoteRepository = creditNoteRepository;
        this.calculator = calculator;
        this.termScheduler = termScheduler;
        this.numberGenerator = numberGenerator;
        this.clientDirectory = clientDirectory;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public Invoice createInvoice(CreateInvoiceRequest request) {
        if (request.clientId() == null || !clientDirectory.clientExists(request.clientId())) {
            throw new ValidationException("Unknown client " + request.clientId());
        }
        if (request.projectId() != null && !clientDirectory.projectBelongsTo(request.projectId(), request.clientId())) {
            throw new ValidationException("Project " + request.projectId() + " does not belong to client " + request.clientId());
        }
        if (request.items() == null || request.items().isEmpty()) {
            throw new ValidationException("An invoice needs at least one line item");
        }

        LocalDate invoiceDate = request.invoiceDate() != null ? request.invoiceDate() : LocalDate.now(clock);
        LocalDate dueDate = request.dueDate() != null
                ? request.dueDate()
                : invoiceDate.plusDays(properties.getDefaultPaymentDays());
        checkDates(invoiceDate, dueDate);

        Invoice invoice = new Invoice();
        invoice.setClientId(request.clientId());
        invoice.setProjectId(request.projectId());
        invoice.setInvoiceDate(invoiceDate);
        invoice.setDueDate(dueDate);
        invoice.setNotes(request.notes());
        invoice.setStatus(InvoiceStatus.DRAFT);
        applyPricing(invoice, request.items(), request.taxRate(), request.discount());
        invoice.setInvoiceNumber(numberGenerator.nextInvoiceNumber(invoiceDate));

        Invoice saved = invoiceRepository.save(invoice);
        log.info("Created invoice {} for client {} totalling {}", saved.getInvoiceNumber(), saved.getClientId(),
                saved.getTotalAmount());
        return saved;
    }

    @Transactional
    public Invoice updateInvoice(Long invoiceId, InvoicePatch patch) {
        Invoice invoice = findInvoice(invoiceId);
        requireDraft(invoice, "edited");

        LocalDate invoiceDate = patch.invoiceDate() != null ? patch.invoiceDate() : invoice.getInvoiceDate();
        LocalDate dueDate = patch.dueDate() != null ? patch.dueDate() : invoice.getDueDate();
        checkDates(invoiceDate, dueDate);
        invoice.setInvoiceDate(invoiceDate);
        invoice.setDueDate(dueDate);
        if (patch.notes() != null) {
            invoice.setNotes(patch.notes());
        }

        List<LineItemRequest> items = patch.items() != null ? patch.items() : currentItems(invoice);
        if (items.isEmpty()) {
            throw new ValidationException("An invoice needs at least one line item");
        }
        BigDecimal taxRate = patch.taxRate() != null ? patch.taxRate() : invoice.getTaxRate();
        Discount discount = patch.discount() != null
                ? patch.discount()
                : new Discount(invoice.getDiscountType(), invoice.getDiscountValue());
        applyPricing(invoice, items, taxRate, discount);

        // Keep the agreed split, rescaled to the new total
        if (!invoice.getTerms().isEmpty()) {
            List<TermRequest> current = invoice.getTerms().stream()
                    .map(t -> new TermRequest(t.getTermNumber(), t.getPercentage(), t.getDueDate(), t.getDescription()))
                    .collect(Collectors.toList());
            List<ScheduledTerm> rescaled = termScheduler.schedule(invoice.total(), current);
            for (int i = 0; i < rescaled.size(); i++) {
                invoice.getTerms().get(i).setAmount(rescaled.get(i).amount().toBigDecimal());
            }
        }

        Invoice saved = invoiceRepository.save(invoice);
        log.info("Updated draft invoice {}, total now {}", saved.getInvoiceNumber(), saved.getTotalAmount());
        return saved;
    }

    @Transactional
    public void deleteInvoice(Long invoiceId) {
        Invoice invoice = findInvoice(invoiceId);
        requireDraft(invoice, "deleted");
        invoiceRepository.delete(invoice);
        log.info("Deleted draft invoice {}", invoice.getInvoiceNumber());
    }

    @Transactional
    public Invoice sendInvoice(Long invoiceId) {
        Invoice invoice = findInvoice(invoiceId);
        if (invoice.getStatus() != InvoiceStatus.DRAFT) {
            throw new InvalidTransitionException(invoice.getStatus(),
                    "Only draft invoices can be sent, invoice " + invoice.getInvoiceNumber() + " is " + invoice.getStatus());
        }
        invoice.setStatus(InvoiceStatus.SENT);
        log.info("Invoice {} sent", invoice.getInvoiceNumber());
        return invoiceRepository.save(invoice);
    }

    @Transactional
    public Invoice scheduleTerms(Long invoiceId, List<TermRequest> terms) {
        Invoice invoice = findInvoice(invoiceId);
        requireDraft(invoice, "rescheduled");

        List<ScheduledTerm> scheduled = termScheduler.schedule(invoice.total(), terms);

        // Flush the removals first; the (invoice, term number) key is unique.
        invoice.getTerms().clear();
        invoiceRepository.saveAndFlush(invoice);

        for (ScheduledTerm s : scheduled) {
            InvoiceTerm term = new InvoiceTerm();
            term.setTermNumber(s.termNumber());
            term.setPercentage(s.percentage());
            term.setAmount(s.amount().toBigDecimal());
            term.setDueDate(s.dueDate());
            term.setDescription(s.description());
            term.setStatus(TermStatus.PENDING);
            invoice.addTerm(term);
        }
        Invoice saved = invoiceRepository.save(invoice);
        log.info("Scheduled {} terms on invoice {}", scheduled.size(), saved.getInvoiceNumber());
        return saved;
    }

    @Transactional(readOnly = true)
    public InvoiceDetails getInvoiceDetails(Long invoiceId) {
        Invoice invoice = findInvoice(invoiceId);
        LocalDate today = LocalDate.now(clock);

        Money total = invoice.total();
        Money paid = Money.of(paymentRepository.sumByInvoiceId(invoiceId));
        Money remaining = total.minus(paid);

        List<InvoiceDetails.Item> items = invoice.getItems().stream()
                .map(i -> new InvoiceDetails.Item(i.getLineNumber(), i.getDescription(), i.getQuantity(),
                        i.getUnitPrice(), i.getTaxRate(), i.getLineTotal()))
                .collect(Collectors.toList());

        List<InvoiceDetails.Term> terms = new ArrayList<>();
        for (InvoiceTerm t : invoice.getTerms()) {
            Money termPaid = Money.of(paymentRepository.sumByTermId(t.getId()));
            // settled terms owe nothing, even when the settling payment was not tagged to them
            Money termRemaining = t.getStatus() == TermStatus.PAID
                    ? Money.ZERO
                    : Money.of(t.getAmount()).minus(termPaid).max(Money.ZERO);
            terms.add(new InvoiceDetails.Term(t.getId(), t.getTermNumber(), t.getPercentage(), t.getAmount(),
                    t.getDueDate(), t.getDescription(), t.effectiveStatus(today), termPaid.toBigDecimal(),
                    termRemaining.toBigDecimal()));
        }

        List<InvoiceDetails.PaymentEntry> payments = paymentRepository.findByInvoiceIdOrderByPaymentDateAscIdAsc(invoiceId)
                .stream()
                .map(p -> new InvoiceDetails.PaymentEntry(p.getId(), p.getTerm() != null ? p.getTerm().getId() : null,
                        p.getAmount(), p.getPaymentDate(), p.getPaymentMethod(), p.getReferenceNumber(),
                        p.getRefundOf() != null ? p.getRefundOf().getId() : null, p.getRefundReason()))
                .collect(Collectors.toList());

        List<InvoiceDetails.CreditNoteEntry> creditNotes = creditNoteRepository.findByInvoiceIdOrderByNoteDateAsc(invoiceId)
                .stream()
                .map(n -> new InvoiceDetails.CreditNoteEntry(n.getId(), n.getNoteNumber(), n.getAmount(), n.getReason(),
                        n.getNoteDate(), n.getRefundPayment() != null ? n.getRefundPayment().getId() : null))
                .collect(Collectors.toList());

        return new InvoiceDetails(invoice.getId(), invoice.getInvoiceNumber(), invoice.getClientId(),
                invoice.getProjectId(), invoice.getInvoiceDate(), invoice.getDueDate(), invoice.effectiveStatus(today),
                invoice.getTaxRate(), invoice.getSubtotal(), invoice.getDiscountAmount(), invoice.getTaxAmount(),
                invoice.getTotalAmount(), paid.toBigDecimal(), remaining.toBigDecimal(), paid.percentOf(total),
                invoice.getNotes(), items, terms, payments, creditNotes);
    }

    private Invoice findInvoice(Long invoiceId) {
        return invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    private void requireDraft(Invoice invoice, String action) {
        if (invoice.getStatus() != InvoiceStatus.DRAFT) {
            throw new InvalidTransitionException(invoice.getStatus(),
                    "Invoice " + invoice.getInvoiceNumber() + " is " + invoice.getStatus() + " and can no longer be " + action);
        }
    }

    private static void checkDates(LocalDate invoiceDate, LocalDate dueDate) {
        if (dueDate.isBefore(invoiceDate)) {
            throw new ValidationException("Due date " + dueDate + " is before invoice date " + invoiceDate);
        }
    }

    private static List<LineItemRequest> currentItems(Invoice invoice) {
        return invoice.getItems().stream()
                .map(i -> new LineItemRequest(i.getDescription(), i.getQuantity(), i.getUnitPrice(), i.getTaxRate()))
                .collect(Collectors.toList());
    }

    private void applyPricing(Invoice invoice, List<LineItemRequest> items, BigDecimal taxRate, Discount discount) {
        InvoiceTotals totals = calculator.calculate(items, taxRate, discount);

        invoice.getItems().clear();
        for (int i = 0; i < items.size(); i++) {
            LineItemRequest request = items.get(i);
            InvoiceItem item = new InvoiceItem();
            item.setLineNumber(i + 1);
            item.setDescription(request.description());
            item.setQuantity(request.quantity());
            item.setUnitPrice(request.unitPrice());
            item.setTaxRate(request.taxRate());
            item.setLineTotal(totals.lineTotals().get(i).toBigDecimal());
            invoice.addItem(item);
        }

        invoice.setTaxRate(taxRate != null ? taxRate : BigDecimal.ZERO);
        boolean hasDiscount = discount != null && discount.type() != null && discount.value() != null;
        invoice.setDiscountType(hasDiscount ? discount.type() : null);
        invoice.setDiscountValue(hasDiscount ? discount.value() : null);
        invoice.setSubtotal(totals.subtotal().toBigDecimal());
        invoice.setDiscountAmount(totals.discountAmount().toBigDecimal());
        invoice.setTaxAmount(totals.taxAmount().toBigDecimal());
        invoice.setTotalAmount(totals.totalAmount().toBigDecimal());
    }
}
