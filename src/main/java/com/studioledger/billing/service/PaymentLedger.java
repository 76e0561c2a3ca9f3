package com.studioledger.billing.service;

import com.studioledger.billing.dto.PaymentReceipt;
import com.studioledger.billing.dto.PaymentRequest;
import com.studioledger.billing.exception.InvalidTransitionException;
import com.studioledger.billing.exception.OverpaymentRejectedException;
import com.studioledger.billing.exception.ResourceNotFoundException;
import com.studioledger.billing.exception.ValidationException;
import com.studioledger.billing.model.*;
import com.studioledger.billing.repository.InvoiceRepository;
import com.studioledger.billing.repository.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Applies payments against invoices without ever letting the paid amount pass the total.
 * <p>
 * Each write locks the invoice row and then sums the payment history fresh, so two payments on
 * the same invoice are checked one after the other against the real balance. Paid amounts are
 * never cached on the invoice.
 */
@Slf4j
@Service
public class PaymentLedger {

    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final FinancePostingService postingService;
    private final LedgerTransactionRunner transactionRunner;
    private final Clock clock;

    public PaymentLedger(InvoiceRepository invoiceRepository, PaymentRepository paymentRepository,
            FinancePostingService postingService, LedgerTransactionRunner transactionRunner, Clock clock) {
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.postingService = postingService;
        this.transactionRunner = transactionRunner;
        this.clock = clock;
    }

    public PaymentReceipt applyPayment(Long invoiceId, PaymentRequest request) {
        if (request.amount() == null || !Money.isWholeCents(request.amount())) {
            throw new ValidationException("Payment amount must be given in whole cents");
        }
        Money amount = Money.of(request.amount());
        if (!amount.isPositive()) {
            throw new ValidationException("Payment amount must be greater than zero");
        }
        if (request.method() == null) {
            throw new ValidationException("Payment method is required");
        }
        LocalDate paymentDate = request.paymentDate() != null ? request.paymentDate() : LocalDate.now(clock);

        return transactionRunner.run(invoiceId, () -> {
            Invoice invoice = lockInvoice(invoiceId);
            if (invoice.getStatus() == InvoiceStatus.DRAFT || invoice.getStatus() == InvoiceStatus.CANCELLED) {
                throw new InvalidTransitionException(invoice.getStatus(),
                        "Invoice " + invoice.getInvoiceNumber() + " is " + invoice.getStatus() + " and cannot take payments");
            }

            Money total = invoice.total();
            Money paid = Money.of(paymentRepository.sumByInvoiceId(invoiceId));
            Money remaining = total.minus(paid);

            InvoiceTerm term = null;
            Money termPaid = Money.ZERO;
            if (request.termId() != null) {
                term = findTerm(invoice, request.termId());
                termPaid = Money.of(paymentRepository.sumByTermId(term.getId()));
                remaining = remaining.min(Money.of(term.getAmount()).minus(termPaid));
            }

            if (amount.isGreaterThan(remaining)) {
                Money available = remaining.max(Money.ZERO);
                log.warn("Rejected payment of {} on invoice {}: remaining {}", amount, invoice.getInvoiceNumber(), available);
                throw new OverpaymentRejectedException(amount.toBigDecimal(), available.toBigDecimal());
            }

            Payment payment = new Payment();
            payment.setInvoice(invoice);
            payment.setTerm(term);
            payment.setAmount(amount.toBigDecimal());
            payment.setPaymentDate(paymentDate);
            payment.setPaymentMethod(request.method());
            payment.setReferenceNumber(request.referenceNumber());
            payment.setNotes(request.notes());
            payment = paymentRepository.save(payment);
            postingService.postPayment(invoice, payment);

            if (term != null && termPaid.plus(amount).compareTo(Money.of(term.getAmount())) >= 0) {
                term.setStatus(TermStatus.PAID);
            }
            Money paidNow = paid.plus(amount);
            if (paidNow.compareTo(total) >= 0) {
                invoice.setStatus(InvoiceStatus.PAID);
                for (InvoiceTerm t : invoice.getTerms()) {
                    if (t.getStatus() == TermStatus.PENDING) {
                        t.setStatus(TermStatus.PAID);
                    }
                }
            }
            invoiceRepository.save(invoice);

            log.info("Applied payment {} of {} to invoice {} ({} of {} paid)", payment.getId(), amount,
                    invoice.getInvoiceNumber(), paidNow, total);
            return new PaymentReceipt(payment.getId(), invoiceId, term != null ? term.getId() : null,
                    amount.toBigDecimal(), paidNow.toBigDecimal(), total.minus(paidNow).toBigDecimal(),
                    invoice.getStatus(), term != null ? term.getStatus() : null);
        });
    }

    /**
     * Cancels a draft or sent invoice that has no net payments against it.
     */
    public Invoice cancelInvoice(Long invoiceId) {
        return transactionRunner.run(invoiceId, () -> {
            Invoice invoice = lockInvoice(invoiceId);
            if (!invoice.getStatus().canTransitionTo(InvoiceStatus.CANCELLED)) {
                throw new InvalidTransitionException(invoice.getStatus(),
                        "Invoice " + invoice.getInvoiceNumber() + " is " + invoice.getStatus() + " and cannot be cancelled");
            }
            BigDecimal paid = paymentRepository.sumByInvoiceId(invoiceId);
            if (paid.signum() != 0) {
                throw new InvalidTransitionException(invoice.getStatus(),
                        "Invoice " + invoice.getInvoiceNumber() + " has " + paid.toPlainString() + " paid and cannot be cancelled");
            }
            invoice.setStatus(InvoiceStatus.CANCELLED);
            log.info("Cancelled invoice {}", invoice.getInvoiceNumber());
            return invoiceRepository.save(invoice);
        });
    }

    private Invoice lockInvoice(Long invoiceId) {
        return invoiceRepository.findByIdForUpdate(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    private static InvoiceTerm findTerm(Invoice invoice, Long termId) {
        return invoice.getTerms().stream()
                .filter(t -> termId.equals(t.getId()))
                .findFirst()
                .orElseThrow(() -> new ValidationException(
                        "Term " + termId + " does not belong to invoice " + invoice.getInvoiceNumber()));
    }
}
