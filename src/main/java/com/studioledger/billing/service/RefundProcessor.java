package com.studioledger.billing.service;

import com.studioledger.billing.dto.RefundRequest;
import com.studioledger.billing.dto.RefundResult;
import com.studioledger.billing.exception.RefundNotEligibleException;
import com.studioledger.billing.exception.ResourceNotFoundException;
import com.studioledger.billing.exception.ValidationException;
import com.studioledger.billing.model.*;
import com.studioledger.billing.repository.CreditNoteRepository;
import com.studioledger.billing.repository.InvoiceRepository;
import com.studioledger.billing.repository.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Reverses all or part of a recorded payment. The original row is left untouched; the refund is
 * a negative counter-entry on the same invoice and term, documented by a credit note.
 */
@Slf4j
@Service
public class RefundProcessor {

    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final CreditNoteRepository creditNoteRepository;
    private final FinancePostingService postingService;
    private final DocumentNumberGenerator numberGenerator;
    private final LedgerTransactionRunner transactionRunner;
    private final Clock clock;

    public RefundProcessor(InvoiceRepository invoiceRepository, PaymentRepository paymentRepository,
            CreditNoteRepository creditNoteRepository, FinancePostingService postingService,
            DocumentNumberGenerator numberGenerator, LedgerTransactionRunner transactionRunner, Clock clock) {
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.creditNoteRepository = creditNoteRepository;
        this.postingService = postingService;
        this.numberGenerator = numberGenerator;
        this.transactionRunner = transactionRunner;
        this.clock = clock;
    }

    public RefundResult refund(Long paymentId, RefundRequest request) {
        if (request.amount() == null || !Money.isWholeCents(request.amount())) {
            throw new ValidationException("Refund amount must be given in whole cents");
        }
        Money amount = Money.of(request.amount());
        if (!amount.isPositive()) {
            throw new ValidationException("Refund amount must be greater than zero");
        }
        if (request.reason() == null || request.reason().isBlank()) {
            throw new ValidationException("A refund reason is required");
        }
        LocalDate refundDate = request.refundDate() != null ? request.refundDate() : LocalDate.now(clock);

        Long invoiceId = paymentRepository.findInvoiceIdById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));

        return transactionRunner.run(invoiceId, () -> {
            Invoice invoice = invoiceRepository.findByIdForUpdate(invoiceId)
                    .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
            Payment original = paymentRepository.findById(paymentId)
                    .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));

            if (original.isRefund()) {
                throw new RefundNotEligibleException("Payment " + paymentId + " is itself a refund", BigDecimal.ZERO);
            }
            if (invoice.getStatus() == InvoiceStatus.CANCELLED) {
                throw new RefundNotEligibleException("Invoice " + invoice.getInvoiceNumber() + " is cancelled",
                        BigDecimal.ZERO);
            }

            Money alreadyRefunded = Money.of(paymentRepository.sumByRefundOfId(paymentId)).negate();
            Money refundable = Money.of(original.getAmount()).minus(alreadyRefunded);
            if (!refundable.isPositive()) {
                throw new RefundNotEligibleException("Payment " + paymentId + " is already fully refunded",
                        BigDecimal.ZERO);
            }
            if (amount.isGreaterThan(refundable)) {
                log.warn("Rejected refund of {} on payment {}: only {} refundable", amount, paymentId, refundable);
                throw new RefundNotEligibleException("Refund of " + amount + " exceeds refundable amount of "
                        + refundable + " on payment " + paymentId, refundable.toBigDecimal());
            }

            Money paidBefore = Money.of(paymentRepository.sumByInvoiceId(invoiceId));

            Payment refund = new Payment();
            refund.setInvoice(invoice);
            refund.setTerm(original.getTerm());
            refund.setAmount(amount.negate().toBigDecimal());
            refund.setPaymentDate(refundDate);
            refund.setPaymentMethod(original.getPaymentMethod());
            refund.setReferenceNumber("REFUND-" + paymentId);
            refund.setNotes("Refund for payment " + paymentId + ": " + request.reason());
            refund.setRefundOf(original);
            refund.setRefundReason(request.reason());
            refund = paymentRepository.save(refund);

            CreditNote note = new CreditNote();
            note.setNoteNumber(numberGenerator.nextCreditNoteNumber(refundDate));
            note.setInvoice(invoice);
            note.setRefundPayment(refund);
            note.setAmount(amount.toBigDecimal());
            note.setReason(request.reason());
            note.setNoteDate(refundDate);
            note = creditNoteRepository.save(note);

            postingService.postRefund(invoice, refund, note);

            Money paidAfter = paidBefore.minus(amount);
            Money total = invoice.total();
            if (invoice.getStatus() == InvoiceStatus.PAID && paidAfter.isLessThan(total)) {
                invoice.setStatus(InvoiceStatus.SENT);
                // Terms closed along with the invoice stand on their own payments again
                for (InvoiceTerm t : invoice.getTerms()) {
                    reopenIfShort(t);
                }
            } else if (original.getTerm() != null) {
                reopenIfShort(original.getTerm());
            }
            invoiceRepository.save(invoice);

            log.info("Refunded {} of payment {} on invoice {} as {}", amount, paymentId, invoice.getInvoiceNumber(),
                    note.getNoteNumber());
            return new RefundResult(refund.getId(), paymentId, note.getId(), note.getNoteNumber(),
                    amount.toBigDecimal(), invoiceId, invoice.getStatus(), total.minus(paidAfter).toBigDecimal());
        });
    }

    private void reopenIfShort(InvoiceTerm term) {
        if (term.getStatus() != TermStatus.PAID) {
            return;
        }
        Money termPaid = Money.of(paymentRepository.sumByTermId(term.getId()));
        if (termPaid.isLessThan(Money.of(term.getAmount()))) {
            term.setStatus(TermStatus.PENDING);
        }
    }
}
