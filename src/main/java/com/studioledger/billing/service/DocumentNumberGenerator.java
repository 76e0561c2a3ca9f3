package com.studioledger.billing.service;

import com.studioledger.billing.config.LedgerProperties;
import com.studioledger.billing.model.CreditNote;
import com.studioledger.billing.model.DocumentSequence;
import com.studioledger.billing.model.Invoice;
import com.studioledger.billing.repository.CreditNoteRepository;
import com.studioledger.billing.repository.DocumentSequenceRepository;
import com.studioledger.billing.repository.InvoiceRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Sequential document numbers of the form {@code PREFIX-YYYYMM-NNNNNN}. The sequence restarts
 * each month and continues from the highest number already issued for that month.
 * <p>
 * The caller's transaction holds the document type's sequence row locked until it commits, so the
 * document carrying the number is visible before the next number of that type is computed.
 */
@Component
public class DocumentNumberGenerator {

    private static final DateTimeFormatter PERIOD = DateTimeFormatter.ofPattern("yyyyMM");

    private final InvoiceRepository invoiceRepository;
    private final CreditNoteRepository creditNoteRepository;
    private final DocumentSequenceRepository sequenceRepository;
    private final LedgerProperties properties;

    public DocumentNumberGenerator(InvoiceRepository invoiceRepository, CreditNoteRepository creditNoteRepository,
            DocumentSequenceRepository sequenceRepository, LedgerProperties properties) {
        this.invoiceRepository = invoiceRepository;
        this.creditNoteRepository = creditNoteRepository;
        this.sequenceRepository = sequenceRepository;
        this.properties = properties;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextInvoiceNumber(LocalDate date) {
        DocumentSequence sequence = lockSequence(properties.getInvoiceNumberPrefix());
        String prefix = periodPrefix(properties.getInvoiceNumberPrefix(), date);
        Optional<String> last = invoiceRepository.findTopByInvoiceNumberStartingWithOrderByInvoiceNumberDesc(prefix)
                .map(Invoice::getInvoiceNumber);
        return issue(sequence, prefix, last);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextCreditNoteNumber(LocalDate date) {
        DocumentSequence sequence = lockSequence(properties.getCreditNotePrefix());
        String prefix = periodPrefix(properties.getCreditNotePrefix(), date);
        Optional<String> last = creditNoteRepository.findTopByNoteNumberStartingWithOrderByNoteNumberDesc(prefix)
                .map(CreditNote::getNoteNumber);
        return issue(sequence, prefix, last);
    }

    private DocumentSequence lockSequence(String documentType) {
        // Rows are seeded at startup; creating one here only covers an unseeded database
        return sequenceRepository.findForUpdate(documentType)
                .orElseGet(() -> sequenceRepository.saveAndFlush(new DocumentSequence(documentType)));
    }

    private static String issue(DocumentSequence sequence, String prefix, Optional<String> last) {
        String number = prefix + String.format("%06d", next(prefix, last));
        sequence.setLastNumber(number);
        return number;
    }

    private static String periodPrefix(String documentPrefix, LocalDate date) {
        return documentPrefix + "-" + date.format(PERIOD) + "-";
    }

    private static long next(String prefix, Optional<String> lastNumber) {
        if (lastNumber.isEmpty()) {
            return 1;
        }
        String sequence = lastNumber.get().substring(prefix.length());
        try {
            return Long.parseLong(sequence) + 1;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Unparseable document number " + lastNumber.get(), e);
        }
    }
}
