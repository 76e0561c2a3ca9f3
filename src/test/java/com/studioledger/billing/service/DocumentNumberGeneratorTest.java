package com.studioledger.billing.service;

import com.studioledger.billing.config.LedgerProperties;
import com.studioledger.billing.model.CreditNote;
import com.studioledger.billing.model.DocumentSequence;
import com.studioledger.billing.model.Invoice;
import com.studioledger.billing.repository.CreditNoteRepository;
import com.studioledger.billing.repository.DocumentSequenceRepository;
import com.studioledger.billing.repository.InvoiceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentNumberGeneratorTest {

    private static final LocalDate MARCH = LocalDate.of(2026, 3, 14);

    @Mock
    private InvoiceRepository invoiceRepository;
    @Mock
    private CreditNoteRepository creditNoteRepository;
    @Mock
    private DocumentSequenceRepository sequenceRepository;

    private DocumentNumberGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new DocumentNumberGenerator(invoiceRepository, creditNoteRepository, sequenceRepository,
                new LedgerProperties());
    }

    @Test
    void nextInvoiceNumber_ShouldLockSequenceBeforeReadingLastNumber() {
        DocumentSequence sequence = new DocumentSequence("INV");
        when(sequenceRepository.findForUpdate("INV")).thenReturn(Optional.of(sequence));
        Invoice last = new Invoice();
        last.setInvoiceNumber("INV-202603-000041");
        when(invoiceRepository.findTopByInvoiceNumberStartingWithOrderByInvoiceNumberDesc("INV-202603-"))
                .thenReturn(Optional.of(last));

        assertEquals("INV-202603-000042", generator.nextInvoiceNumber(MARCH));
        assertEquals("INV-202603-000042", sequence.getLastNumber());

        InOrder order = inOrder(sequenceRepository, invoiceRepository);
        order.verify(sequenceRepository).findForUpdate("INV");
        order.verify(invoiceRepository).findTopByInvoiceNumberStartingWithOrderByInvoiceNumberDesc("INV-202603-");
    }

    @Test
    void nextCreditNoteNumber_ShouldStartEachMonthAtOne() {
        when(sequenceRepository.findForUpdate("CN")).thenReturn(Optional.of(new DocumentSequence("CN")));
        when(creditNoteRepository.findTopByNoteNumberStartingWithOrderByNoteNumberDesc("CN-202603-"))
                .thenReturn(Optional.empty());

        assertEquals("CN-202603-000001", generator.nextCreditNoteNumber(MARCH));
    }

    @Test
    void nextCreditNoteNumber_ShouldCreateMissingSequenceRow() {
        when(sequenceRepository.findForUpdate("CN")).thenReturn(Optional.empty());
        when(sequenceRepository.saveAndFlush(any(DocumentSequence.class))).thenAnswer(inv -> inv.getArgument(0));
        CreditNote last = new CreditNote();
        last.setNoteNumber("CN-202603-000009");
        when(creditNoteRepository.findTopByNoteNumberStartingWithOrderByNoteNumberDesc("CN-202603-"))
                .thenReturn(Optional.of(last));

        assertEquals("CN-202603-000010", generator.nextCreditNoteNumber(MARCH));
        verify(sequenceRepository).saveAndFlush(argThat(s -> "CN".equals(s.getDocumentType())));
    }

    @Test
    void nextInvoiceNumber_ShouldFailOnForeignNumberFormat() {
        when(sequenceRepository.findForUpdate("INV")).thenReturn(Optional.of(new DocumentSequence("INV")));
        Invoice last = new Invoice();
        last.setInvoiceNumber("INV-202603-legacy");
        when(invoiceRepository.findTopByInvoiceNumberStartingWithOrderByInvoiceNumberDesc("INV-202603-"))
                .thenReturn(Optional.of(last));

        assertThrows(IllegalStateException.class, () -> generator.nextInvoiceNumber(MARCH));
    }
}
