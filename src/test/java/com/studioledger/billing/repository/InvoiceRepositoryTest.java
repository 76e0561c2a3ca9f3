package com.studioledger.billing.repository;

import com.studioledger.billing.model.Invoice;
import com.studioledger.billing.model.InvoiceStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class InvoiceRepositoryTest {

    private static final LocalDate ISSUED = LocalDate.of(2030, 7, 1);

    @Autowired
    private InvoiceRepository invoiceRepository;

    private Invoice invoice(String number, String total, InvoiceStatus status, LocalDate dueDate) {
        Invoice invoice = new Invoice();
        invoice.setInvoiceNumber(number);
        invoice.setClientId(1L);
        invoice.setInvoiceDate(ISSUED);
        invoice.setDueDate(dueDate);
        invoice.setSubtotal(new BigDecimal(total));
        invoice.setDiscountAmount(BigDecimal.ZERO);
        invoice.setTaxAmount(BigDecimal.ZERO);
        invoice.setTotalAmount(new BigDecimal(total));
        invoice.setStatus(status);
        return invoiceRepository.save(invoice);
    }

    @Test
    void findByIdForUpdate_ShouldReturnInvoice() {
        Invoice saved = invoice("INV-203007-000001", "100.00", InvoiceStatus.SENT, ISSUED.plusDays(30));

        Optional<Invoice> locked = invoiceRepository.findByIdForUpdate(saved.getId());

        assertTrue(locked.isPresent());
        assertEquals("INV-203007-000001", locked.get().getInvoiceNumber());
        assertTrue(invoiceRepository.findByIdForUpdate(-1L).isEmpty());
    }

    @Test
    void findTopByInvoiceNumberStartingWith_ShouldReturnHighestInMonth() {
        invoice("INV-203007-000002", "10.00", InvoiceStatus.DRAFT, ISSUED.plusDays(30));
        invoice("INV-203007-000011", "10.00", InvoiceStatus.DRAFT, ISSUED.plusDays(30));
        invoice("INV-203008-000099", "10.00", InvoiceStatus.DRAFT, ISSUED.plusDays(30));

        Optional<Invoice> last = invoiceRepository.findTopByInvoiceNumberStartingWithOrderByInvoiceNumberDesc("INV-203007-");

        assertEquals("INV-203007-000011", last.orElseThrow().getInvoiceNumber());
        assertTrue(invoiceRepository.findTopByInvoiceNumberStartingWithOrderByInvoiceNumberDesc("INV-203009-").isEmpty());
    }

    @Test
    void statusAggregates_ShouldSplitByStatus() {
        BigDecimal sentBefore = invoiceRepository.sumTotalByStatus(InvoiceStatus.SENT);
        BigDecimal liveBefore = invoiceRepository.sumTotalByStatusNot(InvoiceStatus.CANCELLED);
        long overdueBefore = invoiceRepository.countByStatusAndDueDateBefore(InvoiceStatus.SENT, ISSUED.plusDays(10));

        invoice("INV-203007-000021", "300.00", InvoiceStatus.SENT, ISSUED.plusDays(5));
        invoice("INV-203007-000022", "200.00", InvoiceStatus.SENT, ISSUED.plusDays(40));
        invoice("INV-203007-000023", "900.00", InvoiceStatus.CANCELLED, ISSUED.plusDays(5));

        assertEquals(0, new BigDecimal("500.00").compareTo(
                invoiceRepository.sumTotalByStatus(InvoiceStatus.SENT).subtract(sentBefore)));
        assertEquals(0, new BigDecimal("500.00").compareTo(
                invoiceRepository.sumTotalByStatusNot(InvoiceStatus.CANCELLED).subtract(liveBefore)));
        assertEquals(overdueBefore + 1,
                invoiceRepository.countByStatusAndDueDateBefore(InvoiceStatus.SENT, ISSUED.plusDays(10)));
    }
}
