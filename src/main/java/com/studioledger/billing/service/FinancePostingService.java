package com.studioledger.billing.service;

import com.studioledger.billing.config.LedgerProperties;
import com.studioledger.billing.model.*;
import com.studioledger.billing.repository.AccountRepository;
import com.studioledger.billing.repository.FinanceTransactionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Books the money movement behind each payment and refund. Always called inside the ledger write,
 * so a posting and its payment row commit or roll back together.
 */
@Service
public class FinancePostingService {

    private final FinanceTransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final LedgerProperties properties;

    public FinancePostingService(FinanceTransactionRepository transactionRepository,
            AccountRepository accountRepository, LedgerProperties properties) {
        this.transactionRepository = transactionRepository;
        this.accountRepository = accountRepository;
        this.properties = properties;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public FinanceTransaction postPayment(Invoice invoice, Payment payment) {
        FinanceTransaction tx = newTransaction(invoice, payment, properties.getIncomeAccountCode());
        tx.setType(TransactionType.INCOME);
        tx.setAmount(payment.getAmount());
        tx.setDescription("Payment received for invoice " + invoice.getInvoiceNumber());
        return transactionRepository.save(tx);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public FinanceTransaction postRefund(Invoice invoice, Payment refund, CreditNote creditNote) {
        FinanceTransaction tx = newTransaction(invoice, refund, properties.getRefundAccountCode());
        tx.setType(TransactionType.EXPENSE);
        tx.setAmount(refund.getAmount().negate());
        tx.setDescription("Refund " + creditNote.getNoteNumber() + " for invoice " + invoice.getInvoiceNumber());
        return transactionRepository.save(tx);
    }

    private FinanceTransaction newTransaction(Invoice invoice, Payment payment, String accountCode) {
        Account account = accountRepository.findByCodeAndActiveTrue(accountCode)
                .orElseThrow(() -> new IllegalStateException("No active account with code " + accountCode));

        FinanceTransaction tx = new FinanceTransaction();
        tx.setAccount(account);
        tx.setInvoice(invoice);
        tx.setPaymentId(payment.getId());
        tx.setProjectId(invoice.getProjectId());
        tx.setTransactionDate(payment.getPaymentDate());
        tx.setReferenceNumber(payment.getReferenceNumber());
        return tx;
    }
}
