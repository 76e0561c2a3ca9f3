package com.studioledger.billing.config;

import com.studioledger.billing.model.Account;
import com.studioledger.billing.model.AccountType;
import com.studioledger.billing.model.DocumentSequence;
import com.studioledger.billing.repository.AccountRepository;
import com.studioledger.billing.repository.DocumentSequenceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class DataInitializer {

    @Bean
    CommandLineRunner seedAccounts(AccountRepository accountRepo, LedgerProperties properties) {
        return args -> {
            // Accounts the ledger posts payments and refunds to
            if (accountRepo.findByCode(properties.getIncomeAccountCode()).isEmpty()) {
                Account income = new Account();
                income.setCode(properties.getIncomeAccountCode());
                income.setName("Service Revenue");
                income.setType(AccountType.INCOME);
                accountRepo.save(income);
                log.info("Seeded income account {}", income.getCode());
            }

            if (accountRepo.findByCode(properties.getRefundAccountCode()).isEmpty()) {
                Account refunds = new Account();
                refunds.setCode(properties.getRefundAccountCode());
                refunds.setName("Customer Refunds");
                refunds.setType(AccountType.EXPENSE);
                accountRepo.save(refunds);
                log.info("Seeded refund account {}", refunds.getCode());
            }
        };
    }

    @Bean
    CommandLineRunner seedDocumentSequences(DocumentSequenceRepository sequenceRepo, LedgerProperties properties) {
        return args -> {
            for (String type : new String[] { properties.getInvoiceNumberPrefix(), properties.getCreditNotePrefix() }) {
                if (!sequenceRepo.existsById(type)) {
                    sequenceRepo.save(new DocumentSequence(type));
                    log.info("Seeded document sequence {}", type);
                }
            }
        };
    }
}
