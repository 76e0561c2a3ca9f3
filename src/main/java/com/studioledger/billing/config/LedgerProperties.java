package com.studioledger.billing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "billing.ledger")
public class LedgerProperties {

    /** Attempts per ledger write before giving up with a contention error. */
    private int maxAttempts = 5;

    /** Base pause between attempts, multiplied by the attempt number. */
    private Duration retryBackoff = Duration.ofMillis(25);

    private String incomeAccountCode = "4000";

    private String refundAccountCode = "5100";

    private int defaultPaymentDays = 30;

    private String invoiceNumberPrefix = "INV";

    private String creditNotePrefix = "CN";
}
