package com.studioledger.billing.controller;

import com.studioledger.billing.dto.DateRange;
import com.studioledger.billing.dto.PaymentMethodFigure;
import com.studioledger.billing.dto.RefundRequest;
import com.studioledger.billing.dto.RefundResult;
import com.studioledger.billing.service.FinancialAggregator;
import com.studioledger.billing.service.RefundProcessor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

@RestController
@RequestMapping("/api/payments")
public class PaymentController {

    private final RefundProcessor refundProcessor;
    private final FinancialAggregator aggregator;
    private final Clock clock;

    public PaymentController(RefundProcessor refundProcessor, FinancialAggregator aggregator, Clock clock) {
        this.refundProcessor = refundProcessor;
        this.aggregator = aggregator;
        this.clock = clock;
    }

    @PostMapping("/{id}/refunds")
    public ResponseEntity<RefundResult> refund(@PathVariable Long id, @RequestBody RefundRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(refundProcessor.refund(id, request));
    }

    // Defaults to the current month
    @GetMapping("/by-method")
    public List<PaymentMethodFigure> byMethod(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        YearMonth current = YearMonth.now(clock);
        return aggregator.paymentsByMethod(new DateRange(
                from != null ? from : current.atDay(1),
                to != null ? to : current.atEndOfMonth()));
    }
}
