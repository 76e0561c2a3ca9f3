package com.studioledger.billing.controller;

import com.studioledger.billing.dto.DateRange;
import com.studioledger.billing.dto.FinancialSummary;
import com.studioledger.billing.service.FinancialAggregator;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    private final FinancialAggregator aggregator;
    private final Clock clock;

    public DashboardController(FinancialAggregator aggregator, Clock clock) {
        this.aggregator = aggregator;
        this.clock = clock;
    }

    // Defaults to the current month
    @GetMapping("/financial-summary")
    public FinancialSummary financialSummary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        YearMonth current = YearMonth.now(clock);
        DateRange range = new DateRange(
                from != null ? from : current.atDay(1),
                to != null ? to : current.atEndOfMonth());
        return aggregator.getFinancialSummary(range);
    }
}
