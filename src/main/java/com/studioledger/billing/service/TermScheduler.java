package com.studioledger.billing.service;

import com.studioledger.billing.dto.ScheduledTerm;
import com.studioledger.billing.dto.TermRequest;
import com.studioledger.billing.exception.InvalidScheduleException;
import com.studioledger.billing.model.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits an invoice total across payment terms by percentage. Every term but the last is rounded
 * on its own; the last term takes whatever is left so the amounts add up to the total exactly.
 */
@Component
public class TermScheduler {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    public List<ScheduledTerm> schedule(Money total, List<TermRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new InvalidScheduleException("At least one payment term is required");
        }

        List<TermRequest> ordered = new ArrayList<>(requests);
        for (TermRequest term : ordered) {
            if (term == null || term.termNumber() == null) {
                throw new InvalidScheduleException("Every term needs a term number");
            }
        }
        ordered.sort(Comparator.comparing(TermRequest::termNumber));

        Set<Integer> seen = new HashSet<>();
        BigDecimal percentSum = BigDecimal.ZERO;
        for (int i = 0; i < ordered.size(); i++) {
            TermRequest term = ordered.get(i);
            if (!seen.add(term.termNumber())) {
                throw new InvalidScheduleException("Duplicate term number " + term.termNumber());
            }
            if (term.termNumber() != i + 1) {
                throw new InvalidScheduleException("Term numbers must run 1.." + ordered.size() + " without gaps");
            }
            BigDecimal pct = term.percentage();
            if (pct == null || pct.signum() <= 0 || pct.compareTo(HUNDRED) > 0) {
                throw new InvalidScheduleException("Term " + term.termNumber() + ": percentage must be above 0 and at most 100");
            }
            if (term.dueDate() == null) {
                throw new InvalidScheduleException("Term " + term.termNumber() + ": due date is required");
            }
            percentSum = percentSum.add(pct);
        }
        if (percentSum.subtract(HUNDRED).abs().compareTo(TOLERANCE) > 0) {
            throw new InvalidScheduleException("Term percentages add up to " + percentSum.toPlainString() + ", expected 100");
        }

        List<ScheduledTerm> result = new ArrayList<>(ordered.size());
        Money allocated = Money.ZERO;
        for (int i = 0; i < ordered.size(); i++) {
            TermRequest term = ordered.get(i);
            Money amount = i == ordered.size() - 1
                    ? total.minus(allocated)
                    : total.percent(term.percentage());
            if (amount.isNegative()) {
                throw new InvalidScheduleException("Total of " + total + " is too small to split into " + ordered.size() + " terms");
            }
            allocated = allocated.plus(amount);
            result.add(new ScheduledTerm(term.termNumber(), term.percentage(), amount, term.dueDate(), term.description()));
        }
        return result;
    }
}
