package com.hold.application.mpp;

import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.InvoiceState;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decides whether one more HTLC part may join an invoice and whether it makes the invoice payable.
 *
 * The running total counts ACCEPTED and PAID parts; failed parts drop out. Parts keep
 * joining after the invoice is ACCEPTED until the total would exceed
 * {@code overpaymentFactor * amount}. "Any amount" invoices have no bound and become
 * payable with their first part.
 */
public class MppAggregator {

    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private final double overpaymentFactor;

    public MppAggregator(double overpaymentFactor) {
        if (overpaymentFactor < 1.0) {
            throw new IllegalArgumentException("overpaymentFactor must be >= 1");
        }
        this.overpaymentFactor = overpaymentFactor;
    }

    public MppVerdict offer(HoldInvoice invoice, long msat) {
        long total = Math.addExact(invoice.amountPaidMsat(), msat);
        boolean unpaid = invoice.state() == InvoiceState.UNPAID;

        Long amount = invoice.terms().amountMsat();
        if (amount == null) {
            return new MppVerdict(true, unpaid, total);
        }
        if (total > maxAcceptableMsat(amount)) {
            return MppVerdict.overpaid(total);
        }
        return new MppVerdict(true, unpaid && total >= amount, total);
    }

    /** Floor of {@code amount * factor} in exact decimal arithmetic, capped at {@code Long.MAX_VALUE}. */
    public long maxAcceptableMsat(long amountMsat) {
        BigDecimal max = BigDecimal.valueOf(amountMsat)
                .multiply(BigDecimal.valueOf(overpaymentFactor))
                .setScale(0, RoundingMode.FLOOR);
        return max.compareTo(LONG_MAX) >= 0 ? Long.MAX_VALUE : max.longValueExact();
    }
}
