package com.hold.application.service;

import com.hold.domain.invoice.PaymentHash;

/**
 * Selects invoices for listing. At most one of the three selectors may be set;
 * none selects every invoice.
 */
public record ListQuery(PaymentHash paymentHash, String bolt11, Pagination pagination) {

    public record Pagination(long indexStart, int limit) {
        public Pagination {
            if (indexStart < 0) throw new InvalidInvoiceException("index_start must be >= 0");
            if (limit <= 0) throw new InvalidInvoiceException("limit must be > 0");
        }
    }

    public ListQuery {
        int selectors = (paymentHash != null ? 1 : 0)
                + (bolt11 != null && !bolt11.isBlank() ? 1 : 0)
                + (pagination != null ? 1 : 0);
        if (selectors > 1) {
            throw new InvalidInvoiceException("only one of payment hash, bolt11 or pagination may be set");
        }
    }

    public static ListQuery all() {
        return new ListQuery(null, null, null);
    }

    public static ListQuery byPaymentHash(PaymentHash hash) {
        return new ListQuery(hash, null, null);
    }

    public static ListQuery page(long indexStart, int limit) {
        return new ListQuery(null, null, new Pagination(indexStart, limit));
    }
}
