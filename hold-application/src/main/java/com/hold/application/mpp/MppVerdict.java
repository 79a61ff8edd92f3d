package com.hold.application.mpp;

/**
 * @param accepted         the part may join the invoice
 * @param completesInvoice the part lifts an UNPAID invoice to its amount
 * @param totalMsat        accepted total including the offered part
 */
public record MppVerdict(boolean accepted, boolean completesInvoice, long totalMsat) {

    static MppVerdict overpaid(long totalMsat) {
        return new MppVerdict(false, false, totalMsat);
    }
}
