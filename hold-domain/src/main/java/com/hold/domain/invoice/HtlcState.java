package com.hold.domain.invoice;

/**
 * State of a single HTLC held for an invoice. HTLCs are never UNPAID.
 */
public enum HtlcState {
    ACCEPTED,
    PAID,
    CANCELLED
}
