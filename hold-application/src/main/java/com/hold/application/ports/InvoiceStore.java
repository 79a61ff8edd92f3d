package com.hold.application.ports;

import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.PaymentHash;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of hold invoices and their HTLCs.
 *
 * Implementations throw {@link InvoiceStoreException} on storage failures;
 * a failed write leaves nothing behind.
 */
public interface InvoiceStore {

    /**
     * Inserts a new invoice and assigns its id. Ids grow monotonically and are never reused.
     */
    void create(HoldInvoice invoice);

    /**
     * Writes the invoice state, timestamps and preimage together with all of its HTLC rows
     * in one transaction. New HTLCs get their row id assigned.
     */
    void save(HoldInvoice invoice);

    Optional<HoldInvoice> findByPaymentHash(PaymentHash paymentHash);

    /** All invoices, ascending by id. */
    List<HoldInvoice> findAll();

    /** Invoices with {@code id >= indexStart}, ascending by id, at most {@code limit}. */
    List<HoldInvoice> findPage(long indexStart, int limit);

    /** Invoices that still have at least one ACCEPTED HTLC. */
    List<HoldInvoice> findWithLiveHtlcs();

    /**
     * Deletes CANCELLED invoices (and their HTLCs) created before {@code cutoff}.
     *
     * @return number of invoices removed
     */
    int deleteCancelledCreatedBefore(Instant cutoff);
}
