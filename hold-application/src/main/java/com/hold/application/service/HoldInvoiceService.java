package com.hold.application.service;

import com.hold.application.config.HoldSettings;
import com.hold.application.events.EventSubscription;
import com.hold.application.events.TrackService;
import com.hold.application.hook.FailureMessage;
import com.hold.application.ports.DecodedInvoice;
import com.hold.application.ports.EncodedInvoice;
import com.hold.application.ports.InvoiceDecoder;
import com.hold.application.ports.InvoiceEncoder;
import com.hold.application.ports.InvoiceRequest;
import com.hold.application.ports.InvoiceStore;
import com.hold.application.settlement.InvoiceStateMachine;
import com.hold.application.settlement.PaymentHashLocks;
import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.InvoiceState;
import com.hold.domain.invoice.InvoiceTerms;
import com.hold.domain.invoice.PaymentHash;
import com.hold.domain.invoice.Preimage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Control operations on hold invoices. Transport adapters call into this class only.
 *
 * Refusals surface as {@link HoldInvoiceException} subclasses with final, human-readable
 * messages; storage faults propagate unchanged.
 */
public class HoldInvoiceService {

    private static final Logger log = LoggerFactory.getLogger(HoldInvoiceService.class);

    private final InvoiceStore store;
    private final InvoiceEncoder encoder;
    private final InvoiceDecoder decoder;
    private final PaymentHashLocks locks;
    private final InvoiceStateMachine stateMachine;
    private final TrackService tracks;
    private final HoldSettings settings;
    private final Clock clock;
    private final String version;

    public HoldInvoiceService(InvoiceStore store,
                              InvoiceEncoder encoder,
                              InvoiceDecoder decoder,
                              PaymentHashLocks locks,
                              InvoiceStateMachine stateMachine,
                              TrackService tracks,
                              HoldSettings settings,
                              Clock clock,
                              String version) {
        this.store = store;
        this.encoder = encoder;
        this.decoder = decoder;
        this.locks = locks;
        this.stateMachine = stateMachine;
        this.tracks = tracks;
        this.settings = settings;
        this.clock = clock;
        this.version = version;
    }

    public NodeInfo getInfo() {
        return new NodeInfo(version, encoder.nodeId());
    }

    /**
     * Signs and starts tracking a new invoice.
     *
     * @return the bolt11 string
     */
    public String invoice(CreateInvoiceCommand cmd) {
        PaymentHash hash = cmd.resolvedPaymentHash();
        if (cmd.memo() != null && cmd.descriptionHash() != null) {
            throw new InvalidInvoiceException("memo and description hash are mutually exclusive");
        }
        String descriptionHash = normalizeDescriptionHash(cmd.descriptionHash());
        if (cmd.amountMsat() != null && cmd.amountMsat() <= 0) {
            throw new InvalidInvoiceException("amount must be positive");
        }
        long expiry = cmd.expirySeconds() != null ? cmd.expirySeconds() : settings.defaultExpirySeconds();
        if (expiry <= 0) {
            throw new InvalidInvoiceException("expiry must be positive");
        }
        int minFinalCltv = cmd.minFinalCltvExpiry() != null
                ? cmd.minFinalCltvExpiry()
                : settings.defaultMinFinalCltvExpiry();
        if (minFinalCltv < 0) {
            throw new InvalidInvoiceException("min final CLTV expiry must be >= 0");
        }

        return locks.withLock(hash, () -> {
            requireUnknown(hash);
            EncodedInvoice encoded = encoder.encode(new InvoiceRequest(
                    hash, cmd.amountMsat(), cmd.memo(), descriptionHash, expiry, minFinalCltv, cmd.routingHints()));
            InvoiceTerms terms = new InvoiceTerms(hash, cmd.preimage(), encoded.bolt11(), cmd.amountMsat(),
                    encoded.paymentSecret(), cmd.memo(), descriptionHash, expiry, minFinalCltv, null);
            stateMachine.create(HoldInvoice.create(terms, clock.instant()));
            return encoded.bolt11();
        });
    }

    /**
     * Starts tracking an invoice signed elsewhere. It must route through this node.
     *
     * @param minCltv optional override of the invoice's min final CLTV expiry delta
     */
    public void inject(String bolt11, Integer minCltv) {
        if (bolt11 == null || bolt11.isBlank()) {
            throw new InvalidInvoiceException("invoice is required");
        }
        if (minCltv != null && minCltv < 0) {
            throw new InvalidInvoiceException("min CLTV must be >= 0");
        }
        String invoice = bolt11.trim();
        DecodedInvoice decoded = decode(invoice);
        if (!decoded.relatedTo(encoder.nodeId())) {
            throw new InvalidInvoiceException("invoice is not related to us");
        }

        locks.withLock(decoded.paymentHash(), () -> {
            requireUnknown(decoded.paymentHash());
            InvoiceTerms terms = new InvoiceTerms(decoded.paymentHash(), null, invoice, decoded.amountMsat(),
                    decoded.paymentSecret(), decoded.description(), decoded.descriptionHash(),
                    decoded.expirySeconds(), decoded.minFinalCltvExpiry(), minCltv);
            stateMachine.create(HoldInvoice.create(terms, clock.instant()));
        });
    }

    /**
     * Releases the preimage: every held HTLC of the matching invoice is resolved.
     * Settling a PAID invoice again is a no-op.
     */
    public void settle(Preimage preimage) {
        PaymentHash hash = preimage.paymentHash();
        locks.withLock(hash, () -> {
            HoldInvoice invoice = store.findByPaymentHash(hash)
                    .orElseThrow(() -> new InvoiceNotFoundException("could not settle invoice: invoice not found"));
            switch (invoice.state()) {
                case PAID -> log.debug("Invoice {} already settled", hash);
                case CANCELLED -> throw new InvoiceStateFinalException(
                        "could not settle invoice: state " + invoice.state().label() + " is final");
                case UNPAID -> throw new NoHtlcsToSettleException("could not settle invoice: no HTLCs to settle");
                case ACCEPTED -> {
                    if (invoice.liveHtlcs().isEmpty()) {
                        throw new NoHtlcsToSettleException("could not settle invoice: no HTLCs to settle");
                    }
                    stateMachine.settle(invoice, preimage);
                }
            }
        });
    }

    /**
     * Fails every held HTLC and closes the invoice. Cancelling a CANCELLED invoice is a no-op.
     */
    public void cancel(PaymentHash hash) {
        locks.withLock(hash, () -> {
            HoldInvoice invoice = store.findByPaymentHash(hash)
                    .orElseThrow(() -> new InvoiceNotFoundException("could not cancel invoice: invoice not found"));
            switch (invoice.state()) {
                case CANCELLED -> log.debug("Invoice {} already cancelled", hash);
                case PAID -> throw new InvoiceStateFinalException(
                        "could not cancel invoice: state " + invoice.state().label() + " is final");
                case UNPAID, ACCEPTED -> stateMachine.cancel(invoice, FailureMessage.INCORRECT_PAYMENT_DETAILS);
            }
        });
    }

    /**
     * Invoices ascending by id. Unknown hashes yield an empty list.
     */
    public List<HoldInvoice> list(ListQuery query) {
        if (query.paymentHash() != null) {
            return store.findByPaymentHash(query.paymentHash()).map(List::of).orElse(List.of());
        }
        if (query.bolt11() != null && !query.bolt11().isBlank()) {
            PaymentHash hash = decode(query.bolt11().trim()).paymentHash();
            return store.findByPaymentHash(hash).map(List::of).orElse(List.of());
        }
        if (query.pagination() != null) {
            return store.findPage(query.pagination().indexStart(), query.pagination().limit());
        }
        return store.findAll();
    }

    public Optional<HoldInvoice> find(PaymentHash hash) {
        return store.findByPaymentHash(hash);
    }

    /**
     * Removes CANCELLED invoices created at least {@code ageSeconds} ago; null removes all of them.
     *
     * @return number of invoices removed
     */
    public int clean(Long ageSeconds) {
        if (ageSeconds != null && ageSeconds < 0) {
            throw new InvalidInvoiceException("age must be >= 0");
        }
        Instant cutoff = clock.instant().minusSeconds(ageSeconds == null ? 0 : ageSeconds);
        int removed = store.deleteCancelledCreatedBefore(cutoff);
        log.info("Cleaned {} cancelled invoices created before {}", removed, cutoff);
        return removed;
    }

    public EventSubscription track(PaymentHash hash) {
        return tracks.track(hash);
    }

    public EventSubscription trackAll(Set<PaymentHash> filter) {
        return tracks.trackAll(filter);
    }

    private void requireUnknown(PaymentHash hash) {
        if (store.findByPaymentHash(hash).isPresent()) {
            throw new DuplicateInvoiceException("invoice with payment hash " + hash + " exists already");
        }
    }

    private DecodedInvoice decode(String bolt11) {
        try {
            return decoder.decode(bolt11);
        } catch (IllegalArgumentException e) {
            throw new InvalidInvoiceException("could not decode invoice: " + e.getMessage());
        }
    }

    private static String normalizeDescriptionHash(String value) {
        if (value == null) return null;
        try {
            byte[] bytes = HexFormat.of().parseHex(value.trim());
            if (bytes.length != 32) {
                throw new InvalidInvoiceException("description hash must be 32 bytes");
            }
            return HexFormat.of().formatHex(bytes);
        } catch (IllegalArgumentException e) {
            throw new InvalidInvoiceException("description hash is not hex");
        }
    }
}
