package com.hold.api.config;

import com.hold.application.config.HoldSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Service configuration, bound from {@code hold.*}.
 *
 * Missing sections fall back to the engine defaults; invalid values fail start-up
 * through {@link #toSettings()}.
 */
@ConfigurationProperties(prefix = "hold")
public record HoldProperties(

    String version,

    Database database,

    /**
     * bitcoin, testnet, signet or regtest.
     */
    String network,

    Node node,

    Mpp mpp,

    Expiry expiry,

    Invoice invoice,

    Events events

) {

    public HoldProperties {
        if (version == null || version.isBlank()) version = "dev";
        if (database == null) database = new Database(null, null);
        if (network == null || network.isBlank()) network = "regtest";
        if (node == null) node = new Node(null);
        if (mpp == null) mpp = new Mpp(null, null, null);
        if (expiry == null) expiry = new Expiry(null);
        if (invoice == null) invoice = new Invoice(null, null);
        if (events == null) events = new Events(null);
    }

    public record Database(String url, Integer busyTimeoutMs) {
        public Database {
            if (url == null || url.isBlank()) url = "jdbc:sqlite:hold/hold.sqlite";
            if (busyTimeoutMs == null) busyTimeoutMs = 5000;
        }
    }

    /**
     * @param privateKey hex secp256k1 key; empty generates a throwaway key
     */
    public record Node(String privateKey) {}

    public record Mpp(Long timeoutSeconds, Double overpaymentFactor, Long sweepIntervalMs) {
        public Mpp {
            if (timeoutSeconds == null) timeoutSeconds = HoldSettings.DEFAULT_MPP_TIMEOUT.toSeconds();
            if (overpaymentFactor == null) overpaymentFactor = HoldSettings.DEFAULT_OVERPAYMENT_FACTOR;
            if (sweepIntervalMs == null) sweepIntervalMs = 1000L;
        }
    }

    /**
     * @param deadlineBlocks 0 disables the expiry watchdog
     */
    public record Expiry(Long deadlineBlocks) {
        public Expiry {
            if (deadlineBlocks == null) deadlineBlocks = HoldSettings.DEFAULT_EXPIRY_DEADLINE;
        }
    }

    public record Invoice(Long defaultExpirySeconds, Integer defaultMinFinalCltvExpiry) {
        public Invoice {
            if (defaultExpirySeconds == null) defaultExpirySeconds = HoldSettings.DEFAULT_EXPIRY_SECONDS;
            if (defaultMinFinalCltvExpiry == null) {
                defaultMinFinalCltvExpiry = HoldSettings.DEFAULT_MIN_FINAL_CLTV_EXPIRY;
            }
        }
    }

    public record Events(Integer subscriberBuffer) {
        public Events {
            if (subscriberBuffer == null) subscriberBuffer = HoldSettings.DEFAULT_SUBSCRIBER_BUFFER;
        }
    }

    public HoldSettings toSettings() {
        if (mpp.timeoutSeconds() <= 0) {
            throw new IllegalArgumentException("hold.mpp.timeout-seconds must be > 0, got " + mpp.timeoutSeconds());
        }
        return new HoldSettings(
            mpp.overpaymentFactor(),
            Duration.ofSeconds(mpp.timeoutSeconds()),
            expiry.deadlineBlocks(),
            invoice.defaultExpirySeconds(),
            invoice.defaultMinFinalCltvExpiry(),
            events.subscriberBuffer()
        );
    }
}
