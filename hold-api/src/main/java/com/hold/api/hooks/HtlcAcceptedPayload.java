package com.hold.api.hooks;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The host node's {@code htlc_accepted} hook payload, reduced to what the engine reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HtlcAcceptedPayload(Onion onion, Htlc htlc) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Onion(@JsonProperty("payment_secret") String paymentSecret) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Htlc(
            @JsonProperty("short_channel_id") String shortChannelId,
            Long id,
            @JsonProperty("amount_msat") Long amountMsat,
            @JsonProperty("cltv_expiry") Long cltvExpiry,
            @JsonProperty("cltv_expiry_relative") Long cltvExpiryRelative,
            @JsonProperty("payment_hash") String paymentHash
    ) {}
}
