package com.hold.api.rest.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * New hold invoice. Either paymentHash or preimage is required.
 */
public record CreateInvoiceRequest(
        String paymentHash,
        String preimage,
        @Positive Long amountMsat,
        String memo,
        String descriptionHash,
        @Positive Long expiry,
        @PositiveOrZero Integer minFinalCltvExpiry,
        List<@Valid RoutingHintDto> routingHints
) {}
