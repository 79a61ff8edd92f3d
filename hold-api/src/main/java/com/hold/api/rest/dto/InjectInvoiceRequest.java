package com.hold.api.rest.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * @param minCltvExpiry overrides the invoice's min final CLTV expiry when set
 */
public record InjectInvoiceRequest(
        @NotBlank String invoice,
        @PositiveOrZero Integer minCltvExpiry
) {}
