package com.hold.api.rest.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public record RoutingHintDto(@NotEmpty List<@Valid Hop> hops) {

    public record Hop(
            @NotBlank String publicKey,
            long shortChannelId,
            @PositiveOrZero long baseFee,
            @PositiveOrZero long ppmFee,
            @PositiveOrZero int cltvExpiryDelta
    ) {}
}
