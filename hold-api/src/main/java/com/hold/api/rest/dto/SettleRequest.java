package com.hold.api.rest.dto;

import jakarta.validation.constraints.NotBlank;

public record SettleRequest(@NotBlank String preimage) {}
