package com.hold.api.hooks;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BlockAddedPayload(@JsonProperty("block_added") Block blockAdded) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Block(Long height, String hash) {}
}
