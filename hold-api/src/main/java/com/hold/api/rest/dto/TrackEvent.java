package com.hold.api.rest.dto;

/**
 * Payload of one server-sent invoice event. Single-invoice tracking only fills {@code state}.
 */
public record TrackEvent(String paymentHash, String bolt11, String state) {}
