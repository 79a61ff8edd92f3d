package com.hold.api.rest.dto;

/**
 * @param age seconds; cancelled invoices at least this old are removed, null removes all
 */
public record CleanRequest(Long age) {}
