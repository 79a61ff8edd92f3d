package com.hold.application.service;

public class NoHtlcsToSettleException extends HoldInvoiceException {

    public NoHtlcsToSettleException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "no_htlcs_to_settle";
    }
}
