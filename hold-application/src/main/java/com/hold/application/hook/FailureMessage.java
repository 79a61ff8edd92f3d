package com.hold.application.hook;

/**
 * BOLT4 failure codes the engine hands back to the host node, as 2-byte hex.
 */
public enum FailureMessage {
    INCORRECT_PAYMENT_DETAILS("400F"),
    MPP_TIMEOUT("0017"),
    FINAL_INCORRECT_CLTV_EXPIRY("0012");

    private final String code;

    FailureMessage(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
