package com.hold.api.hooks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hold.application.expiry.ExpiryWatchdog;
import com.hold.application.hook.HookDecision;
import com.hold.application.hook.HtlcHookGate;
import com.hold.application.hook.HtlcRequest;
import com.hold.domain.invoice.HtlcKey;
import com.hold.domain.invoice.PaymentHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Hook endpoints the host node calls.
 *
 * A held HTLC keeps its request open until the engine answers it. Bodies are read here
 * rather than bound by the framework, so a payload Jackson cannot map is answered with
 * {@code continue} like any other malformed payload or engine fault.
 */
@RestController
@RequestMapping("/api/v1/hooks")
public class HostHookController {

    private static final Logger log = LoggerFactory.getLogger(HostHookController.class);

    static final Map<String, Object> CONTINUE = Map.of("result", "continue");

    private final HtlcHookGate gate;
    private final ExpiryWatchdog watchdog;
    private final ObjectMapper objectMapper;

    public HostHookController(HtlcHookGate gate, ExpiryWatchdog watchdog, ObjectMapper objectMapper) {
        this.gate = gate;
        this.watchdog = watchdog;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/htlc-accepted")
    public CompletableFuture<Map<String, Object>> htlcAccepted(@RequestBody(required = false) String body) {
        HtlcRequest request;
        try {
            request = toRequest(read(body, HtlcAcceptedPayload.class));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed htlc_accepted payload: {}", e.getMessage());
            return CompletableFuture.completedFuture(CONTINUE);
        }

        HookDecision decision = gate.onHtlcAccepted(request);
        if (decision instanceof HookDecision.Hold hold) {
            return hold.resolution()
                    .thenApply(HostHookController::toJson)
                    .exceptionally(t -> {
                        log.error("Held HTLC {} for {} failed, leaving it to the node",
                                request.key(), request.paymentHash(), t);
                        return CONTINUE;
                    });
        }
        return CompletableFuture.completedFuture(toJson(decision));
    }

    @PostMapping("/block-added")
    public Map<String, Object> blockAdded(@RequestBody(required = false) String body) {
        BlockAddedPayload payload;
        try {
            payload = read(body, BlockAddedPayload.class);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed block_added payload: {}", e.getMessage());
            return CONTINUE;
        }
        if (payload.blockAdded() == null || payload.blockAdded().height() == null) {
            log.warn("Ignoring block_added payload without height");
            return CONTINUE;
        }
        try {
            watchdog.blockAdded(payload.blockAdded().height());
        } catch (RuntimeException e) {
            log.error("Block {} could not be processed", payload.blockAdded().height(), e);
        }
        return CONTINUE;
    }

    private <T> T read(String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("empty body");
        }
        try {
            T payload = objectMapper.readValue(body, type);
            if (payload == null) throw new IllegalArgumentException("null payload");
            return payload;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.getOriginalMessage(), e);
        }
    }

    static HtlcRequest toRequest(HtlcAcceptedPayload payload) {
        HtlcAcceptedPayload.Htlc h = payload.htlc();
        if (h == null) throw new IllegalArgumentException("missing htlc");
        if (h.shortChannelId() == null || h.id() == null || h.amountMsat() == null
                || h.cltvExpiry() == null || h.paymentHash() == null) {
            throw new IllegalArgumentException("htlc is missing required fields");
        }
        long relative = h.cltvExpiryRelative() == null ? Long.MAX_VALUE : h.cltvExpiryRelative();
        String secret = payload.onion() == null ? null : payload.onion().paymentSecret();
        return new HtlcRequest(
                new PaymentHash(h.paymentHash()),
                new HtlcKey(h.shortChannelId(), h.id()),
                h.amountMsat(),
                h.cltvExpiry(),
                relative,
                secret);
    }

    static Map<String, Object> toJson(HookDecision decision) {
        if (decision instanceof HookDecision.Fail fail) {
            return Map.of("result", "fail", "failure_message", fail.message().code());
        }
        if (decision instanceof HookDecision.Resolve resolve) {
            return Map.of("result", "resolve", "payment_key", resolve.preimage().hex());
        }
        return CONTINUE;
    }
}
