package com.hold.api.stream;

import com.hold.api.rest.dto.TrackEvent;
import com.hold.application.events.EventSubscription;
import com.hold.application.events.InvoiceEvent;
import com.hold.application.service.HoldInvoiceService;
import com.hold.domain.invoice.PaymentHash;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Server-sent event streams of invoice state changes.
 *
 * Each stream gets a pump thread that drains its subscription into the emitter. A client
 * that goes away or falls behind loses its subscription; the engine never waits for it.
 */
@RestController
public class TrackController {

    private static final Logger log = LoggerFactory.getLogger(TrackController.class);

    private static final Duration POLL = Duration.ofSeconds(1);
    private static final int KEEPALIVE_POLLS = 15;

    private final HoldInvoiceService service;
    private final ExecutorService pumps;

    public TrackController(HoldInvoiceService service) {
        this.service = service;
        AtomicInteger n = new AtomicInteger();
        this.pumps = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "track-pump-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * One invoice: its history so far, then live changes until a final state.
     */
    @GetMapping(path = "/api/v1/invoices/{paymentHash}/track", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter track(@PathVariable String paymentHash) {
        EventSubscription sub = service.track(new PaymentHash(paymentHash));
        return stream(sub, e -> new TrackEvent(null, null, e.state().name()));
    }

    /**
     * Many invoices. Without a filter every invoice's live changes are streamed.
     */
    @GetMapping(path = "/api/v1/invoices/track", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter trackAll(@RequestParam(name = "paymentHash", required = false) List<String> paymentHashes) {
        Set<PaymentHash> filter = paymentHashes == null
                ? Set.of()
                : paymentHashes.stream().filter(h -> !h.isBlank()).map(PaymentHash::new).collect(Collectors.toSet());
        EventSubscription sub = service.trackAll(filter);
        return stream(sub, e -> new TrackEvent(e.paymentHash().hex(), e.bolt11(), e.state().name()));
    }

    @PreDestroy
    public void shutdown() {
        pumps.shutdownNow();
    }

    private SseEmitter stream(EventSubscription sub, Function<InvoiceEvent, TrackEvent> payload) {
        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(sub::close);
        emitter.onTimeout(sub::close);
        emitter.onError(t -> sub.close());

        pumps.execute(() -> pump(sub, emitter, payload));
        return emitter;
    }

    private void pump(EventSubscription sub, SseEmitter emitter, Function<InvoiceEvent, TrackEvent> payload) {
        int idle = 0;
        try {
            while (!sub.isDrained()) {
                Optional<InvoiceEvent> next = sub.next(POLL);
                if (next.isPresent()) {
                    emitter.send(SseEmitter.event()
                            .id(Long.toString(next.get().sequence()))
                            .name("invoice")
                            .data(payload.apply(next.get()), MediaType.APPLICATION_JSON));
                    idle = 0;
                } else if (++idle >= KEEPALIVE_POLLS) {
                    emitter.send(SseEmitter.event().comment("keepalive"));
                    idle = 0;
                }
            }
            if (sub.closeReason().orElse(null) == EventSubscription.CloseReason.OVERFLOW) {
                emitter.send(SseEmitter.event().name("overflow").data("subscriber fell behind"));
            }
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.debug("Subscriber {} went away: {}", sub.id(), e.getMessage());
            sub.close();
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sub.close();
            emitter.complete();
        }
    }
}
