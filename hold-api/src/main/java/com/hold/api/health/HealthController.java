package com.hold.api.health;

import com.hold.application.events.InvoiceEventBus;
import com.hold.application.expiry.ExpiryWatchdog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
public class HealthController {

    private final ExpiryWatchdog watchdog;
    private final InvoiceEventBus bus;

    public HealthController(ExpiryWatchdog watchdog, InvoiceEventBus bus) {
        this.watchdog = watchdog;
        this.bus = bus;
    }

    @GetMapping("/api/v1/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "ok",
                "service", "hold-api",
                "bestHeight", watchdog.bestHeight(),
                "subscribers", bus.subscriberCount(),
                "ts", Instant.now().toString()
        );
    }
}
