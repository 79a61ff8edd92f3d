package com.hold.api.rest;

import com.hold.application.service.HoldInvoiceService;
import com.hold.application.service.NodeInfo;
import com.hold.infrastructure.bolt11.Network;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class InfoController {

    private final HoldInvoiceService service;
    private final Network network;

    public InfoController(HoldInvoiceService service, Network network) {
        this.service = service;
        this.network = network;
    }

    @GetMapping("/api/v1/info")
    public Map<String, Object> info() {
        NodeInfo info = service.getInfo();
        return Map.of(
                "version", info.version(),
                "nodeId", info.nodeId(),
                "network", network.label()
        );
    }
}
