package com.hold.api.rest;

import com.hold.api.rest.dto.CancelRequest;
import com.hold.api.rest.dto.CleanRequest;
import com.hold.api.rest.dto.CreateInvoiceRequest;
import com.hold.api.rest.dto.InjectInvoiceRequest;
import com.hold.api.rest.dto.InvoiceResponse;
import com.hold.api.rest.dto.RoutingHintDto;
import com.hold.api.rest.dto.SettleRequest;
import com.hold.application.ports.RoutingHint;
import com.hold.application.service.CreateInvoiceCommand;
import com.hold.application.service.HoldInvoiceService;
import com.hold.application.service.ListQuery;
import com.hold.domain.invoice.PaymentHash;
import com.hold.domain.invoice.Preimage;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/invoices")
public class HoldInvoiceController {

    private final HoldInvoiceService service;

    public HoldInvoiceController(HoldInvoiceService service) {
        this.service = service;
    }

    /**
     * Creates and signs a hold invoice.
     */
    @PostMapping
    public Map<String, Object> invoice(@Valid @RequestBody CreateInvoiceRequest req) {
        CreateInvoiceCommand cmd = new CreateInvoiceCommand(
                blank(req.paymentHash()) ? null : new PaymentHash(req.paymentHash()),
                blank(req.preimage()) ? null : new Preimage(req.preimage()),
                req.amountMsat(),
                req.memo(),
                blank(req.descriptionHash()) ? null : req.descriptionHash(),
                req.expiry(),
                req.minFinalCltvExpiry(),
                toHints(req.routingHints())
        );
        return Map.of("bolt11", service.invoice(cmd));
    }

    /**
     * Tracks an invoice signed elsewhere that routes through this node.
     */
    @PostMapping("/inject")
    public Map<String, Object> inject(@Valid @RequestBody InjectInvoiceRequest req) {
        service.inject(req.invoice(), req.minCltvExpiry());
        return Map.of();
    }

    /**
     * Lists invoices ascending by id; selects by payment hash, bolt11 or page.
     */
    @GetMapping
    public Map<String, Object> list(@RequestParam(required = false) String paymentHash,
                                    @RequestParam(required = false) String bolt11,
                                    @RequestParam(required = false) Long indexStart,
                                    @RequestParam(required = false) Integer limit) {
        ListQuery.Pagination page = (indexStart == null && limit == null)
                ? null
                : new ListQuery.Pagination(indexStart == null ? 0 : indexStart, limit == null ? Integer.MAX_VALUE : limit);
        ListQuery query = new ListQuery(
                blank(paymentHash) ? null : new PaymentHash(paymentHash),
                blank(bolt11) ? null : bolt11,
                page);

        List<InvoiceResponse> invoices = service.list(query).stream().map(InvoiceResponse::from).toList();
        return Map.of("invoices", invoices);
    }

    @PostMapping("/settle")
    public Map<String, Object> settle(@Valid @RequestBody SettleRequest req) {
        service.settle(new Preimage(req.preimage()));
        return Map.of();
    }

    @PostMapping("/cancel")
    public Map<String, Object> cancel(@Valid @RequestBody CancelRequest req) {
        service.cancel(new PaymentHash(req.paymentHash()));
        return Map.of();
    }

    @PostMapping("/clean")
    public Map<String, Object> clean(@RequestBody(required = false) CleanRequest req) {
        int cleaned = service.clean(req == null ? null : req.age());
        return Map.of("cleaned", cleaned);
    }

    private static List<RoutingHint> toHints(List<RoutingHintDto> hints) {
        if (hints == null) return List.of();
        return hints.stream()
                .map(h -> new RoutingHint(h.hops().stream()
                        .map(hop -> new RoutingHint.Hop(hop.publicKey().trim().toLowerCase(Locale.ROOT), hop.shortChannelId(),
                                hop.baseFee(), hop.ppmFee(), hop.cltvExpiryDelta()))
                        .toList()))
                .toList();
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
