package com.hold.api.wiring;

import com.hold.api.config.HoldProperties;
import com.hold.application.config.HoldSettings;
import com.hold.application.events.InvoiceEventBus;
import com.hold.application.events.TrackService;
import com.hold.application.expiry.ExpiryWatchdog;
import com.hold.application.expiry.MppTimeoutSweeper;
import com.hold.application.hook.HtlcHookGate;
import com.hold.application.mpp.MppAggregator;
import com.hold.application.ports.InvoiceStore;
import com.hold.application.service.HoldInvoiceService;
import com.hold.application.settlement.HtlcResolvers;
import com.hold.application.settlement.InvoiceStateMachine;
import com.hold.application.settlement.PaymentHashLocks;
import com.hold.application.telemetry.EngineObserver;
import com.hold.infrastructure.bolt11.Bolt11Codec;
import com.hold.infrastructure.bolt11.Network;
import com.hold.infrastructure.bolt11.NodeKey;
import com.hold.infrastructure.db.Database;
import com.hold.infrastructure.db.SqliteInvoiceStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free engine into the Spring context.
 */
@Configuration
public class HoldWiringConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HoldSettings holdSettings(HoldProperties props) {
        return props.toSettings();
    }

    @Bean
    public Network network(HoldProperties props) {
        return Network.parse(props.network());
    }

    @Bean
    public Database database(HoldProperties props) {
        Database db = new Database(props.database().url(), props.database().busyTimeoutMs());
        db.initSchema();
        return db;
    }

    @Bean
    public InvoiceStore invoiceStore(Database database) {
        return new SqliteInvoiceStore(database);
    }

    @Bean
    public NodeKey nodeKey(HoldProperties props) {
        return NodeKey.fromConfig(props.node().privateKey());
    }

    @Bean
    public Bolt11Codec bolt11Codec(Network network, NodeKey nodeKey, Clock clock) {
        return new Bolt11Codec(network, nodeKey, clock);
    }

    @Bean
    public PaymentHashLocks paymentHashLocks() {
        return new PaymentHashLocks();
    }

    @Bean
    public HtlcResolvers htlcResolvers() {
        return new HtlcResolvers();
    }

    @Bean
    public InvoiceEventBus invoiceEventBus(HoldSettings settings) {
        return new InvoiceEventBus(settings.subscriberBuffer());
    }

    @Bean
    public InvoiceStateMachine invoiceStateMachine(InvoiceStore store,
                                                   InvoiceEventBus bus,
                                                   HtlcResolvers resolvers,
                                                   EngineObserver observer,
                                                   Clock clock) {
        return new InvoiceStateMachine(store, bus, resolvers, observer, clock);
    }

    @Bean
    public HtlcHookGate htlcHookGate(InvoiceStore store,
                                     PaymentHashLocks locks,
                                     InvoiceStateMachine stateMachine,
                                     HtlcResolvers resolvers,
                                     EngineObserver observer,
                                     HoldSettings settings) {
        return new HtlcHookGate(store, locks, new MppAggregator(settings.overpaymentFactor()),
                stateMachine, resolvers, observer);
    }

    @Bean
    public ExpiryWatchdog expiryWatchdog(InvoiceStore store,
                                         PaymentHashLocks locks,
                                         InvoiceStateMachine stateMachine,
                                         EngineObserver observer,
                                         HoldSettings settings) {
        return new ExpiryWatchdog(store, locks, stateMachine, observer, settings.expiryDeadlineBlocks());
    }

    @Bean
    public MppTimeoutSweeper mppTimeoutSweeper(InvoiceStore store,
                                               PaymentHashLocks locks,
                                               InvoiceStateMachine stateMachine,
                                               EngineObserver observer,
                                               HoldSettings settings,
                                               Clock clock) {
        return new MppTimeoutSweeper(store, locks, stateMachine, observer, settings.mppTimeout(), clock);
    }

    @Bean
    public TrackService trackService(InvoiceStore store, InvoiceEventBus bus) {
        return new TrackService(store, bus);
    }

    @Bean
    public HoldInvoiceService holdInvoiceService(InvoiceStore store,
                                                 Bolt11Codec codec,
                                                 PaymentHashLocks locks,
                                                 InvoiceStateMachine stateMachine,
                                                 TrackService tracks,
                                                 HoldSettings settings,
                                                 Clock clock,
                                                 HoldProperties props) {
        return new HoldInvoiceService(store, codec, codec, locks, stateMachine, tracks, settings, clock,
                props.version());
    }
}
