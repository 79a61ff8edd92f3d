package com.hold.infrastructure.db;

import com.hold.application.ports.InvoiceStore;
import com.hold.application.ports.InvoiceStoreException;
import com.hold.domain.invoice.HoldInvoice;
import com.hold.domain.invoice.Htlc;
import com.hold.domain.invoice.HtlcKey;
import com.hold.domain.invoice.HtlcState;
import com.hold.domain.invoice.InvoiceState;
import com.hold.domain.invoice.InvoiceTerms;
import com.hold.domain.invoice.PaymentHash;
import com.hold.domain.invoice.Preimage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite-backed InvoiceStore.
 *
 * Hashes, preimages and secrets are stored as BLOBs, timestamps as epoch millis.
 */
public final class SqliteInvoiceStore implements InvoiceStore {

    private static final HexFormat HEX = HexFormat.of();

    private final Database db;

    public SqliteInvoiceStore(Database db) {
        this.db = db;
    }

    @Override
    public void create(HoldInvoice invoice) {
        if (invoice.id() != null) {
            throw new IllegalArgumentException("invoice " + invoice.paymentHash() + " is already stored");
        }
        String sql = """
            INSERT INTO invoices(
              payment_hash, preimage, bolt11, amount_msat, payment_secret, memo, description_hash,
              expiry, min_final_cltv_expiry, min_cltv, state, created_at, accepted_at, settled_at
            ) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)
            """;

        try (Connection c = db.getConnection()) {
            c.setAutoCommit(false);
            try {
                long id;
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    InvoiceTerms t = invoice.terms();
                    ps.setBytes(1, invoice.paymentHash().bytes());
                    ps.setBytes(2, invoice.preimage() == null ? null : invoice.preimage().bytes());
                    ps.setString(3, t.bolt11());
                    setLong(ps, 4, t.amountMsat());
                    ps.setBytes(5, t.paymentSecret() == null ? null : HEX.parseHex(t.paymentSecret()));
                    ps.setString(6, t.memo());
                    ps.setBytes(7, t.descriptionHash() == null ? null : HEX.parseHex(t.descriptionHash()));
                    ps.setLong(8, t.expirySeconds());
                    ps.setInt(9, t.minFinalCltvExpiry());
                    setLong(ps, 10, t.minCltv() == null ? null : t.minCltv().longValue());
                    ps.setString(11, invoice.state().name());
                    ps.setLong(12, invoice.createdAt().toEpochMilli());
                    setInstant(ps, 13, invoice.acceptedAt());
                    setInstant(ps, 14, invoice.settledAt());
                    ps.executeUpdate();
                }
                id = lastInsertId(c);
                Map<HtlcKey, Long> newIds = writeHtlcs(c, id, invoice.htlcs());
                c.commit();

                invoice.assignId(id);
                applyIds(invoice, newIds);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new InvoiceStoreException("create failed: " + invoice.paymentHash(), e);
        }
    }

    @Override
    public void save(HoldInvoice invoice) {
        if (invoice.id() == null) {
            throw new IllegalArgumentException("invoice " + invoice.paymentHash() + " was never created");
        }
        String sql = """
            UPDATE invoices
               SET preimage = ?, state = ?, accepted_at = ?, settled_at = ?
             WHERE id = ?
            """;

        try (Connection c = db.getConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setBytes(1, invoice.preimage() == null ? null : invoice.preimage().bytes());
                    ps.setString(2, invoice.state().name());
                    setInstant(ps, 3, invoice.acceptedAt());
                    setInstant(ps, 4, invoice.settledAt());
                    ps.setLong(5, invoice.id());
                    if (ps.executeUpdate() != 1) {
                        throw new SQLException("invoice row " + invoice.id() + " not found");
                    }
                }
                Map<HtlcKey, Long> newIds = writeHtlcs(c, invoice.id(), invoice.htlcs());
                c.commit();

                applyIds(invoice, newIds);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new InvoiceStoreException("save failed: " + invoice.paymentHash(), e);
        }
    }

    @Override
    public Optional<HoldInvoice> findByPaymentHash(PaymentHash paymentHash) {
        if (paymentHash == null) return Optional.empty();
        List<HoldInvoice> found = query("SELECT * FROM invoices WHERE payment_hash = ?",
                ps -> ps.setBytes(1, paymentHash.bytes()), "findByPaymentHash " + paymentHash);
        return found.stream().findFirst();
    }

    @Override
    public List<HoldInvoice> findAll() {
        return query("SELECT * FROM invoices ORDER BY id", ps -> {}, "findAll");
    }

    @Override
    public List<HoldInvoice> findPage(long indexStart, int limit) {
        return query("SELECT * FROM invoices WHERE id >= ? ORDER BY id LIMIT ?", ps -> {
            ps.setLong(1, indexStart);
            ps.setInt(2, limit);
        }, "findPage");
    }

    @Override
    public List<HoldInvoice> findWithLiveHtlcs() {
        String sql = """
            SELECT * FROM invoices i
             WHERE EXISTS (SELECT 1 FROM htlcs h WHERE h.invoice_id = i.id AND h.state = ?)
             ORDER BY i.id
            """;
        return query(sql, ps -> ps.setString(1, HtlcState.ACCEPTED.name()), "findWithLiveHtlcs");
    }

    @Override
    public int deleteCancelledCreatedBefore(Instant cutoff) {
        String sql = "DELETE FROM invoices WHERE state = ? AND created_at <= ?";
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, InvoiceState.CANCELLED.name());
            ps.setLong(2, cutoff.toEpochMilli());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new InvoiceStoreException("deleteCancelledCreatedBefore failed: " + cutoff, e);
        }
    }

    // --- helpers ---

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private List<HoldInvoice> query(String sql, Binder binder, String what) {
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            List<HoldInvoice> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long id = rs.getLong("id");
                    out.add(map(rs, loadHtlcs(c, id)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InvoiceStoreException(what + " failed", e);
        }
    }

    private static List<Htlc> loadHtlcs(Connection c, long invoiceId) throws SQLException {
        String sql = "SELECT * FROM htlcs WHERE invoice_id = ? ORDER BY id";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, invoiceId);
            List<Htlc> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Htlc(
                            rs.getLong("id"),
                            new HtlcKey(rs.getString("scid"), rs.getLong("channel_id")),
                            rs.getLong("msat"),
                            rs.getLong("cltv_expiry"),
                            HtlcState.valueOf(rs.getString("state")),
                            Instant.ofEpochMilli(rs.getLong("created_at"))));
                }
            }
            return out;
        }
    }

    /**
     * Upserts every HTLC row of the invoice and returns the ids of rows inserted now.
     */
    private static Map<HtlcKey, Long> writeHtlcs(Connection c, long invoiceId, List<Htlc> htlcs)
            throws SQLException {
        String upsert = """
            INSERT INTO htlcs(invoice_id, state, scid, channel_id, msat, cltv_expiry, created_at)
            VALUES(?,?,?,?,?,?,?)
            ON CONFLICT(invoice_id, scid, channel_id) DO UPDATE SET
              state=excluded.state
            """;
        String selectId = "SELECT id FROM htlcs WHERE invoice_id = ? AND scid = ? AND channel_id = ?";

        Map<HtlcKey, Long> newIds = new LinkedHashMap<>();
        try (PreparedStatement ps = c.prepareStatement(upsert);
             PreparedStatement sel = c.prepareStatement(selectId)) {
            for (Htlc h : htlcs) {
                ps.setLong(1, invoiceId);
                ps.setString(2, h.state().name());
                ps.setString(3, h.key().scid());
                ps.setLong(4, h.key().channelId());
                ps.setLong(5, h.msat());
                ps.setLong(6, h.cltvExpiry());
                ps.setLong(7, h.createdAt().toEpochMilli());
                ps.executeUpdate();

                if (h.id() == null) {
                    sel.setLong(1, invoiceId);
                    sel.setString(2, h.key().scid());
                    sel.setLong(3, h.key().channelId());
                    try (ResultSet rs = sel.executeQuery()) {
                        if (!rs.next()) throw new SQLException("HTLC row " + h.key() + " missing after insert");
                        newIds.put(h.key(), rs.getLong(1));
                    }
                }
            }
        }
        return newIds;
    }

    private static void applyIds(HoldInvoice invoice, Map<HtlcKey, Long> newIds) {
        newIds.forEach((key, id) -> invoice.findHtlc(key)
                .ifPresent(h -> invoice.replaceHtlc(h.withId(id))));
    }

    private static long lastInsertId(Connection c) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) throw new SQLException("no row id after insert");
            return rs.getLong(1);
        }
    }

    private static HoldInvoice map(ResultSet rs, List<Htlc> htlcs) throws SQLException {
        PaymentHash hash = PaymentHash.of(rs.getBytes("payment_hash"));
        byte[] preimage = rs.getBytes("preimage");
        byte[] secret = rs.getBytes("payment_secret");
        byte[] descriptionHash = rs.getBytes("description_hash");

        InvoiceTerms terms = new InvoiceTerms(
                hash,
                null,
                rs.getString("bolt11"),
                getLong(rs, "amount_msat"),
                secret == null ? null : HEX.formatHex(secret),
                rs.getString("memo"),
                descriptionHash == null ? null : HEX.formatHex(descriptionHash),
                rs.getLong("expiry"),
                rs.getInt("min_final_cltv_expiry"),
                getInt(rs, "min_cltv"));

        return HoldInvoice.restore(
                rs.getLong("id"),
                terms,
                preimage == null ? null : Preimage.of(preimage),
                InvoiceState.valueOf(rs.getString("state")),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                getInstant(rs, "accepted_at"),
                getInstant(rs, "settled_at"),
                htlcs);
    }

    private static void setLong(PreparedStatement ps, int idx, Long v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.INTEGER);
        else ps.setLong(idx, v);
    }

    private static void setInstant(PreparedStatement ps, int idx, Instant v) throws SQLException {
        setLong(ps, idx, v == null ? null : v.toEpochMilli());
    }

    private static Long getLong(ResultSet rs, String col) throws SQLException {
        long v = rs.getLong(col);
        return rs.wasNull() ? null : v;
    }

    private static Integer getInt(ResultSet rs, String col) throws SQLException {
        int v = rs.getInt(col);
        return rs.wasNull() ? null : v;
    }

    private static Instant getInstant(ResultSet rs, String col) throws SQLException {
        Long v = getLong(rs, col);
        return v == null ? null : Instant.ofEpochMilli(v);
    }
}
