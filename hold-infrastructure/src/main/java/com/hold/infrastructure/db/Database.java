package com.hold.infrastructure.db;

import com.hold.application.ports.InvoiceStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite connection factory and schema owner.
 */
public final class Database {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private static final String PREFIX = "jdbc:sqlite:";

    private final String url;
    private final int busyTimeoutMs;

    public Database(String url, int busyTimeoutMs) {
        if (url == null || !url.startsWith(PREFIX)) {
            throw new IllegalArgumentException("not a SQLite JDBC url: " + url);
        }
        this.url = url;
        this.busyTimeoutMs = busyTimeoutMs;
    }

    public String url() {
        return url;
    }

    public void ensureDataDir() {
        String file = url.substring(PREFIX.length());
        int q = file.indexOf('?');
        if (q >= 0) file = file.substring(0, q);
        if (file.isBlank() || file.startsWith(":memory:")) return;
        try {
            Path parent = Path.of(file).toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new InvoiceStoreException("Failed to create directory for " + file, e);
        }
    }

    public Connection getConnection() {
        try {
            Connection c = DriverManager.getConnection(url);

            try (Statement st = c.createStatement()) {
                st.execute("PRAGMA journal_mode=WAL;");
                st.execute("PRAGMA foreign_keys=ON;");
                st.execute("PRAGMA busy_timeout=" + busyTimeoutMs + ";");
            }

            return c;
        } catch (SQLException e) {
            throw new InvoiceStoreException("Failed to connect to SQLite: " + url, e);
        }
    }

    /** Creates tables and indexes if missing. */
    public void initSchema() {
        ensureDataDir();

        String sql = """
        CREATE TABLE IF NOT EXISTS invoices (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          payment_hash BLOB NOT NULL UNIQUE,
          preimage BLOB,
          bolt11 TEXT NOT NULL,
          amount_msat INTEGER,
          payment_secret BLOB,
          memo TEXT,
          description_hash BLOB,
          expiry INTEGER NOT NULL,
          min_final_cltv_expiry INTEGER NOT NULL,
          min_cltv INTEGER,
          state TEXT NOT NULL,
          created_at INTEGER NOT NULL,
          accepted_at INTEGER,
          settled_at INTEGER
        );

        CREATE TABLE IF NOT EXISTS htlcs (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          invoice_id INTEGER NOT NULL REFERENCES invoices(id) ON DELETE CASCADE,
          state TEXT NOT NULL,
          scid TEXT NOT NULL,
          channel_id INTEGER NOT NULL,
          msat INTEGER NOT NULL,
          cltv_expiry INTEGER NOT NULL,
          created_at INTEGER NOT NULL,
          UNIQUE (invoice_id, scid, channel_id)
        );

        CREATE INDEX IF NOT EXISTS idx_invoices_state ON invoices(state);
        CREATE INDEX IF NOT EXISTS idx_htlcs_invoice ON htlcs(invoice_id);
        CREATE INDEX IF NOT EXISTS idx_htlcs_state ON htlcs(state);
        """;

        try (Connection c = getConnection(); Statement st = c.createStatement()) {
            st.executeUpdate(sql);
        } catch (SQLException e) {
            throw new InvoiceStoreException("initSchema() error", e);
        }
        log.info("Invoice store ready at {}", url);
    }
}
