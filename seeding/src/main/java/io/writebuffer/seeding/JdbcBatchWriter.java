package io.writebuffer.seeding;

import io.writebuffer.core.WriteBatch;
import io.writebuffer.core.WriteOpType;
import io.writebuffer.core.WriteOperation;
import io.writebuffer.runtime.BatchOutcome;
import io.writebuffer.runtime.FlushFunction;
import io.writebuffer.runtime.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flushes batches into a single table (entry_key, kind, payload). Each operation runs under its own savepoint so a
 * rejected row fails alone; the rest of the batch commits together.
 * <p>
 * Entries and links are keyed by their dedup key when present, otherwise by operation id. Creating a row that
 * already holds the same content succeeds, so a finished import can be run again.
 */
public class JdbcBatchWriter implements FlushFunction {
    private static final Logger LOG = LoggerFactory.getLogger(JdbcBatchWriter.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final String table;

    public JdbcBatchWriter(String jdbcUrl, String user, String password, String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
        this.table = table;
    }

    public String table() { return table; }

    public void ensureTable() throws SQLException {
        try (Connection c = getConnection(); Statement s = c.createStatement()) {
            s.execute("CREATE TABLE IF NOT EXISTS " + table
                    + " (entry_key VARCHAR(512) PRIMARY KEY, kind VARCHAR(16) NOT NULL, payload BLOB)");
        }
    }

    @Override
    public BatchOutcome flush(WriteBatch batch) throws SQLException {
        List<OperationResult> results = new ArrayList<>(batch.size());
        try (Connection c = getConnection()) {
            c.setAutoCommit(false);
            try {
                for (WriteOperation op : batch.operations()) {
                    Savepoint sp = c.setSavepoint();
                    try {
                        apply(c, op);
                        c.releaseSavepoint(sp);
                        results.add(OperationResult.ok(op.opId()));
                    } catch (SQLException e) {
                        c.rollback(sp);
                        LOG.debug("Rejected {} in {}: {}", op.opId(), batch.batchId(), e.getMessage());
                        results.add(OperationResult.failed(op.opId(), e.getMessage()));
                    }
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        }
        return BatchOutcome.of(results);
    }

    private void apply(Connection c, WriteOperation op) throws SQLException {
        String key = op.hasDedupKey() ? op.dedupKey() : op.opId();
        switch (op.opType()) {
            case CREATE_ENTRY, CREATE_LINK -> {
                String kind = op.opType() == WriteOpType.CREATE_LINK ? "LINK" : "ENTRY";
                if (alreadyStored(c, key, kind, op.payload())) return;
                try (PreparedStatement ps = c.prepareStatement("INSERT INTO " + table + " (entry_key, kind, payload) VALUES (?, ?, ?)")) {
                    ps.setString(1, key);
                    ps.setString(2, kind);
                    ps.setBytes(3, op.payload());
                    ps.executeUpdate();
                }
            }
            case UPDATE_ENTRY -> {
                try (PreparedStatement ps = c.prepareStatement("UPDATE " + table + " SET payload = ? WHERE entry_key = ? AND kind = 'ENTRY'")) {
                    ps.setBytes(1, op.payload());
                    ps.setString(2, key);
                    if (ps.executeUpdate() == 0) throw new SQLException("No entry " + key + " to update");
                }
            }
            case DELETE_ENTRY, DELETE_LINK -> {
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE entry_key = ?")) {
                    ps.setString(1, key);
                    ps.executeUpdate();
                }
            }
        }
    }

    /** True when the row exists with the same content; a different row under the key is a conflict. */
    private boolean alreadyStored(Connection c, String key, String kind, byte[] payload) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT kind, payload FROM " + table + " WHERE entry_key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return false;
                if (kind.equals(rs.getString(1)) && Arrays.equals(payload, rs.getBytes(2))) return true;
                throw new SQLException("Entry " + key + " already exists with different content");
            }
        }
    }

    private Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
