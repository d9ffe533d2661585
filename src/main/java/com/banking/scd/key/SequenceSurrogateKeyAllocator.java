package com.banking.scd.key;

import com.banking.scd.core.exception.DimensionStoreException;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.store.InputSanitizer;
import com.banking.scd.store.JdbcDimensionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Delegates key generation to the PostgreSQL serial sequence behind each dimension's
 * surrogate key column.
 *
 * <p>Rows loaded with explicit keys leave the sequence behind the table. Before live
 * loads start, {@link #resetSequence(DimensionId)} sets every sequence to one past the
 * table's highest key, the same statement the warehouse's sequence reset script runs.</p>
 */
public class SequenceSurrogateKeyAllocator implements SurrogateKeyAllocator {
    private static final Logger log = LoggerFactory.getLogger(SequenceSurrogateKeyAllocator.class);

    private final DataSource dataSource;
    private final String schema;

    public SequenceSurrogateKeyAllocator(DataSource dataSource) {
        this(dataSource, JdbcDimensionStore.DEFAULT_SCHEMA);
    }

    public SequenceSurrogateKeyAllocator(DataSource dataSource, String schema) {
        this.dataSource = dataSource;
        this.schema = InputSanitizer.validateIdentifier(schema);
    }

    @Override
    public long next(DimensionId dimension) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT nextval(pg_get_serial_sequence(?, ?))")) {
            ps.setString(1, qualifiedTable(dimension));
            ps.setString(2, dimension.getSurrogateKeyColumn());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new DimensionStoreException("Failed to allocate surrogate key for " + dimension, e);
        }
    }

    @Override
    public void advancePast(DimensionId dimension, long highWater) {
        // is_called = true: the next nextval returns the stored value + 1
        String sql = "SELECT setval(s.seq::regclass, GREATEST(?, "
                + "COALESCE(pg_sequence_last_value(s.seq::regclass), 0)), true) "
                + "FROM (SELECT pg_get_serial_sequence(?, ?) AS seq) s";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, Math.max(highWater, 1L));
            ps.setString(2, qualifiedTable(dimension));
            ps.setString(3, dimension.getSurrogateKeyColumn());
            ps.execute();
            log.info("sequence.advanced dimension={} highWater={}", dimension, highWater);
        } catch (SQLException e) {
            throw new DimensionStoreException("Failed to advance sequence of " + dimension, e);
        }
    }

    /**
     * Sets the dimension's sequence to {@code COALESCE(MAX(sk), 0) + 1} with {@code is_called = false}.
     *
     * @return the next key the sequence will issue
     */
    public long resetSequence(DimensionId dimension) {
        String sql = "SELECT setval(pg_get_serial_sequence(?, ?), "
                + "COALESCE((SELECT MAX(" + dimension.getSurrogateKeyColumn() + ") FROM "
                + qualifiedTable(dimension) + "), 0) + 1, false)";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, qualifiedTable(dimension));
            ps.setString(2, dimension.getSurrogateKeyColumn());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                long nextKey = rs.getLong(1);
                log.info("sequence.reset dimension={} nextKey={}", dimension, nextKey);
                return nextKey;
            }
        } catch (SQLException e) {
            throw new DimensionStoreException("Failed to reset sequence of " + dimension, e);
        }
    }

    /**
     * Resets the sequences of all dimensions.
     */
    public void resetAllSequences() {
        for (DimensionId dimension : DimensionId.values()) {
            resetSequence(dimension);
        }
    }

    private String qualifiedTable(DimensionId dimension) {
        return schema + "." + InputSanitizer.validateIdentifier(dimension.getTableName());
    }
}
