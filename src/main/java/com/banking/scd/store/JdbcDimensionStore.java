package com.banking.scd.store;

import com.banking.scd.core.exception.ConcurrentVersionModificationException;
import com.banking.scd.core.exception.DimensionIntegrityException;
import com.banking.scd.core.exception.DimensionStoreException;
import com.banking.scd.core.model.AttributeDefinition;
import com.banking.scd.core.model.DimensionDefinition;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * PostgreSQL implementation of DimensionStore over the {@code banking_dw} dimension tables.
 *
 * <p>Each write runs in one {@link JdbcTransaction} that first takes a transaction-scoped
 * advisory lock on {@code (table, natural key)}, so writers of the same natural key are
 * serialized across processes. Closing a version is an update guarded by
 * {@code is_current_record = TRUE}; if no row matches, the transaction rolls back and
 * {@link ConcurrentVersionModificationException} is thrown.</p>
 */
public class JdbcDimensionStore implements DimensionStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcDimensionStore.class);

    public static final String DEFAULT_SCHEMA = "banking_dw";

    private final DataSource dataSource;
    private final String schema;
    private final Map<DimensionId, TableMapping> mappings = new EnumMap<>(DimensionId.class);

    public JdbcDimensionStore(DataSource dataSource, Map<DimensionId, DimensionDefinition> definitions) {
        this(dataSource, definitions, DEFAULT_SCHEMA);
    }

    public JdbcDimensionStore(DataSource dataSource, Map<DimensionId, DimensionDefinition> definitions,
                              String schema) {
        this.dataSource = dataSource;
        this.schema = InputSanitizer.validateIdentifier(schema);
        definitions.forEach((dimension, definition) ->
                mappings.put(dimension, new TableMapping(this.schema, definition)));
    }

    @Override
    public List<DimensionVersion> findCurrent(DimensionId dimension, String naturalKey) {
        TableMapping table = mapping(dimension);
        String sql = "SELECT " + table.selectColumns() + " FROM " + table.qualifiedName()
                + " WHERE " + table.nkColumn() + " = ? AND is_current_record = TRUE"
                + " ORDER BY " + table.skColumn();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, naturalKey);
            return readVersions(table, ps);
        } catch (SQLException e) {
            throw new DimensionStoreException("Failed to read current version of " + dimension + "/" + naturalKey, e);
        }
    }

    @Override
    public VersionPage findVersionsPage(DimensionId dimension, String naturalKey, VersionCursor after, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        TableMapping table = mapping(dimension);
        StringBuilder sql = new StringBuilder("SELECT ").append(table.selectColumns())
                .append(" FROM ").append(table.qualifiedName())
                .append(" WHERE ").append(table.nkColumn()).append(" = ?");
        if (after != null) {
            sql.append(" AND (effective_from_date > ? OR (effective_from_date = ? AND ")
                    .append(table.skColumn()).append(" > ?))");
        }
        sql.append(" ORDER BY effective_from_date, ").append(table.skColumn()).append(" LIMIT ?");

        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setString(i++, naturalKey);
            if (after != null) {
                ps.setObject(i++, after.effectiveFrom());
                ps.setObject(i++, after.effectiveFrom());
                ps.setLong(i++, after.surrogateKey());
            }
            ps.setInt(i, limit + 1);
            return VersionPage.fromLookahead(readVersions(table, ps), limit);
        } catch (SQLException e) {
            throw new DimensionStoreException("Failed to read versions of " + dimension + "/" + naturalKey, e);
        }
    }

    @Override
    public void insertFirst(DimensionVersion version) {
        TableMapping table = mapping(version.getDimension());
        String countSql = "SELECT COUNT(*) FROM " + table.qualifiedName()
                + " WHERE " + table.nkColumn() + " = ? AND is_current_record = TRUE";
        try (JdbcTransaction tx = JdbcTransaction.begin(dataSource)) {
            tx.execute("lock natural key", c -> lockNaturalKey(c, table, version.getNaturalKey()));
            long current = tx.execute("count current versions", c -> {
                try (PreparedStatement ps = c.prepareStatement(countSql)) {
                    ps.setString(1, version.getNaturalKey());
                    try (ResultSet rs = ps.executeQuery()) {
                        rs.next();
                        return rs.getLong(1);
                    }
                }
            });
            if (current > 0) {
                throw new ConcurrentVersionModificationException(version.getDimension(), version.getNaturalKey(),
                        "Natural key " + version.getDimension() + "/" + version.getNaturalKey()
                                + " already has a current version");
            }
            tx.execute("insert version", c -> insertVersion(c, table, version));
            tx.commit();
        } catch (SQLException e) {
            throw new DimensionStoreException("Failed to insert first version of "
                    + version.getDimension() + "/" + version.getNaturalKey(), e);
        }
    }

    @Override
    public DimensionVersion supersede(DimensionVersion current, LocalDate closeDate, DimensionVersion successor) {
        TableMapping table = mapping(current.getDimension());
        String closeSql = "UPDATE " + table.qualifiedName()
                + " SET effective_to_date = ?, is_current_record = FALSE"
                + " WHERE " + table.skColumn() + " = ? AND is_current_record = TRUE";
        try (JdbcTransaction tx = JdbcTransaction.begin(dataSource)) {
            tx.execute("lock natural key", c -> lockNaturalKey(c, table, current.getNaturalKey()));
            int closed = tx.execute("close version " + current.getSurrogateKey(), c -> {
                try (PreparedStatement ps = c.prepareStatement(closeSql)) {
                    ps.setObject(1, closeDate);
                    ps.setLong(2, current.getSurrogateKey());
                    return ps.executeUpdate();
                }
            });
            if (closed != 1) {
                throw noLongerCurrent(current);
            }
            tx.execute("insert version " + successor.getSurrogateKey(), c -> insertVersion(c, table, successor));
            DimensionVersion result = tx.execute("read closed version",
                    c -> findBySurrogateKey(c, table, current.getSurrogateKey()));
            tx.commit();
            return result;
        } catch (SQLException e) {
            throw new DimensionStoreException("Failed to supersede version " + current.getSurrogateKey()
                    + " of " + current.getDimension() + "/" + current.getNaturalKey(), e);
        }
    }

    @Override
    public DimensionVersion overwrite(DimensionVersion current, Map<String, Object> attributes) {
        if (attributes.isEmpty()) {
            return current;
        }
        TableMapping table = mapping(current.getDimension());
        List<AttributeDefinition> columns = attributes.keySet().stream()
                .map(table.definition()::get)
                .toList();
        String sql = "UPDATE " + table.qualifiedName() + " SET "
                + columns.stream().map(a -> a.name() + " = ?").collect(Collectors.joining(", "))
                + " WHERE " + table.skColumn() + " = ? AND is_current_record = TRUE";
        try (JdbcTransaction tx = JdbcTransaction.begin(dataSource)) {
            tx.execute("lock natural key", c -> lockNaturalKey(c, table, current.getNaturalKey()));
            int updated = tx.execute("overwrite version " + current.getSurrogateKey(), c -> {
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    int i = 1;
                    for (AttributeDefinition column : columns) {
                        bind(ps, i++, column, attributes.get(column.name()));
                    }
                    ps.setLong(i, current.getSurrogateKey());
                    return ps.executeUpdate();
                }
            });
            if (updated != 1) {
                throw noLongerCurrent(current);
            }
            DimensionVersion result = tx.execute("read updated version",
                    c -> findBySurrogateKey(c, table, current.getSurrogateKey()));
            tx.commit();
            return result;
        } catch (SQLException e) {
            throw new DimensionStoreException("Failed to overwrite version " + current.getSurrogateKey()
                    + " of " + current.getDimension() + "/" + current.getNaturalKey(), e);
        }
    }

    @Override
    public long maxSurrogateKey(DimensionId dimension) {
        TableMapping table = mapping(dimension);
        String sql = "SELECT COALESCE(MAX(" + table.skColumn() + "), 0) FROM " + table.qualifiedName();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new DimensionStoreException("Failed to read max surrogate key of " + dimension, e);
        }
    }

    private TableMapping mapping(DimensionId dimension) {
        TableMapping table = mappings.get(dimension);
        if (table == null) {
            throw new IllegalArgumentException("No definition registered for dimension " + dimension);
        }
        return table;
    }

    private static Void lockNaturalKey(Connection c, TableMapping table, String naturalKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT pg_advisory_xact_lock(hashtext(?))")) {
            ps.setString(1, table.qualifiedName() + ":" + naturalKey);
            ps.execute();
        }
        return null;
    }

    private static Void insertVersion(Connection c, TableMapping table, DimensionVersion version)
            throws SQLException {
        List<AttributeDefinition> attributes = List.copyOf(table.definition().getAttributes());
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(table.qualifiedName())
                .append(" (").append(table.skColumn()).append(", ").append(table.nkColumn());
        for (AttributeDefinition attribute : attributes) {
            sql.append(", ").append(attribute.name());
        }
        sql.append(", effective_from_date, effective_to_date, is_current_record) VALUES (?, ?");
        sql.append(", ?".repeat(attributes.size()));
        sql.append(", ?, ?, ?)");

        try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setLong(i++, version.getSurrogateKey());
            ps.setString(i++, version.getNaturalKey());
            for (AttributeDefinition attribute : attributes) {
                bind(ps, i++, attribute, version.getAttribute(attribute.name()));
            }
            ps.setObject(i++, version.getEffectiveFrom());
            if (version.getEffectiveTo() != null) {
                ps.setObject(i++, version.getEffectiveTo());
            } else {
                ps.setNull(i++, Types.DATE);
            }
            ps.setBoolean(i, version.isCurrent());
            ps.executeUpdate();
        }
        log.debug("version.inserted table={} sk={} nk={}",
                table.qualifiedName(), version.getSurrogateKey(), version.getNaturalKey());
        return null;
    }

    private static DimensionVersion findBySurrogateKey(Connection c, TableMapping table, long surrogateKey)
            throws SQLException {
        String sql = "SELECT " + table.selectColumns() + " FROM " + table.qualifiedName()
                + " WHERE " + table.skColumn() + " = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, surrogateKey);
            List<DimensionVersion> rows = readVersions(table, ps);
            if (rows.isEmpty()) {
                throw new DimensionStoreException("Version " + surrogateKey + " vanished from " + table.qualifiedName());
            }
            return rows.get(0);
        }
    }

    private static List<DimensionVersion> readVersions(TableMapping table, PreparedStatement ps) throws SQLException {
        List<DimensionVersion> versions = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                versions.add(mapRow(table, rs));
            }
        }
        return versions;
    }

    private static DimensionVersion mapRow(TableMapping table, ResultSet rs) throws SQLException {
        DimensionId dimension = table.definition().getDimension();
        String naturalKey = rs.getString(table.nkColumn());
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (AttributeDefinition attribute : table.definition().getAttributes()) {
            attributes.put(attribute.name(), read(rs, attribute));
        }
        LocalDate effectiveTo = rs.getObject("effective_to_date", LocalDate.class);
        boolean currentFlag = rs.getBoolean("is_current_record");
        if (currentFlag != (effectiveTo == null)) {
            throw new DimensionIntegrityException(dimension, naturalKey,
                    "Version " + rs.getLong(table.skColumn()) + " has is_current_record=" + currentFlag
                            + " but effective_to_date=" + effectiveTo);
        }
        return DimensionVersion.builder()
                .surrogateKey(rs.getLong(table.skColumn()))
                .dimension(dimension)
                .naturalKey(naturalKey)
                .attributes(attributes)
                .effectiveFrom(rs.getObject("effective_from_date", LocalDate.class))
                .effectiveTo(effectiveTo)
                .build();
    }

    private static Object read(ResultSet rs, AttributeDefinition attribute) throws SQLException {
        String column = attribute.name();
        Object value = switch (attribute.type()) {
            case STRING, CODE -> rs.getString(column);
            case DATE -> rs.getObject(column, LocalDate.class);
            case DECIMAL -> rs.getBigDecimal(column);
            case BOOLEAN -> rs.getBoolean(column);
            case INTEGER -> rs.getLong(column);
        };
        if (rs.wasNull()) {
            return null;
        }
        return attribute.type().coerce(value instanceof String s ? s.stripTrailing() : value);
    }

    private static void bind(PreparedStatement ps, int index, AttributeDefinition attribute, Object value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, switch (attribute.type()) {
                case STRING, CODE -> Types.VARCHAR;
                case DATE -> Types.DATE;
                case DECIMAL -> Types.NUMERIC;
                case BOOLEAN -> Types.BOOLEAN;
                case INTEGER -> Types.BIGINT;
            });
            return;
        }
        switch (attribute.type()) {
            case STRING, CODE -> ps.setString(index, value.toString());
            case DATE -> ps.setObject(index, value);
            case DECIMAL -> ps.setBigDecimal(index, (BigDecimal) value);
            case BOOLEAN -> ps.setBoolean(index, (Boolean) value);
            case INTEGER -> ps.setLong(index, (Long) value);
        }
    }

    private static ConcurrentVersionModificationException noLongerCurrent(DimensionVersion version) {
        return new ConcurrentVersionModificationException(version.getDimension(), version.getNaturalKey(),
                "Version " + version.getSurrogateKey() + " of " + version.getDimension() + "/"
                        + version.getNaturalKey() + " is no longer current");
    }

    /**
     * Physical names of one dimension table, validated once at construction.
     */
    private record TableMapping(String schema, DimensionDefinition definition) {
        TableMapping {
            DimensionId dimension = definition.getDimension();
            InputSanitizer.validateIdentifier(dimension.getTableName());
            InputSanitizer.validateIdentifier(dimension.getSurrogateKeyColumn());
            InputSanitizer.validateIdentifier(dimension.getNaturalKeyColumn());
            definition.getAttributeNames().forEach(InputSanitizer::validateIdentifier);
        }

        String qualifiedName() {
            return schema + "." + definition.getDimension().getTableName();
        }

        String skColumn() {
            return definition.getDimension().getSurrogateKeyColumn();
        }

        String nkColumn() {
            return definition.getDimension().getNaturalKeyColumn();
        }

        String selectColumns() {
            StringBuilder columns = new StringBuilder(skColumn()).append(", ").append(nkColumn());
            definition.getAttributeNames().forEach(name -> columns.append(", ").append(name));
            return columns.append(", effective_from_date, effective_to_date, is_current_record").toString();
        }
    }
}
