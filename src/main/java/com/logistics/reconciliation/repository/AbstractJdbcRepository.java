package com.logistics.reconciliation.repository;

import com.logistics.reconciliation.model.TransferScope;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Shared plumbing for the JDBC repositories of both stores.
 */
public abstract class AbstractJdbcRepository {

    /**
     * Upper bound for values bound into one {@code IN (...)} list.
     */
    protected static final int IN_CHUNK_SIZE = 500;

    protected final NamedParameterJdbcTemplate jdbc;
    protected final SqlTemplateLoader sql;

    protected AbstractJdbcRepository(NamedParameterJdbcTemplate jdbc, SqlTemplateLoader sql) {
        this.jdbc = jdbc;
        this.sql = sql;
    }

    /**
     * Binds the optional date range and warehouse of a scope with explicit
     * SQL types, so {@code CAST(:x AS type) IS NULL} works for null values.
     */
    protected static MapSqlParameterSource scopeParams(TransferScope scope) {
        return new MapSqlParameterSource()
                .addValue("startDate", scope.startDate(), Types.DATE)
                .addValue("endDateExclusive", scope.endDateExclusive(), Types.DATE)
                .addValue("warehouseId", scope.warehouseId(), Types.VARCHAR);
    }

    protected static <E> List<List<E>> partition(Collection<E> values, int size) {
        List<E> list = values instanceof List<E> l ? l : new ArrayList<>(values);
        List<List<E>> out = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            out.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return out;
    }

    protected static LocalDate localDate(ResultSet rs, String column) throws SQLException {
        Date value = rs.getDate(column);
        return value == null ? null : value.toLocalDate();
    }

    protected static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    protected static long countOf(Long value) {
        return value == null ? 0L : value;
    }
}
