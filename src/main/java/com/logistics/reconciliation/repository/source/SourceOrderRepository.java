package com.logistics.reconciliation.repository.source;

import com.logistics.reconciliation.model.Address;
import com.logistics.reconciliation.model.OrderHeader;
import com.logistics.reconciliation.model.TransferScope;
import com.logistics.reconciliation.repository.AbstractJdbcRepository;
import com.logistics.reconciliation.repository.RecordReader;
import com.logistics.reconciliation.repository.SqlTemplateLoader;
import com.logistics.reconciliation.repository.StoreGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.util.List;

/**
 * Reads order headers from the Source {@code "order"} table in {@code order_id} order.
 */
@Repository
@Slf4j
public class SourceOrderRepository extends AbstractJdbcRepository implements RecordReader<OrderHeader> {

    static final RowMapper<OrderHeader> ROW_MAPPER = (rs, rowNum) -> new OrderHeader(
            rs.getLong("order_id"),
            rs.getString("faktur_id"),
            localDate(rs, "faktur_date"),
            localDate(rs, "delivery_date"),
            rs.getString("do_number"),
            rs.getString("status"),
            rs.getString("customer_id"),
            rs.getString("warehouse_id"),
            rs.getString("client_id"),
            rs.getString("divisi"),
            new Address(
                    rs.getString("origin_name"),
                    rs.getString("origin_address_1"),
                    rs.getString("origin_address_2"),
                    rs.getString("origin_city"),
                    rs.getString("origin_zipcode"),
                    rs.getString("origin_phone"),
                    rs.getString("origin_email")),
            new Address(
                    rs.getString("destination_name"),
                    rs.getString("destination_address_1"),
                    rs.getString("destination_address_2"),
                    rs.getString("destination_city"),
                    rs.getString("destination_zip_code"),
                    rs.getString("destination_phone"),
                    rs.getString("destination_email")),
            rs.getString("notes"),
            rs.getString("created_by"));

    private final StoreGuard guard;

    public SourceOrderRepository(@Qualifier("sourceJdbcTemplate") NamedParameterJdbcTemplate jdbc,
                                 SqlTemplateLoader sql,
                                 @Qualifier("sourceStoreGuard") StoreGuard guard) {
        super(jdbc, sql);
        this.guard = guard;
    }

    @Override
    public String table() {
        return "order";
    }

    @Override
    public List<OrderHeader> readPage(TransferScope scope, String afterKey, int pageSize) {
        MapSqlParameterSource params = scopeParams(scope)
                .addValue("afterId", parseNumericKey(table(), afterKey), Types.BIGINT)
                .addValue("pageSize", pageSize, Types.INTEGER);

        List<OrderHeader> page = guard.call("read order page",
                () -> jdbc.query(sql.load("source.orders.page"), params, ROW_MAPPER));
        log.debug("Read {} orders after order_id {}", page.size(), afterKey);
        return page;
    }

    @Override
    public void checkResumeKey(String resumeAfter) {
        SourceOrderRepository.parseNumericKey(table(), resumeAfter);
    }

    @Override
    public long count(TransferScope scope) {
        return countOf(guard.call("count order",
                () -> jdbc.queryForObject(sql.load("source.orders.count"), scopeParams(scope), Long.class)));
    }

    static Long parseNumericKey(String table, String afterKey) {
        if (afterKey == null || afterKey.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(afterKey.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Resume key for table " + table + " must be numeric, was '" + afterKey + "'", e);
        }
    }
}
