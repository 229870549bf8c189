package com.logistics.reconciliation.repository.source;

import com.logistics.reconciliation.model.OrderLine;
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
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code order_detail} rows joined to their header's faktur_id,
 * in {@code order_detail_id} order.
 */
@Repository
@Slf4j
public class SourceOrderLineRepository extends AbstractJdbcRepository implements RecordReader<OrderLine> {

    static final RowMapper<OrderLine> ROW_MAPPER = (rs, rowNum) -> new OrderLine(
            rs.getLong("order_detail_id"),
            rs.getString("faktur_id"),
            null,
            rs.getString("product_id"),
            rs.getString("unit_id"),
            rs.getString("pack_id"),
            rs.getString("line_id"),
            rs.getBigDecimal("quantity_faktur"),
            rs.getBigDecimal("net_price"),
            rs.getBigDecimal("quantity_wms"),
            rs.getBigDecimal("quantity_delivery"),
            rs.getBigDecimal("quantity_loading"),
            rs.getBigDecimal("quantity_unloading"),
            rs.getString("status"),
            nullableDouble(rs, "unloading_latitude"),
            nullableDouble(rs, "unloading_longitude"),
            rs.getString("origin_uom"),
            rs.getBigDecimal("origin_qty"),
            rs.getBigDecimal("total_ctn"),
            rs.getBigDecimal("total_pcs"));

    private final StoreGuard guard;

    public SourceOrderLineRepository(@Qualifier("sourceJdbcTemplate") NamedParameterJdbcTemplate jdbc,
                                     SqlTemplateLoader sql,
                                     @Qualifier("sourceStoreGuard") StoreGuard guard) {
        super(jdbc, sql);
        this.guard = guard;
    }

    @Override
    public String table() {
        return "order_detail";
    }

    @Override
    public List<OrderLine> readPage(TransferScope scope, String afterKey, int pageSize) {
        MapSqlParameterSource params = scopeParams(scope)
                .addValue("afterId", SourceOrderRepository.parseNumericKey(table(), afterKey), Types.BIGINT)
                .addValue("pageSize", pageSize, Types.INTEGER);

        List<OrderLine> page = guard.call("read order_detail page",
                () -> jdbc.query(sql.load("source.orderLines.page"), params, ROW_MAPPER));
        log.debug("Read {} order lines after order_detail_id {}", page.size(), afterKey);
        return page;
    }

    @Override
    public void checkResumeKey(String resumeAfter) {
        SourceOrderRepository.parseNumericKey(table(), resumeAfter);
    }

    @Override
    public long count(TransferScope scope) {
        return countOf(guard.call("count order_detail",
                () -> jdbc.queryForObject(sql.load("source.orderLines.count"), scopeParams(scope), Long.class)));
    }

    /**
     * Order-line counts per do_number for headers whose faktur date lies in
     * [startDate, endDate]. Headers without lines do not appear.
     */
    public Map<String, Long> countByDoNumber(LocalDate startDate, LocalDate endDate) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("startDate", startDate, Types.DATE)
                .addValue("endDateExclusive", endDate.plusDays(1), Types.DATE);

        return guard.call("count order lines by do_number", () -> {
            Map<String, Long> counts = new HashMap<>();
            jdbc.query(sql.load("source.orderLines.countByDoNumber"), params,
                    rs -> {
                        counts.put(rs.getString("do_number"), rs.getLong("line_count"));
                    });
            return counts;
        });
    }
}
