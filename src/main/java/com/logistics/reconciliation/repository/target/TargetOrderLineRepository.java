package com.logistics.reconciliation.repository.target;

import com.logistics.reconciliation.model.OrderLine;
import com.logistics.reconciliation.model.TransferScope;
import com.logistics.reconciliation.repository.SqlTemplateLoader;
import com.logistics.reconciliation.repository.StoreGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Writes {@code order_detail_main}, keyed by (order_id, product_id, line_id).
 * <p>
 * Each line's parent is resolved through its faktur_id; a line whose header is
 * not in Target is counted as orphaned and never written.
 */
@Repository
@Slf4j
public class TargetOrderLineRepository extends AbstractKeyedWriter<OrderLine> {

    private final TargetOrderRepository orderRepository;
    private final StoreGuard guard;

    public TargetOrderLineRepository(@Qualifier("targetJdbcTemplate") NamedParameterJdbcTemplate jdbc,
                                     SqlTemplateLoader sql,
                                     TargetOrderRepository orderRepository,
                                     @Qualifier("targetStoreGuard") StoreGuard guard) {
        super(jdbc, sql);
        this.orderRepository = orderRepository;
        this.guard = guard;
    }

    @Override
    public String table() {
        return "order_detail_main";
    }

    @Override
    protected Prepared<OrderLine> prepare(List<OrderLine> rows) {
        Set<String> fakturIds = new LinkedHashSet<>();
        for (OrderLine line : rows) {
            if (line.fakturId() != null) {
                fakturIds.add(line.fakturId());
            }
        }
        Map<String, Long> parents = fakturIds.isEmpty() ? Map.of() : orderRepository.findOrderIds(fakturIds);

        List<OrderLine> resolved = new ArrayList<>(rows.size());
        int orphaned = 0;
        for (OrderLine line : rows) {
            Long orderId = line.fakturId() == null ? null : parents.get(line.fakturId());
            if (orderId == null) {
                orphaned++;
                continue;
            }
            resolved.add(line.withTargetOrderId(orderId));
        }
        if (orphaned > 0) {
            log.warn("Skipped {} order lines whose header is not in order_main", orphaned);
        }
        return new Prepared<>(resolved, orphaned);
    }

    @Override
    protected Set<String> findExistingKeys(Collection<OrderLine> rows) {
        List<String> fakturIds = rows.stream().map(OrderLine::fakturId).filter(Objects::nonNull).distinct().toList();
        Set<String> existing = new HashSet<>();
        for (List<String> chunk : partition(fakturIds, IN_CHUNK_SIZE)) {
            jdbc.query(sql.load("target.orderLines.existingKeys"), new MapSqlParameterSource("fakturIds", chunk),
                    rs -> {
                        existing.add(rs.getString("faktur_id") + "|" + rs.getString("product_id") + "|" + rs.getString("line_id"));
                    });
        }
        return existing;
    }

    @Override
    protected String insertStatement() {
        return sql.load("target.orderLines.insert");
    }

    @Override
    protected String updateStatement() {
        return sql.load("target.orderLines.update");
    }

    @Override
    protected SqlParameterSource toParameters(OrderLine l) {
        return new MapSqlParameterSource()
                .addValue("orderId", l.targetOrderId(), Types.BIGINT)
                .addValue("productId", l.productId(), Types.VARCHAR)
                .addValue("unitId", l.unitId(), Types.VARCHAR)
                .addValue("packId", l.packId(), Types.VARCHAR)
                .addValue("lineId", l.lineId(), Types.VARCHAR)
                .addValue("quantityFaktur", l.quantityFaktur(), Types.NUMERIC)
                .addValue("netPrice", l.netPrice(), Types.NUMERIC)
                .addValue("quantityWms", l.quantityWms(), Types.NUMERIC)
                .addValue("quantityDelivery", l.quantityDelivery(), Types.NUMERIC)
                .addValue("quantityLoading", l.quantityLoading(), Types.NUMERIC)
                .addValue("quantityUnloading", l.quantityUnloading(), Types.NUMERIC)
                .addValue("status", l.status(), Types.VARCHAR)
                .addValue("unloadingLatitude", l.unloadingLatitude(), Types.DOUBLE)
                .addValue("unloadingLongitude", l.unloadingLongitude(), Types.DOUBLE)
                .addValue("originUom", l.originUom(), Types.VARCHAR)
                .addValue("originQty", l.originQty(), Types.NUMERIC)
                .addValue("totalCtn", l.totalCtn(), Types.NUMERIC)
                .addValue("totalPcs", l.totalPcs(), Types.NUMERIC);
    }

    @Override
    public long count(TransferScope scope) {
        return countOf(guard.call("count order_detail_main",
                () -> jdbc.queryForObject(sql.load("target.orderLines.count"), scopeParams(scope), Long.class)));
    }
}
