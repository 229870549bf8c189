package com.logistics.reconciliation.repository.target;

import com.logistics.reconciliation.model.Address;
import com.logistics.reconciliation.model.OrderHeader;
import com.logistics.reconciliation.model.OrderRef;
import com.logistics.reconciliation.model.TransferScope;
import com.logistics.reconciliation.repository.SqlTemplateLoader;
import com.logistics.reconciliation.repository.StoreGuard;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes {@code order_main}, keyed by faktur_id, and answers the header
 * lookups used by the line writer and the range operations.
 */
@Repository
public class TargetOrderRepository extends AbstractKeyedWriter<OrderHeader> {

    private final StoreGuard guard;

    public TargetOrderRepository(@Qualifier("targetJdbcTemplate") NamedParameterJdbcTemplate jdbc,
                                 SqlTemplateLoader sql,
                                 @Qualifier("targetStoreGuard") StoreGuard guard) {
        super(jdbc, sql);
        this.guard = guard;
    }

    @Override
    public String table() {
        return "order_main";
    }

    @Override
    protected Set<String> findExistingKeys(Collection<OrderHeader> rows) {
        List<String> fakturIds = rows.stream().map(OrderHeader::fakturId).toList();
        Set<String> existing = new HashSet<>();
        for (List<String> chunk : partition(fakturIds, IN_CHUNK_SIZE)) {
            existing.addAll(jdbc.queryForList(sql.load("target.orders.existingKeys"),
                    new MapSqlParameterSource("keys", chunk), String.class));
        }
        return existing;
    }

    @Override
    protected String insertStatement() {
        return sql.load("target.orders.insert");
    }

    @Override
    protected String updateStatement() {
        return sql.load("target.orders.update");
    }

    @Override
    protected SqlParameterSource toParameters(OrderHeader o) {
        Address origin = o.origin() == null ? Address.empty() : o.origin();
        Address destination = o.destination() == null ? Address.empty() : o.destination();
        return new MapSqlParameterSource()
                .addValue("fakturId", o.fakturId(), Types.VARCHAR)
                .addValue("fakturDate", o.fakturDate(), Types.DATE)
                .addValue("deliveryDate", o.deliveryDate(), Types.DATE)
                .addValue("doNumber", o.doNumber(), Types.VARCHAR)
                .addValue("status", o.status(), Types.VARCHAR)
                .addValue("customerId", o.customerId(), Types.VARCHAR)
                .addValue("warehouseId", o.warehouseId(), Types.VARCHAR)
                .addValue("clientId", o.clientId(), Types.VARCHAR)
                .addValue("divisi", o.divisi(), Types.VARCHAR)
                .addValue("originName", origin.name(), Types.VARCHAR)
                .addValue("originAddress1", origin.address1(), Types.VARCHAR)
                .addValue("originAddress2", origin.address2(), Types.VARCHAR)
                .addValue("originCity", origin.city(), Types.VARCHAR)
                .addValue("originZipCode", origin.zipCode(), Types.VARCHAR)
                .addValue("originPhone", origin.phone(), Types.VARCHAR)
                .addValue("originEmail", origin.email(), Types.VARCHAR)
                .addValue("destinationName", destination.name(), Types.VARCHAR)
                .addValue("destinationAddress1", destination.address1(), Types.VARCHAR)
                .addValue("destinationAddress2", destination.address2(), Types.VARCHAR)
                .addValue("destinationCity", destination.city(), Types.VARCHAR)
                .addValue("destinationZipCode", destination.zipCode(), Types.VARCHAR)
                .addValue("destinationPhone", destination.phone(), Types.VARCHAR)
                .addValue("destinationEmail", destination.email(), Types.VARCHAR)
                .addValue("notes", o.notes(), Types.VARCHAR)
                .addValue("createdBy", o.createdBy(), Types.VARCHAR);
    }

    @Override
    public long count(TransferScope scope) {
        return countOf(guard.call("count order_main",
                () -> jdbc.queryForObject(sql.load("target.orders.count"), scopeParams(scope), Long.class)));
    }

    /**
     * Target order_id for each faktur_id that has a header in Target.
     */
    public Map<String, Long> findOrderIds(Collection<String> fakturIds) {
        Map<String, Long> ids = new HashMap<>();
        for (List<String> chunk : partition(fakturIds, IN_CHUNK_SIZE)) {
            jdbc.query(sql.load("target.orders.idsByFakturId"), new MapSqlParameterSource("fakturIds", chunk),
                    rs -> {
                        ids.put(rs.getString("faktur_id"), rs.getLong("order_id"));
                    });
        }
        return ids;
    }

    /**
     * Headers in the scope's date range and warehouse that have no lines yet,
     * ordered by faktur date then do_number.
     */
    public List<OrderRef> findWithoutLines(TransferScope scope) {
        return guard.call("find order_main headers without lines",
                () -> jdbc.query(sql.load("target.orders.withoutLines"), scopeParams(scope),
                        (rs, rowNum) -> new OrderRef(rs.getLong("order_id"), rs.getString("faktur_id"),
                                rs.getString("do_number"))));
    }

    /**
     * Distinct do_numbers of the headers in the scope's date range and warehouse, ascending.
     */
    public List<String> findDoNumbers(TransferScope scope) {
        return guard.call("list order_main do_numbers",
                () -> jdbc.queryForList(sql.load("target.orders.doNumbers"), scopeParams(scope), String.class));
    }
}
