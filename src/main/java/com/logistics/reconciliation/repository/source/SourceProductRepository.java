package com.logistics.reconciliation.repository.source;

import com.logistics.reconciliation.model.ProductRecord;
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
 * Reads {@code mst_product} from Source in SKU order.
 */
@Repository
@Slf4j
public class SourceProductRepository extends AbstractJdbcRepository implements RecordReader<ProductRecord> {

    static final RowMapper<ProductRecord> ROW_MAPPER = (rs, rowNum) -> new ProductRecord(
            rs.getString("sku"),
            rs.getBigDecimal("height"),
            rs.getBigDecimal("width"),
            rs.getBigDecimal("length"),
            rs.getString("name"),
            rs.getBigDecimal("price"),
            rs.getString("type_product_id"),
            rs.getBigDecimal("qty"),
            rs.getBigDecimal("volume"),
            rs.getBigDecimal("weight"),
            rs.getString("base_uom"),
            rs.getString("pack_id"),
            rs.getString("warehouse_id"));

    private final StoreGuard guard;

    public SourceProductRepository(@Qualifier("sourceJdbcTemplate") NamedParameterJdbcTemplate jdbc,
                                   SqlTemplateLoader sql,
                                   @Qualifier("sourceStoreGuard") StoreGuard guard) {
        super(jdbc, sql);
        this.guard = guard;
    }

    @Override
    public String table() {
        return "mst_product";
    }

    @Override
    public List<ProductRecord> readPage(TransferScope scope, String afterKey, int pageSize) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("warehouseId", scope.warehouseId(), Types.VARCHAR)
                .addValue("afterKey", afterKey, Types.VARCHAR)
                .addValue("pageSize", pageSize, Types.INTEGER);

        List<ProductRecord> page = guard.call("read mst_product page",
                () -> jdbc.query(sql.load("source.products.page"), params, ROW_MAPPER));
        log.debug("Read {} products after sku {}", page.size(), afterKey);
        return page;
    }

    @Override
    public long count(TransferScope scope) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("warehouseId", scope.warehouseId(), Types.VARCHAR);
        return countOf(guard.call("count mst_product",
                () -> jdbc.queryForObject(sql.load("source.products.count"), params, Long.class)));
    }
}
