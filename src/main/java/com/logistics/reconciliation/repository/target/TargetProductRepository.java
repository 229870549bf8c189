package com.logistics.reconciliation.repository.target;

import com.logistics.reconciliation.model.ProductRecord;
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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes {@code mst_product_main}, keyed by SKU.
 * <p>
 * {@code allocated_qty} starts at zero and is never touched by the writer;
 * {@code available_qty} is recomputed from the incoming quantity on every write.
 */
@Repository
public class TargetProductRepository extends AbstractKeyedWriter<ProductRecord> {

    private final StoreGuard guard;

    public TargetProductRepository(@Qualifier("targetJdbcTemplate") NamedParameterJdbcTemplate jdbc,
                                   SqlTemplateLoader sql,
                                   @Qualifier("targetStoreGuard") StoreGuard guard) {
        super(jdbc, sql);
        this.guard = guard;
    }

    @Override
    public String table() {
        return "mst_product_main";
    }

    @Override
    protected Set<String> findExistingKeys(Collection<ProductRecord> rows) {
        List<String> skus = rows.stream().map(ProductRecord::sku).toList();
        Set<String> existing = new HashSet<>();
        for (List<String> chunk : partition(skus, IN_CHUNK_SIZE)) {
            existing.addAll(jdbc.queryForList(sql.load("target.products.existingKeys"),
                    new MapSqlParameterSource("keys", chunk), String.class));
        }
        return existing;
    }

    @Override
    protected String insertStatement() {
        return sql.load("target.products.insert");
    }

    @Override
    protected String updateStatement() {
        return sql.load("target.products.update");
    }

    @Override
    protected SqlParameterSource toParameters(ProductRecord p) {
        return new MapSqlParameterSource()
                .addValue("sku", p.sku(), Types.VARCHAR)
                .addValue("height", p.height(), Types.NUMERIC)
                .addValue("width", p.width(), Types.NUMERIC)
                .addValue("length", p.length(), Types.NUMERIC)
                .addValue("name", p.name(), Types.VARCHAR)
                .addValue("price", p.price(), Types.NUMERIC)
                .addValue("typeProductId", p.typeProductId(), Types.VARCHAR)
                .addValue("qty", p.qty(), Types.NUMERIC)
                .addValue("volume", p.volume(), Types.NUMERIC)
                .addValue("weight", p.weight(), Types.NUMERIC)
                .addValue("baseUom", p.baseUom(), Types.VARCHAR)
                .addValue("packId", p.packId(), Types.VARCHAR)
                .addValue("warehouseId", p.warehouseId(), Types.VARCHAR);
    }

    @Override
    public long count(TransferScope scope) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("warehouseId", scope.warehouseId(), Types.VARCHAR);
        return countOf(guard.call("count mst_product_main",
                () -> jdbc.queryForObject(sql.load("target.products.count"), params, Long.class)));
    }
}
