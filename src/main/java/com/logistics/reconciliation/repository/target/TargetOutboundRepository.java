package com.logistics.reconciliation.repository.target;

import com.logistics.reconciliation.model.Address;
import com.logistics.reconciliation.model.OutboundConversion;
import com.logistics.reconciliation.model.OutboundCount;
import com.logistics.reconciliation.model.OutboundDocument;
import com.logistics.reconciliation.model.OutboundItem;
import com.logistics.reconciliation.repository.AbstractJdbcRepository;
import com.logistics.reconciliation.repository.SqlTemplateLoader;
import com.logistics.reconciliation.repository.StoreGuard;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the cleansed outbound projection in Target
 * (documents, items and unit conversions).
 */
@Repository
public class TargetOutboundRepository extends AbstractJdbcRepository {

    private static final RowMapper<OutboundDocument> DOCUMENT_MAPPER = (rs, rowNum) -> new OutboundDocument(
            rs.getLong("id"),
            rs.getString("warehouse_id"),
            rs.getString("client_id"),
            rs.getString("outbound_reference"),
            rs.getString("divisi"),
            localDate(rs, "faktur_date"),
            localDate(rs, "request_delivery_date"),
            new Address(
                    rs.getString("origin_name"),
                    rs.getString("origin_address_1"),
                    rs.getString("origin_address_2"),
                    rs.getString("origin_city"),
                    null,
                    rs.getString("origin_phone"),
                    rs.getString("origin_email")),
            rs.getString("destination_id"),
            new Address(
                    rs.getString("destination_name"),
                    rs.getString("destination_address_1"),
                    rs.getString("destination_address_2"),
                    rs.getString("destination_city"),
                    rs.getString("destination_zip_code"),
                    rs.getString("destination_phone"),
                    rs.getString("destination_email")),
            rs.getString("order_type"));

    private static final RowMapper<OutboundConversion> CONVERSION_MAPPER = (rs, rowNum) -> new OutboundConversion(
            rs.getLong("id"),
            rs.getLong("item_id"),
            rs.getString("uom"),
            rs.getBigDecimal("numerator"),
            rs.getBigDecimal("denominator"));

    private final StoreGuard guard;

    public TargetOutboundRepository(@Qualifier("targetJdbcTemplate") NamedParameterJdbcTemplate jdbc,
                                    SqlTemplateLoader sql,
                                    @Qualifier("targetStoreGuard") StoreGuard guard) {
        super(jdbc, sql);
        this.guard = guard;
    }

    /**
     * Outbound item counts per outbound_reference for documents whose faktur
     * date lies in [startDate, endDate].
     */
    public Map<String, OutboundCount> countByReference(LocalDate startDate, LocalDate endDate) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("startDate", startDate, Types.DATE)
                .addValue("endDateExclusive", endDate.plusDays(1), Types.DATE);

        return guard.call("count outbound items by reference", () -> {
            Map<String, OutboundCount> counts = new HashMap<>();
            jdbc.query(sql.load("target.outbound.countByReference"), params,
                    rs -> {
                        counts.put(rs.getString("do_number"), new OutboundCount(
                                rs.getLong("line_count"), rs.getString("warehouse_id"), rs.getString("client_id")));
                    });
            return counts;
        });
    }

    /**
     * The document for a do_number; the lowest id wins when several match.
     */
    public Optional<OutboundDocument> findDocument(String doNumber) {
        MapSqlParameterSource params = new MapSqlParameterSource("doNumber", doNumber);
        List<OutboundDocument> documents = guard.call("find outbound document " + doNumber,
                () -> jdbc.query(sql.load("target.outbound.documentByReference"), params, DOCUMENT_MAPPER));
        return documents.stream().findFirst();
    }

    public List<OutboundItem> findItems(OutboundDocument document) {
        MapSqlParameterSource params = new MapSqlParameterSource("documentId", document.id());
        return guard.call("find outbound items of " + document.outboundReference(),
                () -> jdbc.query(sql.load("target.outbound.itemsByDocument"), params,
                        (rs, rowNum) -> mapItem(rs, document.outboundReference())));
    }

    /**
     * Conversions grouped by item id, each group ordered by conversion id.
     */
    public Map<Long, List<OutboundConversion>> findConversions(Collection<Long> itemIds) {
        Map<Long, List<OutboundConversion>> byItem = new HashMap<>();
        if (itemIds.isEmpty()) {
            return byItem;
        }
        for (List<Long> chunk : partition(itemIds, IN_CHUNK_SIZE)) {
            List<OutboundConversion> conversions = guard.call("find outbound conversions",
                    () -> jdbc.query(sql.load("target.outbound.conversionsByItems"),
                            new MapSqlParameterSource("itemIds", chunk), CONVERSION_MAPPER));
            for (OutboundConversion conversion : conversions) {
                byItem.computeIfAbsent(conversion.itemId(), id -> new ArrayList<>()).add(conversion);
            }
        }
        return byItem;
    }

    /**
     * Items of every document whose outbound_reference is in {@code references},
     * grouped by reference and ordered by item id.
     */
    public Map<String, List<OutboundItem>> findItemsByReferences(Collection<String> references) {
        Map<String, List<OutboundItem>> byReference = new LinkedHashMap<>();
        if (references.isEmpty()) {
            return byReference;
        }
        for (List<String> chunk : partition(references, IN_CHUNK_SIZE)) {
            List<OutboundItem> items = guard.call("find outbound items by reference",
                    () -> jdbc.query(sql.load("target.outbound.itemsByReferences"),
                            new MapSqlParameterSource("references", chunk),
                            (rs, rowNum) -> mapItem(rs, rs.getString("outbound_reference"))));
            for (OutboundItem item : items) {
                byReference.computeIfAbsent(item.outboundReference(), ref -> new ArrayList<>()).add(item);
            }
        }
        return byReference;
    }

    private static OutboundItem mapItem(ResultSet rs, String outboundReference) throws SQLException {
        return new OutboundItem(
                rs.getLong("id"),
                outboundReference,
                rs.getString("warehouse_id"),
                rs.getString("line_id"),
                rs.getString("product_id"),
                rs.getString("product_description"),
                rs.getString("group_id"),
                rs.getString("group_description"),
                rs.getString("product_type"),
                rs.getBigDecimal("qty"),
                rs.getString("uom"),
                rs.getString("pack_id"),
                rs.getBigDecimal("product_net_price"),
                rs.getString("image_url"));
    }
}
