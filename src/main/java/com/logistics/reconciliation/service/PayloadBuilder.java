package com.logistics.reconciliation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.reconciliation.dto.OrderPayload;
import com.logistics.reconciliation.dto.PayloadConversion;
import com.logistics.reconciliation.dto.PayloadItem;
import com.logistics.reconciliation.model.Address;
import com.logistics.reconciliation.model.OutboundConversion;
import com.logistics.reconciliation.model.OutboundDocument;
import com.logistics.reconciliation.model.OutboundItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assembles the normalized payload document from an outbound document, its
 * items and their conversions.
 * <p>
 * Null strings become {@code ""}, missing quantities and prices become 0,
 * missing conversion factors become 1, and {@code order_type} defaults to {@code REG}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PayloadBuilder {

    static final String DEFAULT_ORDER_TYPE = "REG";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final ObjectMapper objectMapper;

    public OrderPayload build(OutboundDocument document, List<OutboundItem> items,
                              Map<Long, List<OutboundConversion>> conversionsByItem) {
        Address origin = document.origin() == null ? Address.empty() : document.origin();
        Address destination = document.destination() == null ? Address.empty() : document.destination();

        List<PayloadItem> payloadItems = new ArrayList<>(items.size());
        for (OutboundItem item : items) {
            payloadItems.add(buildItem(item, conversionsByItem.getOrDefault(item.id(), List.of())));
        }

        return OrderPayload.builder()
                .warehouseId(text(document.warehouseId()))
                .clientId(text(document.clientId()))
                .outboundReference(text(document.outboundReference()))
                .divisi(text(document.divisi()))
                .fakturDate(date(document.fakturDate()))
                .requestDeliveryDate(date(document.requestDeliveryDate()))
                .originName(text(origin.name()))
                .originAddress1(text(origin.address1()))
                .originAddress2(text(origin.address2()))
                .originCity(text(origin.city()))
                .originPhone(text(origin.phone()))
                .originEmail(text(origin.email()))
                .destinationId(text(document.destinationId()))
                .destinationName(text(destination.name()))
                .destinationAddress1(text(destination.address1()))
                .destinationAddress2(text(destination.address2()))
                .destinationCity(text(destination.city()))
                .destinationZipCode(text(destination.zipCode()))
                .destinationPhone(text(destination.phone()))
                .destinationEmail(text(destination.email()))
                .orderType(document.orderType() == null || document.orderType().isBlank()
                        ? DEFAULT_ORDER_TYPE : document.orderType())
                .items(payloadItems)
                .build();
    }

    private PayloadItem buildItem(OutboundItem item, List<OutboundConversion> conversions) {
        List<PayloadConversion> conversionList = new ArrayList<>(conversions.size());
        for (OutboundConversion conversion : conversions) {
            conversionList.add(PayloadConversion.builder()
                    .uom(text(conversion.uom()))
                    .numerator(orDefault(conversion.numerator(), BigDecimal.ONE))
                    .denominator(orDefault(conversion.denominator(), BigDecimal.ONE))
                    .build());
        }

        return PayloadItem.builder()
                .warehouseId(text(item.warehouseId()))
                .lineId(text(item.lineId()))
                .productId(text(item.productId()))
                .productDescription(text(item.productDescription()))
                .groupId(text(item.groupId()))
                .groupDescription(text(item.groupDescription()))
                .productType(text(item.productType()))
                .qty(orDefault(item.qty(), BigDecimal.ZERO))
                .uom(text(item.uom()))
                .packId(text(item.packId()))
                .productNetPrice(orDefault(item.productNetPrice(), BigDecimal.ZERO))
                .conversion(conversionList)
                .imageUrl(imageUrls(item.imageUrl()))
                .build();
    }

    /**
     * Parses the stored image column. A JSON array yields its elements, any
     * other non-empty value yields a single element, and no image yields {@code [""]}.
     */
    List<String> imageUrls(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of("");
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node != null && node.isArray()) {
                List<String> urls = new ArrayList<>();
                node.forEach(element -> urls.add(element.isNull() ? "" : element.asText()));
                return urls.isEmpty() ? List.of("") : urls;
            }
            if (node != null && node.isTextual()) {
                return List.of(node.asText());
            }
        } catch (JsonProcessingException e) {
            log.debug("image_url is not JSON, using it as a single URL: {}", raw);
        }
        return List.of(raw);
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }

    private static String date(LocalDate value) {
        return value == null ? "" : value.format(DATE_FORMAT);
    }

    private static BigDecimal orDefault(BigDecimal value, BigDecimal fallback) {
        return value == null ? fallback : value;
    }
}
