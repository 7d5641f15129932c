package com.cred.freestyle.storefront.infrastructure.export;

import com.cred.freestyle.storefront.domain.model.Item;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes the inventory as CSV with a header row.
 *
 * @author Storefront Team
 */
@Component
public class InventoryCsvExporter {

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(InventoryRow.class).withHeader();

    public String export(List<Item> items) {
        List<InventoryRow> rows = items.stream().map(InventoryRow::of).collect(Collectors.toList());
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write inventory CSV", e);
        }
    }

    @JsonPropertyOrder({"id", "name", "price", "available", "reserved", "available_for_sale",
            "visibility", "status", "digital"})
    static class InventoryRow {

        public String id;
        public String name;
        public String price;
        public int available;
        public int reserved;
        @JsonProperty("available_for_sale")
        public int availableForSale;
        public String visibility;
        public String status;
        public boolean digital;

        static InventoryRow of(Item item) {
            InventoryRow row = new InventoryRow();
            row.id = item.getItemId();
            row.name = item.getName();
            row.price = BigDecimal.valueOf(item.getPriceMinor(), 2).toPlainString();
            row.available = item.getQuantityAvailable();
            row.reserved = item.getQuantityReserved();
            row.availableForSale = item.availableForSale();
            row.visibility = item.getStockVisibility().name();
            row.status = item.getStatus().name();
            row.digital = item.isDigital();
            return row;
        }
    }
}
