package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.dto.DigitalAssetsRequest;
import com.cred.freestyle.storefront.api.dto.ItemRequest;
import com.cred.freestyle.storefront.api.dto.ItemResponse;
import com.cred.freestyle.storefront.api.dto.QuantityRequest;
import com.cred.freestyle.storefront.domain.model.Item;
import com.cred.freestyle.storefront.service.CatalogService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for the item catalog.
 * Reads are public; writes take the acting staff member from the X-Staff-Id header.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/items")
public class CatalogController {

    private static final Logger logger = LoggerFactory.getLogger(CatalogController.class);

    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    /**
     * List items. Hidden items are only included when requested (staff views).
     */
    @GetMapping
    public ResponseEntity<List<ItemResponse>> listItems(
            @RequestParam(defaultValue = "false") boolean includeHidden
    ) {
        List<ItemResponse> items = catalogService.listItems(includeHidden)
                .stream()
                .map(ItemResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(items);
    }

    @GetMapping("/{itemId}")
    public ResponseEntity<ItemResponse> getItem(@PathVariable String itemId) {
        return ResponseEntity.ok(ItemResponse.fromEntity(catalogService.getItem(itemId)));
    }

    /**
     * Create a new item.
     *
     * @param request item fields; name and price are required
     * @param staffId acting staff member
     * @return created item
     */
    @PostMapping
    public ResponseEntity<ItemResponse> createItem(
            @Valid @RequestBody ItemRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        Item item = catalogService.createItem(request.toDetails(), staffId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ItemResponse.fromEntity(item));
    }

    /**
     * Edit item fields. Absent fields are left unchanged; stock is changed through restock only.
     */
    @PatchMapping("/{itemId}")
    public ResponseEntity<ItemResponse> editItem(
            @PathVariable String itemId,
            @Valid @RequestBody ItemRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        Item item = catalogService.editItem(itemId, request.toDetails(), staffId);
        return ResponseEntity.ok(ItemResponse.fromEntity(item));
    }

    @PostMapping("/{itemId}/restock")
    public ResponseEntity<ItemResponse> restock(
            @PathVariable String itemId,
            @Valid @RequestBody QuantityRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        Item item = catalogService.restock(itemId, request.getQuantity(), staffId);
        return ResponseEntity.ok(ItemResponse.fromEntity(item));
    }

    /**
     * Remove an item from sale. Past orders keep their line snapshots.
     */
    @DeleteMapping("/{itemId}")
    public ResponseEntity<ItemResponse> removeItem(
            @PathVariable String itemId,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        Item item = catalogService.removeItem(itemId, staffId);
        return ResponseEntity.ok(ItemResponse.fromEntity(item));
    }

    @PostMapping("/{itemId}/digital-assets")
    public ResponseEntity<Map<String, Object>> addDigitalAssets(
            @PathVariable String itemId,
            @Valid @RequestBody DigitalAssetsRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        long available = catalogService.addDigitalAssets(itemId, request.getPayloads());
        logger.info("{} added {} digital units to item {}", staffId, request.getPayloads().size(), itemId);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "itemId", itemId,
                "availableUnits", available
        ));
    }

    /**
     * Export the full inventory, hidden and removed items included, as CSV.
     */
    @GetMapping(value = "/export", produces = "text/csv")
    public ResponseEntity<String> exportInventoryCsv(
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        logger.info("Inventory export requested by {}", staffId);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"inventory.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(catalogService.exportInventoryCsv());
    }
}
