package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.DigitalAsset;
import com.cred.freestyle.storefront.domain.model.DigitalAsset.AssetStatus;
import com.cred.freestyle.storefront.domain.model.Item;
import com.cred.freestyle.storefront.domain.model.Item.ItemStatus;
import com.cred.freestyle.storefront.domain.model.Item.StockVisibility;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.infrastructure.export.InventoryCsvExporter;
import com.cred.freestyle.storefront.infrastructure.messaging.StoreNotification;
import com.cred.freestyle.storefront.repository.DigitalAssetRepository;
import com.cred.freestyle.storefront.repository.ItemRepository;
import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Staff-facing catalog management.
 *
 * Stock changes go through the {@link InventoryLedger}; this service only edits descriptive
 * fields and status. Removing an item hides it for good but keeps the row, since orders refer
 * to it.
 *
 * @author Storefront Team
 */
@Service
public class CatalogService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogService.class);

    private final ItemRepository itemRepository;
    private final DigitalAssetRepository digitalAssetRepository;
    private final InventoryLedger inventoryLedger;
    private final InventoryCsvExporter csvExporter;
    private final ApplicationEventPublisher eventPublisher;

    public CatalogService(
            ItemRepository itemRepository,
            DigitalAssetRepository digitalAssetRepository,
            InventoryLedger inventoryLedger,
            InventoryCsvExporter csvExporter,
            ApplicationEventPublisher eventPublisher
    ) {
        this.itemRepository = itemRepository;
        this.digitalAssetRepository = digitalAssetRepository;
        this.inventoryLedger = inventoryLedger;
        this.csvExporter = csvExporter;
        this.eventPublisher = eventPublisher;
    }

    @Transactional
    public Item createItem(ItemDetails details, String staffId) {
        if (details.getName() == null || details.getName().isBlank()) {
            throw new IllegalArgumentException("Item name is required");
        }
        if (details.getPriceMinor() == null) {
            throw new IllegalArgumentException("Item price is required");
        }
        validatePrice(details.getPriceMinor());
        if (details.getQuantity() != null && details.getQuantity() < 0) {
            throw new IllegalArgumentException("Initial quantity cannot be negative");
        }
        requireUniqueName(details.getName());

        Item item = itemRepository.save(Item.builder()
                .name(details.getName().trim())
                .description(details.getDescription())
                .imageUrl(details.getImageUrl())
                .priceMinor(details.getPriceMinor())
                .quantityAvailable(details.getQuantity() == null ? 0 : details.getQuantity())
                .quantityReserved(0)
                .stockVisibility(details.getStockVisibility() == null
                        ? StockVisibility.EXACT : details.getStockVisibility())
                .status(ItemStatus.ACTIVE)
                .digital(Boolean.TRUE.equals(details.getDigital()))
                .build());

        publishChange(item, "created", staffId);
        logger.info("Item {} ({}) created by {}", item.getItemId(), item.getName(), staffId);
        return item;
    }

    /**
     * Update the fields that are set in {@code changes}. Stock is changed with {@link #restock}.
     */
    @Transactional
    public Item editItem(String itemId, ItemDetails changes, String staffId) {
        Item item = itemRepository.findByIdWithLock(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Item", itemId));
        if (item.getStatus() == ItemStatus.REMOVED) {
            throw new IllegalArgumentException("Item " + itemId + " has been removed");
        }
        if (changes.getQuantity() != null) {
            throw new IllegalArgumentException("Use restock to change stock levels");
        }

        if (changes.getName() != null && !changes.getName().trim().equalsIgnoreCase(item.getName())) {
            requireUniqueName(changes.getName());
            item.setName(changes.getName().trim());
        }
        if (changes.getPriceMinor() != null) {
            validatePrice(changes.getPriceMinor());
            item.setPriceMinor(changes.getPriceMinor());
        }
        if (changes.getDescription() != null) {
            item.setDescription(changes.getDescription());
        }
        if (changes.getImageUrl() != null) {
            item.setImageUrl(changes.getImageUrl());
        }
        if (changes.getStockVisibility() != null) {
            item.setStockVisibility(changes.getStockVisibility());
        }
        if (changes.getStatus() != null) {
            if (changes.getStatus() == ItemStatus.REMOVED) {
                throw new IllegalArgumentException("Use remove to take an item out of the catalog");
            }
            item.setStatus(changes.getStatus());
        }
        if (changes.getDigital() != null) {
            item.setDigital(changes.getDigital());
        }

        Item saved = itemRepository.save(item);
        publishChange(saved, "edited", staffId);
        logger.info("Item {} edited by {}", itemId, staffId);
        return saved;
    }

    @Transactional
    public Item restock(String itemId, int quantity, String staffId) {
        Item item = inventoryLedger.restock(itemId, quantity);
        publishChange(item, "restocked", staffId);
        return item;
    }

    /**
     * Take an item out of the catalog. Orders already holding it are not affected.
     */
    @Transactional
    public Item removeItem(String itemId, String staffId) {
        Item item = itemRepository.findByIdWithLock(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Item", itemId));
        if (item.getStatus() == ItemStatus.REMOVED) {
            return item;
        }
        item.setStatus(ItemStatus.REMOVED);
        Item saved = itemRepository.save(item);

        publishChange(saved, "removed", staffId);
        logger.info("Item {} removed by {}", itemId, staffId);
        return saved;
    }

    /**
     * Add deliverable units (keys, codes, links) to a digital item's pool.
     *
     * @return Number of units now available
     */
    @Transactional
    public long addDigitalAssets(String itemId, List<String> payloads) {
        Item item = getItem(itemId);
        if (!item.isDigital()) {
            throw new IllegalArgumentException("Item " + itemId + " is not digital");
        }
        List<DigitalAsset> assets = payloads.stream()
                .filter(payload -> payload != null && !payload.isBlank())
                .map(payload -> DigitalAsset.builder().itemId(itemId).payload(payload.trim()).build())
                .collect(Collectors.toList());
        digitalAssetRepository.saveAll(assets);

        logger.info("Added {} digital units to item {}", assets.size(), itemId);
        return digitalAssetRepository.countByItemIdAndStatus(itemId, AssetStatus.AVAILABLE);
    }

    @Transactional(readOnly = true)
    public long availableDigitalUnits(String itemId) {
        return digitalAssetRepository.countByItemIdAndStatus(itemId, AssetStatus.AVAILABLE);
    }

    @Transactional(readOnly = true)
    public Item getItem(String itemId) {
        return itemRepository.findById(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Item", itemId));
    }

    /**
     * Catalog listing. Buyers see active items; staff may include hidden ones.
     */
    @Transactional(readOnly = true)
    public List<Item> listItems(boolean includeHidden) {
        if (includeHidden) {
            return itemRepository.findByStatusInOrderByNameAsc(EnumSet.of(ItemStatus.ACTIVE, ItemStatus.HIDDEN));
        }
        return itemRepository.findByStatusOrderByNameAsc(ItemStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public String exportInventoryCsv() {
        return csvExporter.export(itemRepository.findAll(Sort.by("name")));
    }

    private void requireUniqueName(String name) {
        if (itemRepository.existsByNameIgnoreCase(name.trim())) {
            throw new IllegalArgumentException("An item named '" + name.trim() + "' already exists");
        }
    }

    private static void validatePrice(long priceMinor) {
        if (priceMinor <= 0) {
            throw new IllegalArgumentException("Price must be positive");
        }
    }

    private void publishChange(Item item, String action, String staffId) {
        eventPublisher.publishEvent(StoreNotification.of(StoreNotification.Type.ITEM_CHANGED, null, item.getItemId())
                .with("action", action)
                .with("name", item.getName())
                .with("changedBy", staffId));
    }

    /**
     * Descriptive fields of an item. Null fields are left unchanged on edit.
     */
    @Data
    @Builder
    public static class ItemDetails {
        private String name;
        private String description;
        private String imageUrl;
        private Long priceMinor;
        private Integer quantity;
        private StockVisibility stockVisibility;
        private ItemStatus status;
        private Boolean digital;
    }
}
