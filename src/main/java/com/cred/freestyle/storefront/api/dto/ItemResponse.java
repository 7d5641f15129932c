package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.domain.model.Item;
import com.cred.freestyle.storefront.domain.model.Item.StockVisibility;

import java.time.Instant;

/**
 * Response DTO for a catalog item.
 * With BINARY stock visibility the exact count is withheld and only inStock is shown.
 *
 * @author Storefront Team
 */
public class ItemResponse {

    private String itemId;

    private String name;

    private String description;

    private String imageUrl;

    private Long priceMinor;

    private Integer availableForSale;

    private boolean inStock;

    private String stockVisibility;

    private String status;

    private boolean digital;

    private Instant updatedAt;

    public ItemResponse() {
    }

    /**
     * Create response from Item entity.
     *
     * @param item Item entity
     * @return ItemResponse
     */
    public static ItemResponse fromEntity(Item item) {
        ItemResponse response = new ItemResponse();
        response.setItemId(item.getItemId());
        response.setName(item.getName());
        response.setDescription(item.getDescription());
        response.setImageUrl(item.getImageUrl());
        response.setPriceMinor(item.getPriceMinor());
        response.setInStock(item.availableForSale() > 0);
        if (item.getStockVisibility() == StockVisibility.EXACT) {
            response.setAvailableForSale(item.availableForSale());
        }
        response.setStockVisibility(item.getStockVisibility().name());
        response.setStatus(item.getStatus().name());
        response.setDigital(item.isDigital());
        response.setUpdatedAt(item.getUpdatedAt());
        return response;
    }

    // Getters and setters
    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public Long getPriceMinor() {
        return priceMinor;
    }

    public void setPriceMinor(Long priceMinor) {
        this.priceMinor = priceMinor;
    }

    public Integer getAvailableForSale() {
        return availableForSale;
    }

    public void setAvailableForSale(Integer availableForSale) {
        this.availableForSale = availableForSale;
    }

    public boolean isInStock() {
        return inStock;
    }

    public void setInStock(boolean inStock) {
        this.inStock = inStock;
    }

    public String getStockVisibility() {
        return stockVisibility;
    }

    public void setStockVisibility(String stockVisibility) {
        this.stockVisibility = stockVisibility;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public boolean isDigital() {
        return digital;
    }

    public void setDigital(boolean digital) {
        this.digital = digital;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
