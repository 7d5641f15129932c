package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.domain.model.Item.ItemStatus;
import com.cred.freestyle.storefront.domain.model.Item.StockVisibility;
import com.cred.freestyle.storefront.service.CatalogService;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for creating or editing a catalog item.
 * On edit, fields left null are not changed.
 *
 * @author Storefront Team
 */
public class ItemRequest {

    @Size(max = 100, message = "Name must be at most 100 characters")
    private String name;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    private String description;

    @Size(max = 500, message = "Image URL must be at most 500 characters")
    private String imageUrl;

    @Positive(message = "Price must be positive")
    private Long priceMinor;

    @PositiveOrZero(message = "Quantity cannot be negative")
    private Integer quantity;

    private StockVisibility stockVisibility;

    private ItemStatus status;

    private Boolean digital;

    public ItemRequest() {
    }

    public CatalogService.ItemDetails toDetails() {
        return CatalogService.ItemDetails.builder()
                .name(name)
                .description(description)
                .imageUrl(imageUrl)
                .priceMinor(priceMinor)
                .quantity(quantity)
                .stockVisibility(stockVisibility)
                .status(status)
                .digital(digital)
                .build();
    }

    // Getters and setters
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

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public StockVisibility getStockVisibility() {
        return stockVisibility;
    }

    public void setStockVisibility(StockVisibility stockVisibility) {
        this.stockVisibility = stockVisibility;
    }

    public ItemStatus getStatus() {
        return status;
    }

    public void setStatus(ItemStatus status) {
        this.status = status;
    }

    public Boolean getDigital() {
        return digital;
    }

    public void setDigital(Boolean digital) {
        this.digital = digital;
    }
}
