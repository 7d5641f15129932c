package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.service.CartSnapshot;

/**
 * One line of a cart.
 *
 * @author Storefront Team
 */
public class CartLineResponse {

    private String itemId;

    private String itemName;

    private int quantity;

    private long priceSnapshotMinor;

    private long lineTotalMinor;

    public CartLineResponse() {
    }

    public static CartLineResponse fromLine(CartSnapshot.Line line) {
        CartLineResponse response = new CartLineResponse();
        response.setItemId(line.getItemId());
        response.setItemName(line.getItemName());
        response.setQuantity(line.getQuantity());
        response.setPriceSnapshotMinor(line.getPriceSnapshotMinor());
        response.setLineTotalMinor(line.getLineTotalMinor());
        return response;
    }

    // Getters and setters
    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public String getItemName() {
        return itemName;
    }

    public void setItemName(String itemName) {
        this.itemName = itemName;
    }

    public int getQuantity() {
        return quantity;
    }

    public void setQuantity(int quantity) {
        this.quantity = quantity;
    }

    public long getPriceSnapshotMinor() {
        return priceSnapshotMinor;
    }

    public void setPriceSnapshotMinor(long priceSnapshotMinor) {
        this.priceSnapshotMinor = priceSnapshotMinor;
    }

    public long getLineTotalMinor() {
        return lineTotalMinor;
    }

    public void setLineTotalMinor(long lineTotalMinor) {
        this.lineTotalMinor = lineTotalMinor;
    }
}
