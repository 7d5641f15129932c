package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.domain.model.OrderLine;

/**
 * One line of an order.
 *
 * @author Storefront Team
 */
public class OrderLineResponse {

    private String itemId;

    private String itemName;

    private Integer quantity;

    private Long unitPriceMinor;

    private long lineTotalMinor;

    private boolean digital;

    public OrderLineResponse() {
    }

    public static OrderLineResponse fromLine(OrderLine line) {
        OrderLineResponse response = new OrderLineResponse();
        response.setItemId(line.getItemId());
        response.setItemName(line.getItemName());
        response.setQuantity(line.getQuantity());
        response.setUnitPriceMinor(line.getUnitPriceMinor());
        response.setLineTotalMinor(line.lineTotalMinor());
        response.setDigital(line.isDigital());
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

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public Long getUnitPriceMinor() {
        return unitPriceMinor;
    }

    public void setUnitPriceMinor(Long unitPriceMinor) {
        this.unitPriceMinor = unitPriceMinor;
    }

    public long getLineTotalMinor() {
        return lineTotalMinor;
    }

    public void setLineTotalMinor(long lineTotalMinor) {
        this.lineTotalMinor = lineTotalMinor;
    }

    public boolean isDigital() {
        return digital;
    }

    public void setDigital(boolean digital) {
        this.digital = digital;
    }
}
