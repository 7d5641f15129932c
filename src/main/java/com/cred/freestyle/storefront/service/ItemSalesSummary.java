package com.cred.freestyle.storefront.service;

/**
 * Units sold and revenue of one item over a period.
 *
 * @author Storefront Team
 */
public class ItemSalesSummary {

    private final String itemId;
    private final String itemName;
    private final long unitsSold;
    private final long revenueMinor;

    public ItemSalesSummary(String itemId, String itemName, Long unitsSold, Long revenueMinor) {
        this.itemId = itemId;
        this.itemName = itemName;
        this.unitsSold = unitsSold == null ? 0 : unitsSold;
        this.revenueMinor = revenueMinor == null ? 0 : revenueMinor;
    }

    public String getItemId() { return itemId; }
    public String getItemName() { return itemName; }
    public long getUnitsSold() { return unitsSold; }
    public long getRevenueMinor() { return revenueMinor; }
}
