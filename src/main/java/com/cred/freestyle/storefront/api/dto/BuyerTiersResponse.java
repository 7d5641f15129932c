package com.cred.freestyle.storefront.api.dto;

import java.util.List;

/**
 * Tiers held by a buyer.
 *
 * @author Storefront Team
 */
public class BuyerTiersResponse {

    private String ownerId;

    private List<String> roleIds;

    private List<String> newlyGranted;

    public BuyerTiersResponse() {
    }

    public BuyerTiersResponse(String ownerId, List<String> roleIds, List<String> newlyGranted) {
        this.ownerId = ownerId;
        this.roleIds = roleIds;
        this.newlyGranted = newlyGranted;
    }

    // Getters and setters
    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public List<String> getRoleIds() {
        return roleIds;
    }

    public void setRoleIds(List<String> roleIds) {
        this.roleIds = roleIds;
    }

    public List<String> getNewlyGranted() {
        return newlyGranted;
    }

    public void setNewlyGranted(List<String> newlyGranted) {
        this.newlyGranted = newlyGranted;
    }
}
