package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.domain.model.Customer;

/**
 * Response DTO for a customer's balances and spend.
 *
 * @author Storefront Team
 */
public class CustomerResponse {

    private String ownerId;

    private Long creditBalanceMinor;

    private Long lifetimeTotalMinor;

    private Long deliveryValueHandledMinor;

    public CustomerResponse() {
    }

    public static CustomerResponse fromEntity(Customer customer) {
        CustomerResponse response = new CustomerResponse();
        response.setOwnerId(customer.getOwnerId());
        response.setCreditBalanceMinor(customer.getCreditBalanceMinor());
        response.setLifetimeTotalMinor(customer.getLifetimeTotalMinor());
        response.setDeliveryValueHandledMinor(customer.getDeliveryValueHandledMinor());
        return response;
    }

    // Getters and setters
    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public Long getCreditBalanceMinor() {
        return creditBalanceMinor;
    }

    public void setCreditBalanceMinor(Long creditBalanceMinor) {
        this.creditBalanceMinor = creditBalanceMinor;
    }

    public Long getLifetimeTotalMinor() {
        return lifetimeTotalMinor;
    }

    public void setLifetimeTotalMinor(Long lifetimeTotalMinor) {
        this.lifetimeTotalMinor = lifetimeTotalMinor;
    }

    public Long getDeliveryValueHandledMinor() {
        return deliveryValueHandledMinor;
    }

    public void setDeliveryValueHandledMinor(Long deliveryValueHandledMinor) {
        this.deliveryValueHandledMinor = deliveryValueHandledMinor;
    }
}
