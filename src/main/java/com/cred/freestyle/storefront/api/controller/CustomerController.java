package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.dto.CreditRequest;
import com.cred.freestyle.storefront.api.dto.CustomerResponse;
import com.cred.freestyle.storefront.service.CustomerService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Customer balances: store credit, lifetime spend and delivery value handled.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/customers")
public class CustomerController {

    private static final Logger logger = LoggerFactory.getLogger(CustomerController.class);

    private final CustomerService customerService;

    public CustomerController(CustomerService customerService) {
        this.customerService = customerService;
    }

    @GetMapping("/me")
    public ResponseEntity<CustomerResponse> me(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CustomerResponse.fromEntity(customerService.getCustomer(userId)));
    }

    @GetMapping("/{ownerId}")
    public ResponseEntity<CustomerResponse> getCustomer(
            @PathVariable String ownerId,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        return ResponseEntity.ok(CustomerResponse.fromEntity(customerService.getCustomer(ownerId)));
    }

    @PostMapping("/{ownerId}/credit")
    public ResponseEntity<CustomerResponse> addCredit(
            @PathVariable String ownerId,
            @Valid @RequestBody CreditRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        logger.info("Staff {} adding {} credit to {}", staffId, request.getAmountMinor(), ownerId);
        return ResponseEntity.ok(CustomerResponse.fromEntity(
                customerService.addCredit(ownerId, request.getAmountMinor())));
    }

    @PutMapping("/{ownerId}/credit")
    public ResponseEntity<CustomerResponse> setCredit(
            @PathVariable String ownerId,
            @Valid @RequestBody CreditRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        logger.info("Staff {} setting credit of {} to {}", staffId, ownerId, request.getAmountMinor());
        return ResponseEntity.ok(CustomerResponse.fromEntity(
                customerService.setCredit(ownerId, request.getAmountMinor())));
    }
}
