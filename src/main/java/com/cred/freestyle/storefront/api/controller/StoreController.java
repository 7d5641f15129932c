package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.dto.ShopStatusRequest;
import com.cred.freestyle.storefront.api.dto.StoreStatusResponse;
import com.cred.freestyle.storefront.service.StoreStateService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Shop open/closed switch.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/store")
public class StoreController {

    private final StoreStateService storeStateService;

    public StoreController(StoreStateService storeStateService) {
        this.storeStateService = storeStateService;
    }

    @GetMapping("/status")
    public ResponseEntity<StoreStatusResponse> getStatus() {
        return ResponseEntity.ok(StoreStatusResponse.fromEntity(storeStateService.current()));
    }

    @PutMapping("/status")
    public ResponseEntity<StoreStatusResponse> setStatus(
            @Valid @RequestBody ShopStatusRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        return ResponseEntity.ok(StoreStatusResponse.fromEntity(
                storeStateService.setShopStatus(request.getStatus(), staffId)));
    }
}
