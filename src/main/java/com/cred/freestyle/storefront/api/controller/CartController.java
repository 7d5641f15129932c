package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.dto.AddToCartRequest;
import com.cred.freestyle.storefront.api.dto.CartResponse;
import com.cred.freestyle.storefront.service.CartService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for carts.
 * /cart acts on the caller's own cart; /carts are the staff views over all carts.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1")
public class CartController {

    private static final Logger logger = LoggerFactory.getLogger(CartController.class);

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    @GetMapping("/cart")
    public ResponseEntity<CartResponse> viewCart(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(CartResponse.fromSnapshot(cartService.view(userId)));
    }

    /**
     * Add an item to the caller's cart, merging with an existing line.
     * Does not reserve stock; the quantity is only checked against what is currently for sale.
     */
    @PostMapping("/cart/items")
    public ResponseEntity<CartResponse> addToCart(
            @Valid @RequestBody AddToCartRequest request,
            @RequestHeader(RequestHeaders.USER_ID) String userId
    ) {
        logger.debug("User {} adding {} x {}", userId, request.getQuantity(), request.getItemId());
        return ResponseEntity.ok(CartResponse.fromSnapshot(
                cartService.addItem(userId, request.getItemId(), request.getQuantity())));
    }

    /**
     * Remove some or all of a line. Without a quantity the whole line goes.
     */
    @DeleteMapping("/cart/items/{itemId}")
    public ResponseEntity<CartResponse> removeFromCart(
            @PathVariable String itemId,
            @RequestParam(required = false) Integer quantity,
            @RequestHeader(RequestHeaders.USER_ID) String userId
    ) {
        return ResponseEntity.ok(CartResponse.fromSnapshot(cartService.removeItem(userId, itemId, quantity)));
    }

    @DeleteMapping("/cart")
    public ResponseEntity<Void> clearCart(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        cartService.clear(userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/carts")
    public ResponseEntity<List<CartResponse>> listCarts(@RequestHeader(RequestHeaders.STAFF_ID) String staffId) {
        List<CartResponse> carts = cartService.listCarts()
                .stream()
                .map(CartResponse::fromSnapshot)
                .collect(Collectors.toList());
        return ResponseEntity.ok(carts);
    }

    @DeleteMapping("/carts")
    public ResponseEntity<Map<String, Object>> wipeAllCarts(@RequestHeader(RequestHeaders.STAFF_ID) String staffId) {
        int wiped = cartService.wipeAll(staffId);
        return ResponseEntity.ok(Map.of("wipedCarts", wiped));
    }
}
