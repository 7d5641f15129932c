package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.storefront.domain.model.Item;
import com.cred.freestyle.storefront.domain.model.Item.ItemStatus;
import com.cred.freestyle.storefront.domain.model.Item.StockVisibility;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.service.CatalogService;
import com.cred.freestyle.storefront.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for CatalogController using MockMvc.
 */
@WebMvcTest(CatalogController.class)
@ContextConfiguration(classes = {CatalogController.class, GlobalExceptionHandler.class})
@DisplayName("CatalogController Tests")
class CatalogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CatalogService catalogService;

    @MockBean
    private StorefrontMetricsService metricsService;

    private Item item(String itemId, int available, int reserved) {
        Item item = TestDataBuilder.item().name("Hoodie").priceMinor(4_500L)
                .quantityAvailable(available).quantityReserved(reserved).build();
        item.setItemId(itemId);
        return item;
    }

    @Test
    @DisplayName("POST /items - Valid request returns 201 with the created item")
    void createItem_Valid_Returns201() throws Exception {
        // Given
        when(catalogService.createItem(any(CatalogService.ItemDetails.class), eq("staff-1")))
                .thenReturn(item("item-1", 10, 0));

        // When / Then
        mockMvc.perform(post("/api/v1/items")
                        .header("X-Staff-Id", "staff-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Hoodie", "priceMinor": 4500, "quantity": 10}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.itemId").value("item-1"))
                .andExpect(jsonPath("$.priceMinor").value(4500))
                .andExpect(jsonPath("$.availableForSale").value(10))
                .andExpect(jsonPath("$.inStock").value(true));
    }

    @Test
    @DisplayName("POST /items - Negative price returns 400 without touching the catalog")
    void createItem_NegativePrice_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/items")
                        .header("X-Staff-Id", "staff-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Hoodie", "priceMinor": -5}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.priceMinor").exists());

        verifyNoInteractions(catalogService);
    }

    @Test
    @DisplayName("POST /items - Missing staff header returns 400")
    void createItem_NoStaffHeader_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Hoodie", "priceMinor": 4500}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(catalogService);
    }

    @Test
    @DisplayName("GET /items/{id} - Available for sale excludes reserved units")
    void getItem_ShowsAvailableForSale() throws Exception {
        when(catalogService.getItem("item-1")).thenReturn(item("item-1", 5, 3));

        mockMvc.perform(get("/api/v1/items/item-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.availableForSale").value(2))
                .andExpect(jsonPath("$.stockVisibility").value("EXACT"));
    }

    @Test
    @DisplayName("GET /items/{id} - Binary visibility omits the count and shows in/out only")
    void getItem_BinaryStock_OmitsCount() throws Exception {
        Item binary = item("item-1", 5, 0);
        binary.setStockVisibility(StockVisibility.BINARY);
        when(catalogService.getItem("item-1")).thenReturn(binary);

        mockMvc.perform(get("/api/v1/items/item-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.availableForSale").doesNotExist())
                .andExpect(jsonPath("$.inStock").value(true))
                .andExpect(jsonPath("$.stockVisibility").value("BINARY"));
    }

    @Test
    @DisplayName("GET /items/{id} - Unknown item returns 404")
    void getItem_Unknown_Returns404() throws Exception {
        when(catalogService.getItem("missing")).thenThrow(new ResourceNotFoundException("Item", "missing"));

        mockMvc.perform(get("/api/v1/items/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /items - Lists the public catalog")
    void listItems_ReturnsCatalog() throws Exception {
        when(catalogService.listItems(false)).thenReturn(List.of(item("item-1", 5, 0), item("item-2", 1, 1)));

        mockMvc.perform(get("/api/v1/items"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].inStock").value(false));
    }

    @Test
    @DisplayName("POST /items/{id}/restock - Zero quantity returns 400")
    void restock_ZeroQuantity_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/items/item-1/restock")
                        .header("X-Staff-Id", "staff-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"quantity": 0}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(catalogService);
    }

    @Test
    @DisplayName("POST /items/{id}/restock - Adds stock")
    void restock_Valid_Returns200() throws Exception {
        when(catalogService.restock("item-1", 5, "staff-1")).thenReturn(item("item-1", 15, 0));

        mockMvc.perform(post("/api/v1/items/item-1/restock")
                        .header("X-Staff-Id", "staff-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"quantity": 5}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.availableForSale").value(15));
    }

    @Test
    @DisplayName("DELETE /items/{id} - Removes the item from sale")
    void removeItem_Returns200() throws Exception {
        Item removed = item("item-1", 5, 0);
        removed.setStatus(ItemStatus.REMOVED);
        when(catalogService.removeItem("item-1", "staff-1")).thenReturn(removed);

        mockMvc.perform(delete("/api/v1/items/item-1").header("X-Staff-Id", "staff-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REMOVED"));
    }

    @Test
    @DisplayName("GET /items/export - Returns the inventory as a CSV attachment")
    void exportInventoryCsv_ReturnsCsv() throws Exception {
        when(catalogService.exportInventoryCsv()).thenReturn("itemId,name\nitem-1,Hoodie\n");

        mockMvc.perform(get("/api/v1/items/export").header("X-Staff-Id", "staff-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"inventory.csv\""))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(startsWith("itemId,name")));

        verify(catalogService, never()).getItem(anyString());
    }
}
