package com.stationery.tracker.controller;

import com.stationery.tracker.dto.RestoredStock;
import com.stationery.tracker.dto.RetailLineRequest;
import com.stationery.tracker.dto.SaleDeletionResult;
import com.stationery.tracker.dto.SaleResponse;
import com.stationery.tracker.exception.InsufficientStockException;
import com.stationery.tracker.exception.NotFoundException;
import com.stationery.tracker.model.*;
import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.AuditService;
import com.stationery.tracker.service.SalesService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class SalesControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SalesService salesService;
    @MockBean
    private AuditService auditService;

    private SaleResponse responseFor(Sale sale) {
        return new SaleResponse(sale.getId(), Instant.parse("2024-03-10T08:00:00Z"), null, "Walk-in",
                new BigDecimal("1000.00"), PaymentMethod.CASH, true, null, SaleKind.NORMAL, null, "user",
                List.of(), new BigDecimal("400.00"));
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void addItem_ShouldReturnReloadedSale() throws Exception {
        Sale sale = new Sale();
        sale.setId(1L);
        when(salesService.getSale(1L)).thenReturn(sale);
        when(salesService.toResponse(sale)).thenReturn(responseFor(sale));

        mockMvc.perform(post("/api/sales/1/items")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"RETAIL\",\"itemId\":10,\"quantity\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.totalAmount").value(1000.00))
                .andExpect(jsonPath("$.profit").value(400.00));

        verify(salesService).addLineItem(eq(1L), eq(new RetailLineRequest(10L, 2, null)),
                eq(new Actor(null, "user")));
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void addItem_InsufficientStock_ShouldReturnConflictWithDetails() throws Exception {
        when(salesService.addLineItem(eq(1L), any(), any()))
                .thenThrow(new InsufficientStockException("Blue Pen", 3, 5));

        mockMvc.perform(post("/api/sales/1/items")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"RETAIL\",\"itemId\":10,\"quantity\":5}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.itemName").value("Blue Pen"))
                .andExpect(jsonPath("$.details.available").value(3))
                .andExpect(jsonPath("$.details.requested").value(5));
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void addItem_ZeroQuantity_ShouldFailValidation() throws Exception {
        mockMvc.perform(post("/api/sales/1/items")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"WHOLESALE\",\"productId\":4,\"quantity\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.quantity").exists());

        verify(salesService, never()).addLineItem(any(), any(), any());
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void addItem_UnknownType_ShouldBeMalformed() throws Exception {
        mockMvc.perform(post("/api/sales/1/items")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"SERVICE\",\"quantity\":1}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void get_MissingSale_ShouldReturnNotFound() throws Exception {
        when(salesService.getSale(99L)).thenThrow(new NotFoundException("Sale", 99L));

        mockMvc.perform(get("/api/sales/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Sale with ID 99 not found"));
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void delete_ShouldReportRestoredStock() throws Exception {
        when(salesService.deleteSale(eq(5L), any())).thenReturn(new SaleDeletionResult(List.of(5L),
                List.of(new RestoredStock(LineItemType.RETAIL, 10L, "Blue Pen", 2, "units"))));

        mockMvc.perform(delete("/api/sales/5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletedSaleIds[0]").value(5))
                .andExpect(jsonPath("$.restoredStock[0].quantity").value(2));
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void bulkDelete_EmptySelection_ShouldFailValidation() throws Exception {
        mockMvc.perform(post("/api/sales/bulk-delete")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"saleIds\":[]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(salesService);
    }

    @Test
    void anonymousRequest_ShouldBeUnauthorized() throws Exception {
        mockMvc.perform(get("/api/sales"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void adminSettings_AsStaff_ShouldBeForbidden() throws Exception {
        mockMvc.perform(get("/api/admin/settings"))
                .andExpect(status().isForbidden());
    }
}
