package com.stationery.tracker.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RetailLineRequest.class, name = "RETAIL"),
        @JsonSubTypes.Type(value = WholesaleLineRequest.class, name = "WHOLESALE")
})
public interface LineItemRequest {

    int quantity();

    // null uses the stock record's selling price
    BigDecimal unitPrice();
}
