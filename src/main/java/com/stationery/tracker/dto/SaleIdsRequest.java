package com.stationery.tracker.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record SaleIdsRequest(@NotEmpty List<Long> saleIds) {
}
