package com.tbmerch.backoffice.domain;

import java.math.BigDecimal;
import java.util.UUID;

public record SupplierRevenue(UUID supplierId, Long orderCount, BigDecimal revenue, Double averageOrderValue) {
}
