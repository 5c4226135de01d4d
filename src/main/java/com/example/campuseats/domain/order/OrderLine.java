package com.example.campuseats.domain.order;

import java.math.BigDecimal;

public record OrderLine(
	String name,
	BigDecimal unitPrice,
	int quantity
) {
	public OrderLine {
		if (quantity < 1) {
			throw new IllegalArgumentException("quantity must be at least 1");
		}
	}

	public BigDecimal lineTotal() {
		return unitPrice.multiply(BigDecimal.valueOf(quantity));
	}

	OrderLine plus(int extra) {
		return new OrderLine(name, unitPrice, quantity + extra);
	}
}
