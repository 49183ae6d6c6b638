package com.storeforecast.model;

/** Units sold by a product over a recent window, with its current stock. */
public record ProductSales(Long productId, String name, String category, Integer stock, Long unitsSold) {
}
