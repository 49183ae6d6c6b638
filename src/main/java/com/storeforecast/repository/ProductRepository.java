package com.storeforecast.repository;

import com.storeforecast.entity.Product;
import com.storeforecast.model.ProductSales;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface ProductRepository extends JpaRepository<Product, Long> {

    @Query("""
        SELECT new com.storeforecast.model.ProductSales(
            p.id, p.name, p.category, p.stock, COALESCE(SUM(t.quantity), 0L))
        FROM Product p
        LEFT JOIN TransactionItem t ON t.productId = p.id AND t.soldOn >= :since
        GROUP BY p.id, p.name, p.category, p.stock
        ORDER BY COALESCE(SUM(t.quantity), 0L) DESC, p.name ASC
    """)
    List<ProductSales> findTopSellersSince(@Param("since") LocalDate since, Pageable pageable);
}
