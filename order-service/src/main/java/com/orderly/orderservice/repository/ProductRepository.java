package com.orderly.orderservice.repository;

import com.orderly.orderservice.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProductRepository extends JpaRepository<Product, String> {

    @Query(value = "SELECT * FROM products ORDER BY updated_at DESC, id LIMIT :limit OFFSET :skip", nativeQuery = true)
    List<Product> findPage(@Param("skip") int skip, @Param("limit") int limit);
}
