package com.orderly.orderservice.repository;

import com.orderly.orderservice.model.Order;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    @EntityGraph(attributePaths = "items")
    Optional<Order> findByOrderCode(String orderCode);

    @EntityGraph(attributePaths = "items")
    Optional<Order> findWithItemsById(UUID id);

    boolean existsByOrderCode(String orderCode);

    // one page of ids, most recently updated first
    @Query(value = "SELECT id FROM orders ORDER BY updated_at DESC, id LIMIT :limit OFFSET :skip", nativeQuery = true)
    List<UUID> findPageIds(@Param("skip") int skip, @Param("limit") int limit);

    // loads orders and their items in one query (avoids N+1)
    @EntityGraph(attributePaths = "items")
    List<Order> findAllByIdIn(Collection<UUID> ids);
}
