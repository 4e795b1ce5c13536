package com.shopfront.productservice.repository;

import com.shopfront.productservice.model.Product;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProductRepository extends JpaRepository<Product, Long> {

    // insertion order, seller fetched in the same query for the display form
    @EntityGraph(attributePaths = "seller")
    List<Product> findAllByOrderByIdAsc();
}
