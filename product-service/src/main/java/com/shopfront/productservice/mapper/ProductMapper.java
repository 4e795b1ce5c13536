package com.shopfront.productservice.mapper;

import com.shopfront.productservice.dto.ProductDisplayResponse;
import com.shopfront.productservice.dto.ProductRequest;
import com.shopfront.productservice.dto.ProductResponse;
import com.shopfront.productservice.model.Product;
import org.mapstruct.InjectionStrategy;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.ReportingPolicy;

@Mapper(
        componentModel = "spring",
        uses = SellerMapper.class,
        injectionStrategy = InjectionStrategy.CONSTRUCTOR,
        unmappedTargetPolicy = ReportingPolicy.IGNORE
)
public interface ProductMapper {

    /**
     * Converts the Product entity to its read-side form.
     * Price is not part of the target; the seller goes through
     * {@link SellerMapper#toSellerDisplayResponse}, so no hash can leak.
     */
    ProductDisplayResponse toProductDisplayResponse(Product product);

    /**
     * Converts the Product entity to the full form returned on creation.
     * Maps the ID of the 'seller' object to the 'sellerId' field.
     */
    @Mapping(source = "seller.id", target = "sellerId")
    ProductResponse toProductResponse(Product product);

    /**
     * Creates a new Product entity from a ProductRequest DTO.
     * The seller is resolved from its id in the service layer.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "seller", ignore = true)
    Product toProduct(ProductRequest request);

    /**
     * Replaces name, description and price of an existing Product.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "seller", ignore = true)
    void updateProductFromRequest(ProductRequest request, @MappingTarget Product product);
}
