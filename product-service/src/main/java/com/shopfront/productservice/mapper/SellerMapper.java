package com.shopfront.productservice.mapper;

import com.shopfront.productservice.dto.SellerDisplayResponse;
import com.shopfront.productservice.dto.SellerRequest;
import com.shopfront.productservice.dto.SellerResponse;
import com.shopfront.productservice.model.Seller;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface SellerMapper {

    /**
     * Public summary of a seller: username and email only.
     */
    SellerDisplayResponse toSellerDisplayResponse(Seller seller);

    /**
     * The stored record, password hash included.
     */
    SellerResponse toSellerResponse(Seller seller);

    /**
     * The plaintext password is never copied; the service stores its hash instead.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "password", ignore = true)
    @Mapping(target = "products", ignore = true)
    Seller toSeller(SellerRequest request);
}
