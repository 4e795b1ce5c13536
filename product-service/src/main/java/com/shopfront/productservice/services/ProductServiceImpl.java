package com.shopfront.productservice.services;

import com.shopfront.common.exception.ResourceNotFoundException;
import com.shopfront.productservice.dto.MessageResponse;
import com.shopfront.productservice.dto.ProductDisplayResponse;
import com.shopfront.productservice.dto.ProductRequest;
import com.shopfront.productservice.dto.ProductResponse;
import com.shopfront.productservice.mapper.ProductMapper;
import com.shopfront.productservice.model.Product;
import com.shopfront.productservice.model.Seller;
import com.shopfront.productservice.repository.ProductRepository;
import com.shopfront.productservice.repository.SellerRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class ProductServiceImpl implements ProductService {

        private static final Logger log = LoggerFactory.getLogger(ProductServiceImpl.class);

        private final ProductRepository productRepository;
        private final SellerRepository sellerRepository;
        private final ProductMapper productMapper;

        @Override
        @Transactional
        public List<ProductDisplayResponse> getAllProducts() {
                return productRepository.findAllByOrderByIdAsc().stream()
                                .map(productMapper::toProductDisplayResponse)
                                .toList();
        }

        @Override
        @Transactional
        public ProductDisplayResponse getProductById(Long productId) {
                Product product = findProduct(productId);
                return productMapper.toProductDisplayResponse(product);
        }

        @Override
        @Transactional
        public ProductResponse createProduct(ProductRequest request) {
                Product product = productMapper.toProduct(request);

                // Seller association is optional
                if (request.getSellerId() != null) {
                        Seller seller = sellerRepository.findById(request.getSellerId())
                                        .orElseThrow(() -> {
                                                log.warn("Product rejected: seller {} does not exist", request.getSellerId());
                                                return new ResourceNotFoundException(
                                                                "Seller with id " + request.getSellerId() + " not found");
                                        });
                        product.setSeller(seller);
                }

                Product savedProduct = productRepository.save(product);

                log.info("Product created: id={}, name='{}', price={}, sellerId={}",
                                savedProduct.getId(), savedProduct.getName(), savedProduct.getPrice(),
                                request.getSellerId());

                return productMapper.toProductResponse(savedProduct);
        }

        @Override
        @Transactional
        public MessageResponse updateProduct(Long productId, ProductRequest request) {
                Product product = findProduct(productId);

                // Full replace of name, description, price; the seller stays as it was
                productMapper.updateProductFromRequest(request, product);

                Product updatedProduct = productRepository.save(product);

                log.info("Product updated: id={}, name='{}', price={}",
                                productId, updatedProduct.getName(), updatedProduct.getPrice());

                return MessageResponse.builder()
                                .message("Product: " + productId + " is successfully updated")
                                .id(productId)
                                .build();
        }

        @Override
        @Transactional
        public MessageResponse deleteProduct(Long productId) {
                Product product = findProduct(productId);

                String productName = product.getName();
                productRepository.delete(product);

                log.info("Product deleted: id={}, name='{}'", productId, productName);

                return MessageResponse.builder()
                                .message("Product deleted successfully")
                                .id(productId)
                                .build();
        }

        private Product findProduct(Long productId) {
                return productRepository.findById(productId)
                                .orElseThrow(() -> new ResourceNotFoundException(
                                                "Product with id " + productId + " not found"));
        }
}
