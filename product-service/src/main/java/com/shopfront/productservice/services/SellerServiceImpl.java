package com.shopfront.productservice.services;

import com.shopfront.common.exception.DuplicateResourceException;
import com.shopfront.productservice.dto.SellerRequest;
import com.shopfront.productservice.dto.SellerResponse;
import com.shopfront.productservice.mapper.SellerMapper;
import com.shopfront.productservice.model.Seller;
import com.shopfront.productservice.repository.SellerRepository;
import com.shopfront.productservice.security.CredentialService;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class SellerServiceImpl implements SellerService {

    private final SellerRepository sellerRepository;
    private final SellerMapper sellerMapper;
    private final CredentialService credentialService;

    @Override
    @Transactional
    public SellerResponse registerSeller(SellerRequest request) {
        // the unique constraint still backs this up when two registrations race
        if (sellerRepository.existsByUsername(request.getUsername())) {
            log.warn("Registration rejected: username '{}' is already taken", request.getUsername());
            throw new DuplicateResourceException(
                    "Seller with username '" + request.getUsername() + "' already exists");
        }

        Seller seller = sellerMapper.toSeller(request);
        seller.setPassword(credentialService.hash(request.getPassword()));

        Seller savedSeller = sellerRepository.save(seller);

        log.info("Seller registered: id={}, username='{}'", savedSeller.getId(), savedSeller.getUsername());

        // Full record, hash included
        return sellerMapper.toSellerResponse(savedSeller);
    }
}
