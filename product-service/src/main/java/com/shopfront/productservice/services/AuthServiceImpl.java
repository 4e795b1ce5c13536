package com.shopfront.productservice.services;

import com.shopfront.productservice.dto.LoginRequest;
import com.shopfront.productservice.dto.TokenResponse;
import com.shopfront.productservice.exception.InvalidCredentialsException;
import com.shopfront.productservice.model.Seller;
import com.shopfront.productservice.repository.SellerRepository;
import com.shopfront.productservice.security.CredentialService;
import com.shopfront.productservice.security.TokenService;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Password login for sellers.
 *
 * Unknown usernames and wrong passwords are reported with different
 * messages ("Invalid user" / "Invalid password"); clients rely on that.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthServiceImpl implements AuthService {

    private final SellerRepository sellerRepository;
    private final CredentialService credentialService;
    private final TokenService tokenService;

    @Override
    @Transactional
    public TokenResponse login(LoginRequest request) {
        Seller seller = sellerRepository.findByUsername(request.getUsername())
                .orElseThrow(() -> {
                    log.warn("Login rejected: unknown username '{}'", request.getUsername());
                    return new InvalidCredentialsException("Invalid user");
                });

        if (!credentialService.verify(request.getPassword(), seller.getPassword())) {
            log.warn("Login rejected: wrong password for seller id={}", seller.getId());
            throw new InvalidCredentialsException("Invalid password");
        }

        String accessToken = tokenService.issue(seller.getUsername());
        log.info("Seller authenticated: id={}, username='{}'", seller.getId(), seller.getUsername());

        return TokenResponse.bearer(accessToken);
    }
}
