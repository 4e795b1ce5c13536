package com.shopfront.productservice.service;

import com.shopfront.common.exception.DuplicateResourceException;
import com.shopfront.productservice.dto.SellerRequest;
import com.shopfront.productservice.dto.SellerResponse;
import com.shopfront.productservice.mapper.SellerMapper;
import com.shopfront.productservice.model.Seller;
import com.shopfront.productservice.repository.SellerRepository;
import com.shopfront.productservice.security.CredentialService;
import com.shopfront.productservice.services.SellerServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SellerService Unit Tests")
class SellerServiceImplTest {

    @Mock
    private SellerRepository sellerRepository;
    @Mock
    private SellerMapper sellerMapper;
    @Mock
    private CredentialService credentialService;

    @InjectMocks
    private SellerServiceImpl sellerService;

    private SellerRequest request;
    private Seller seller;

    @BeforeEach
    void setUp() {
        request = SellerRequest.builder()
                .username("alice")
                .email("a@x.com")
                .password("Secret123")
                .build();

        seller = new Seller();
        seller.setUsername("alice");
        seller.setEmail("a@x.com");
    }

    @Test
    @DisplayName("should store the hash, never the plaintext")
    void shouldStoreHashedPassword() {
        // Arrange
        when(sellerRepository.existsByUsername("alice")).thenReturn(false);
        when(sellerMapper.toSeller(request)).thenReturn(seller);
        when(credentialService.hash("Secret123")).thenReturn("$2a$10$hashed");
        when(sellerRepository.save(seller)).thenReturn(seller);
        when(sellerMapper.toSellerResponse(seller)).thenReturn(
                SellerResponse.builder().id(1L).username("alice").email("a@x.com").password("$2a$10$hashed").build());

        // Act
        SellerResponse result = sellerService.registerSeller(request);

        // Assert
        verify(sellerRepository).save(argThat(s -> "$2a$10$hashed".equals(s.getPassword())));
        assertThat(result.getPassword()).isEqualTo("$2a$10$hashed").isNotEqualTo("Secret123");
    }

    @Test
    @DisplayName("should reject a username that is already registered")
    void shouldRejectDuplicateUsername() {
        // Arrange
        when(sellerRepository.existsByUsername("alice")).thenReturn(true);

        // Act & Assert
        assertThatThrownBy(() -> sellerService.registerSeller(request))
                .isInstanceOf(DuplicateResourceException.class)
                .hasMessageContaining("alice");

        verify(sellerRepository, never()).save(any());
        verifyNoInteractions(credentialService);
    }
}
