package com.shopfront.productservice.security;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BearerTokenFilter Unit Tests")
class BearerTokenFilterTest {

    @Mock
    private TokenService tokenService;
    @Mock
    private FilterChain chain;

    private BearerTokenFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        filter = new BearerTokenFilter(tokenService);
        request = new MockHttpServletRequest("GET", "/products");
        response = new MockHttpServletResponse();
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("should authenticate the token subject and continue the chain")
    void shouldAuthenticateValidToken() throws Exception {
        // Arrange
        request.addHeader("Authorization", "Bearer good-token");
        when(tokenService.validate("good-token")).thenReturn("alice");

        // Act
        filter.doFilter(request, response, chain);

        // Assert
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getName()).isEqualTo("alice");
        assertThat(authentication.getAuthorities()).extracting("authority").containsExactly("ROLE_SELLER");
        verify(chain).doFilter(request, response);
    }

    @Test
    @DisplayName("should leave the request anonymous when the token is rejected")
    void shouldStayAnonymousForRejectedToken() throws Exception {
        // Arrange
        request.addHeader("Authorization", "Bearer expired-token");
        when(tokenService.validate("expired-token"))
                .thenThrow(new TokenValidationException(TokenError.EXPIRED, "Token has expired"));

        // Act
        filter.doFilter(request, response, chain);

        // Assert
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(response.getStatus()).isEqualTo(200);
        verify(chain).doFilter(request, response);
    }

    @Test
    @DisplayName("should not touch the token service without a bearer header")
    void shouldIgnoreRequestsWithoutBearerHeader() throws Exception {
        // Arrange
        request.addHeader("Authorization", "Basic YWxpY2U6c2VjcmV0");

        // Act
        filter.doFilter(request, response, chain);

        // Assert
        verifyNoInteractions(tokenService);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verify(chain).doFilter(request, response);
    }
}
