package com.shopfront.productservice.security;

import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Hashes registration passwords and checks login attempts against the stored hash.
 * Backed by the bcrypt {@link PasswordEncoder} from SecurityConfig.
 */
@Component
@RequiredArgsConstructor
public class CredentialService {

    private final PasswordEncoder passwordEncoder;

    // salted: two calls with the same plaintext give different hashes
    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null) {
            return false;
        }
        // BCryptPasswordEncoder answers false (and logs) for hashes it can't parse
        return passwordEncoder.matches(plaintext, hash);
    }
}
