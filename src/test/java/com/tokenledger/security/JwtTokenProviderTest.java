package com.tokenledger.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JwtTokenProviderTest {

    private JwtTokenProvider provider;

    @BeforeEach
    void setUp() {
        provider = new JwtTokenProvider(
            "test-secret-key-that-is-long-enough!!", 3_600_000L);
    }

    @Test @DisplayName("generateToken → isValid returns true")
    void generateAndValidate() {
        String token = provider.generateToken("user-1");
        assertThat(provider.isValid(token)).isTrue();
    }

    @Test @DisplayName("extractUserId returns the subject")
    void extractUserId() {
        String token = provider.generateToken("alice-42");
        assertThat(provider.extractUserId(token)).isEqualTo("alice-42");
    }

    @Test @DisplayName("tampered token → isValid returns false")
    void tamperedToken() {
        String token = provider.generateToken("user-1");
        assertThat(provider.isValid(token + "x")).isFalse();
    }

    @Test @DisplayName("token signed with another secret → isValid returns false")
    void foreignSecret() {
        var other = new JwtTokenProvider("another-secret-key-that-is-long-enough", 3_600_000L);
        assertThat(provider.isValid(other.generateToken("user-1"))).isFalse();
    }

    @Test @DisplayName("null token → isValid returns false")
    void nullToken() {
        assertThat(provider.isValid(null)).isFalse();
    }

    @Test @DisplayName("expired token → isValid returns false")
    void expiredToken() {
        var expired = new JwtTokenProvider("test-secret-key-that-is-long-enough!!", -1L);
        String token = expired.generateToken("user-1");
        assertThat(expired.isValid(token)).isFalse();
    }

    @Test @DisplayName("blank user id → IllegalArgumentException")
    void blankUserId() {
        assertThatThrownBy(() -> provider.generateToken(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test @DisplayName("short secret < 32 chars → IllegalStateException on construction")
    void shortSecret() {
        assertThatThrownBy(() -> new JwtTokenProvider("tooshort", 3600L))
            .isInstanceOf(IllegalStateException.class);
    }
}
