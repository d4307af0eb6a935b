package com.sendseven.passkeyauth.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TokenResponseTest {

    @Test
    void toString_printsNoTokenMaterial() {
        TokenResponse tokens = new TokenResponse();
        tokens.setAccessToken("eyJhbGciOiJSUzI1NiJ9.access");
        tokens.setIdToken("eyJraWQiOiJrMSJ9.identity");
        tokens.setTokenType("Bearer");

        String printed = tokens.toString();

        assertThat(printed)
                .doesNotContain("eyJ")
                .contains("hasAccessToken=true")
                .contains("hasIdToken=true")
                .contains("Bearer");
    }

    @Test
    void toString_withoutTokens_reportsAbsence() {
        assertThat(new TokenResponse().toString())
                .contains("hasAccessToken=false")
                .contains("hasIdToken=false");
    }
}
