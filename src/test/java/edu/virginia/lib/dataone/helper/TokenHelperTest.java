package edu.virginia.lib.dataone.helper;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.Test;

public class TokenHelperTest {

    private static String token(String claims) {
        Base64.Encoder e = Base64.getUrlEncoder().withoutPadding();
        return e.encodeToString("{\"alg\":\"RS256\"}".getBytes(StandardCharsets.UTF_8)) + "."
                + e.encodeToString(claims.getBytes(StandardCharsets.UTF_8)) + ".signature";
    }

    @Test
    public void comparesExpirationClaimWithNow() {
        final String token = token("{\"sub\":\"CN=me\",\"exp\":1600000000}");

        assertThat(TokenHelper.isExpired(token, 1599999999000L)).isFalse();
        assertThat(TokenHelper.isExpired(token, 1600000000000L)).isTrue();
    }

    @Test
    public void unusableTokensAreExpired() {
        assertThat(TokenHelper.isExpired(null, 0)).isTrue();
        assertThat(TokenHelper.isExpired("  ", 0)).isTrue();
        assertThat(TokenHelper.isExpired("not-a-jwt", 0)).isTrue();
        assertThat(TokenHelper.isExpired("a.!!!.c", 0)).isTrue();
        assertThat(TokenHelper.isExpired(token("{\"sub\":\"CN=me\"}"), 0)).isTrue();
        assertThat(TokenHelper.isExpired(token("[1,2]"), 0)).isTrue();
    }
}
