package edu.virginia.lib.dataone.helper;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.json.Json;
import javax.json.JsonException;
import javax.json.JsonNumber;
import javax.json.JsonObject;
import javax.json.JsonReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the expiration time out of a DataONE authentication token (a JWT).
 */
public class TokenHelper {

    final private static Logger LOGGER = LoggerFactory.getLogger(TokenHelper.class);

    /**
     * Returns true if the token is missing, unreadable or past its "exp" claim.
     */
    public static boolean isExpired(final String token, final long nowMillis) {
        if (token == null || token.trim().length() == 0) {
            LOGGER.warn("No authentication token configured.");
            return true;
        }
        final String[] parts = token.trim().split("\\.");
        if (parts.length < 2) {
            LOGGER.warn("Authentication token is not a JWT.");
            return true;
        }
        try {
            final String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
            JsonReader reader = Json.createReader(new StringReader(payload));
            try {
                JsonObject claims = reader.readObject();
                JsonNumber exp = claims.getJsonNumber("exp");
                if (exp == null) {
                    LOGGER.warn("Authentication token has no expiration claim.");
                    return true;
                }
                return exp.longValue() * 1000 <= nowMillis;
            } finally {
                reader.close();
            }
        } catch (IllegalArgumentException ex) {
            LOGGER.warn("Unable to decode authentication token.", ex);
            return true;
        } catch (JsonException ex) {
            LOGGER.warn("Unable to parse authentication token.", ex);
            return true;
        } catch (ClassCastException ex) {
            LOGGER.warn("Authentication token has a malformed expiration claim.", ex);
            return true;
        }
    }
}
