package vn.com.fecredit.chunkeddownload.model.util;

import java.util.Base64;

/**
 * Helpers for the unpadded base64url encoding the gateway uses for binary fields.
 */
public class Base64UrlUtil {

    private Base64UrlUtil() {
    }

    /**
     * Decodes a base64url string. Padding is accepted but not required.
     *
     * @param value the encoded value, may be empty
     * @return the decoded bytes
     * @throws IllegalArgumentException if the value is null or not valid base64url
     */
    public static byte[] decode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("base64url value must not be null");
        }
        return Base64.getUrlDecoder().decode(value);
    }

    /**
     * Encodes bytes as base64url without padding.
     */
    public static String encode(byte[] data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }
}
