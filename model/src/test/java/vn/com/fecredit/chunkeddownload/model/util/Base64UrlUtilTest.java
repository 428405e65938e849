package vn.com.fecredit.chunkeddownload.model.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class Base64UrlUtilTest {

    @Test
    void testDecodeUnpaddedUrlAlphabet() {
        // 0xfb 0xff encodes to "-_8" in the url alphabet, "+/8=" in the standard one
        byte[] decoded = Base64UrlUtil.decode("-_8");
        assertArrayEquals(new byte[]{(byte) 0xfb, (byte) 0xff}, decoded);
    }

    @Test
    void testDecodeAcceptsPadding() {
        assertArrayEquals("ab".getBytes(StandardCharsets.US_ASCII), Base64UrlUtil.decode("YWI="));
        assertArrayEquals("ab".getBytes(StandardCharsets.US_ASCII), Base64UrlUtil.decode("YWI"));
    }

    @Test
    void testEncodeOmitsPadding() {
        assertEquals("YWI", Base64UrlUtil.encode("ab".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("", Base64UrlUtil.encode(new byte[0]));
    }

    @Test
    void testDecodeRejectsNullAndStandardAlphabet() {
        assertThrows(IllegalArgumentException.class, () -> Base64UrlUtil.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Base64UrlUtil.decode("+/8"));
    }
}
