package vn.com.fecredit.chunkeddownload.core.exception;

import java.math.BigInteger;

/**
 * The bytes yielded by a finished download do not add up to the declared size.
 */
public class SizeMismatchException extends ChunkedDownloadException {

    private final BigInteger expected;
    private final BigInteger actual;

    public SizeMismatchException(BigInteger expected, BigInteger actual) {
        super("Failed to download content: got " + actual + "B, expected " + expected + "B");
        this.expected = expected;
        this.actual = actual;
    }

    public BigInteger getExpected() {
        return expected;
    }

    public BigInteger getActual() {
        return actual;
    }
}
