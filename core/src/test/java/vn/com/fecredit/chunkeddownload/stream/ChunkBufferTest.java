package vn.com.fecredit.chunkeddownload.stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import vn.com.fecredit.chunkeddownload.core.exception.InsufficientBufferException;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ChunkBufferTest {

    private ChunkBuffer chunkBuffer;
    private byte[] data;

    @BeforeEach
    void setUp() {
        chunkBuffer = new ChunkBuffer();
        data = new byte[32];
        new Random(32).nextBytes(data);
    }

    @Test
    void testChunkSingleBuffer() {
        chunkBuffer.push(data);

        assertArrayEquals(Arrays.copyOfRange(data, 0, 8), chunkBuffer.pop(8));
        assertArrayEquals(Arrays.copyOfRange(data, 8, 16), chunkBuffer.pop(8));
        assertArrayEquals(Arrays.copyOfRange(data, 16, 32), chunkBuffer.pop(16));
        assertArrayEquals(new byte[0], chunkBuffer.flush());
    }

    @Test
    void testChunkMultipleAlignedBuffers() {
        chunkBuffer.push(Arrays.copyOfRange(data, 0, 16));
        chunkBuffer.push(Arrays.copyOfRange(data, 16, 32));

        assertArrayEquals(Arrays.copyOfRange(data, 0, 16), chunkBuffer.pop(16));
        assertArrayEquals(Arrays.copyOfRange(data, 16, 32), chunkBuffer.pop(16));
        assertArrayEquals(new byte[0], chunkBuffer.flush());
    }

    @Test
    void testChunkMultipleUnalignedBuffers() {
        chunkBuffer.push(Arrays.copyOfRange(data, 0, 16));
        chunkBuffer.push(Arrays.copyOfRange(data, 16, 32));

        assertArrayEquals(Arrays.copyOfRange(data, 0, 8), chunkBuffer.pop(8));
        assertArrayEquals(Arrays.copyOfRange(data, 8, 15), chunkBuffer.pop(7));
        assertArrayEquals(Arrays.copyOfRange(data, 15, 27), chunkBuffer.pop(12));
        assertEquals(5, chunkBuffer.length());
        assertArrayEquals(Arrays.copyOfRange(data, 27, 32), chunkBuffer.flush());
        assertTrue(chunkBuffer.isEmpty());
    }

    @Test
    void testPopMoreThanBufferedFailsWithoutConsuming() {
        chunkBuffer.push(Arrays.copyOfRange(data, 0, 10));
        chunkBuffer.push(Arrays.copyOfRange(data, 10, 20));
        chunkBuffer.pop(3);

        InsufficientBufferException ex = assertThrows(InsufficientBufferException.class, () -> chunkBuffer.pop(18));

        assertEquals(18, ex.getRequested());
        assertEquals(17, ex.getAvailable());
        assertEquals(17, chunkBuffer.length());
        assertArrayEquals(Arrays.copyOfRange(data, 3, 20), chunkBuffer.flush());
    }

    @Test
    void testEmptyBufferAndEmptySegments() {
        assertArrayEquals(new byte[0], chunkBuffer.flush());
        assertArrayEquals(new byte[0], chunkBuffer.pop(0));
        assertThrows(InsufficientBufferException.class, () -> chunkBuffer.pop(1));

        chunkBuffer.push(new byte[0]);
        chunkBuffer.push(Arrays.copyOfRange(data, 0, 4));
        chunkBuffer.push(new byte[0]);

        assertArrayEquals(Arrays.copyOfRange(data, 0, 4), chunkBuffer.pop(4));
        assertTrue(chunkBuffer.isEmpty());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> chunkBuffer.push(null));
        assertThrows(IllegalArgumentException.class, () -> chunkBuffer.pop(-1));
    }

    @Test
    void testRandomPushesAndPopsPreserveByteOrder() {
        Random random = new Random(2024);
        byte[] source = new byte[10_000];
        random.nextBytes(source);
        ByteArrayOutputStream popped = new ByteArrayOutputStream();

        int pushed = 0;
        while (pushed < source.length) {
            int len = Math.min(random.nextInt(700), source.length - pushed);
            chunkBuffer.push(Arrays.copyOfRange(source, pushed, pushed + len));
            pushed += len;
            int pop = random.nextInt(900);
            if (pop <= chunkBuffer.length()) {
                popped.writeBytes(chunkBuffer.pop(pop));
            }
        }
        popped.writeBytes(chunkBuffer.flush());

        assertArrayEquals(source, popped.toByteArray());
    }
}
