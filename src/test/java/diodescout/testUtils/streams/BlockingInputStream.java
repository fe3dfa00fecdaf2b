package diodescout.testUtils.streams;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.concurrent.CountDownLatch;

/**
 * Serves the given bytes, then blocks like an idle serial port until it is closed.
 */
public class BlockingInputStream extends InputStream {
    private final byte[] data;
    private final CountDownLatch closed = new CountDownLatch(1);
    private int position = 0;

    public BlockingInputStream(byte[] data) {
        this.data = data;
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int n = this.read(single, 0, 1);
        return n == -1 ? -1 : single[0] & 0xFF;
    }

    @Override
    public synchronized int read(byte[] b, int off, int len) throws IOException {
        if (position < data.length) {
            int n = Math.min(len, data.length - position);
            System.arraycopy(data, position, b, off, n);
            position += n;
            return n;
        }

        try {
            closed.await();
        } catch (InterruptedException e) {
            throw new InterruptedIOException();
        }
        throw new IOException("Stream closed");
    }

    @Override
    public void close() {
        closed.countDown();
    }
}
