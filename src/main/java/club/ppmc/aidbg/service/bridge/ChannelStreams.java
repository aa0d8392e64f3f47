/**
 * ChannelStreams.java
 *
 * 把通道的读写操作包装成 InputStream / OutputStream。
 * 与 Channels.newInputStream 不同，这里的读和写互不持有同一把锁，
 * 读取线程阻塞在 read 上时，命令线程仍然可以写入。
 */
package club.ppmc.aidbg.service.bridge;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

final class ChannelStreams {

    @FunctionalInterface
    interface ChunkReader {
        /** 读入 buffer，流结束时返回 -1。 */
        int read(ByteBuffer buffer) throws IOException;
    }

    @FunctionalInterface
    interface ChunkWriter {
        int write(ByteBuffer buffer) throws IOException;
    }

    private ChannelStreams() {}

    static InputStream input(ChunkReader reader) {
        return new InputStream() {
            @Override
            public int read() throws IOException {
                byte[] one = new byte[1];
                int n = read(one, 0, 1);
                return n <= 0 ? -1 : one[0] & 0xFF;
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                if (len == 0) {
                    return 0;
                }
                int n;
                do {
                    n = reader.read(ByteBuffer.wrap(b, off, len));
                } while (n == 0);
                return n;
            }
        };
    }

    static OutputStream output(ChunkWriter writer) {
        return new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                write(new byte[] {(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                ByteBuffer buffer = ByteBuffer.wrap(b, off, len);
                while (buffer.hasRemaining()) {
                    writer.write(buffer);
                }
            }
        };
    }
}
