package com.evpn.auditor.transport.netconf;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Кадрирование сообщений NETCONF 1.0 (RFC 6242, end-of-message framing).
 * Каждое сообщение завершается последовательностью {@code ]]>]]>}.
 */
final class NetconfFraming {

    static final String END_OF_MESSAGE = "]]>]]>";

    private static final byte[] DELIMITER = END_OF_MESSAGE.getBytes(StandardCharsets.US_ASCII);

    private NetconfFraming() {
    }

    static void writeMessage(OutputStream out, String xml) throws IOException {
        out.write(xml.getBytes(StandardCharsets.UTF_8));
        out.write(DELIMITER);
        out.flush();
    }

    /**
     * Читает одно сообщение до разделителя (сам разделитель отбрасывается).
     *
     * @throws EOFException если поток закрылся до конца сообщения
     */
    static String readMessage(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(4096);
        byte[] tail = new byte[DELIMITER.length];
        long read = 0;
        while (true) {
            int next = in.read();
            if (next < 0) {
                throw new EOFException("Сессия NETCONF закрыта до конца сообщения (" + read + " байт прочитано)");
            }
            buffer.write(next);
            read++;
            System.arraycopy(tail, 1, tail, 0, tail.length - 1);
            tail[tail.length - 1] = (byte) next;
            if (read >= DELIMITER.length && Arrays.equals(tail, DELIMITER)) {
                byte[] bytes = buffer.toByteArray();
                return new String(bytes, 0, bytes.length - DELIMITER.length, StandardCharsets.UTF_8).trim();
            }
        }
    }
}
