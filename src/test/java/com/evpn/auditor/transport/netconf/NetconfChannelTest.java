package com.evpn.auditor.transport.netconf;

import com.evpn.auditor.transport.OperationResult;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NetconfChannelTest {

    private static final Duration HELLO_TIMEOUT = Duration.ofSeconds(5);

    private static final String NS = "urn:ietf:params:xml:ns:netconf:base:1.0";

    private static final String SERVER_HELLO =
        "<hello xmlns=\"" + NS + "\"><capabilities>"
            + "<capability>urn:ietf:params:netconf:base:1.0</capability>"
            + "<capability>http://xml.juniper.net/netconf/junos/1.0</capability>"
            + "</capabilities><session-id>42</session-id></hello>";

    private static final String EVPN_REPLY =
        "<rpc-reply xmlns=\"" + NS + "\" xmlns:junos=\"http://xml.juniper.net/junos/21.4R0/junos\" message-id=\"1\">"
            + "<evpn-ip-prefix-database-information xmlns=\"http://xml.juniper.net/junos/21.4R0/junos-routing\">"
            + "<evpn-ip-prefix-database-instance><evpn-ip-prefix-database-entry>"
            + "<adv-ip-route-status>Accepted</adv-ip-route-status>"
            + "<adv-ip-route-status>Rejected</adv-ip-route-status>"
            + "</evpn-ip-prefix-database-entry><evpn-ip-prefix-database-entry>"
            + "<adv-ip-route-status>\n  Rejected\n</adv-ip-route-status>"
            + "</evpn-ip-prefix-database-entry></evpn-ip-prefix-database-instance>"
            + "</evpn-ip-prefix-database-information></rpc-reply>";

    private static final String OK_REPLY = "<rpc-reply xmlns=\"" + NS + "\" message-id=\"2\"><ok/></rpc-reply>";

    private static final String ERROR_REPLY =
        "<rpc-reply xmlns=\"" + NS + "\" message-id=\"1\"><rpc-error>"
            + "<error-type>protocol</error-type><error-severity>error</error-severity>"
            + "<error-message>syntax error</error-message></rpc-error></rpc-reply>";

    private static final String WARNING_REPLY =
        "<rpc-reply xmlns=\"" + NS + "\" message-id=\"1\"><rpc-error>"
            + "<error-severity>warning</error-severity><error-message>statement deprecated</error-message>"
            + "</rpc-error><ok/></rpc-reply>";

    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private final AtomicInteger released = new AtomicInteger();

    private NetconfChannel channel(String... serverMessages) {
        StringBuilder raw = new StringBuilder();
        for (String message : serverMessages) {
            raw.append(message).append(NetconfFraming.END_OF_MESSAGE);
        }
        return new NetconfChannel("10.0.0.1",
            new ByteArrayInputStream(raw.toString().getBytes(StandardCharsets.UTF_8)),
            written, released::incrementAndGet);
    }

    private String sent() {
        return written.toString(StandardCharsets.UTF_8);
    }

    @Test
    void helloExchangeSendsClientCapabilities() throws IOException {
        NetconfChannel channel = channel(SERVER_HELLO);

        channel.exchangeHello(HELLO_TIMEOUT);

        assertTrue(sent().contains("<capability>urn:ietf:params:netconf:base:1.0</capability>"));
        assertTrue(sent().endsWith(NetconfFraming.END_OF_MESSAGE));
    }

    @Test
    void helloWithoutBaseCapabilityIsRejected() {
        NetconfChannel channel = channel("<hello xmlns=\"" + NS + "\"><capabilities>"
            + "<capability>urn:example:other</capability></capabilities></hello>");

        assertThrows(IOException.class, () -> channel.exchangeHello(HELLO_TIMEOUT));
    }

    @Test
    void nonHelloGreetingIsRejected() {
        NetconfChannel channel = channel(OK_REPLY);

        assertThrows(IOException.class, () -> channel.exchangeHello(HELLO_TIMEOUT));
    }

    @Test
    void silentServerFailsHelloWithinConnectTimeout() {
        CountDownLatch unblock = new CountDownLatch(1);
        InputStream silent = new InputStream() {
            @Override
            public int read() throws IOException {
                try {
                    unblock.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return -1;
            }
        };
        NetconfChannel channel = new NetconfChannel("10.0.0.1", silent, written, released::incrementAndGet);

        long started = System.nanoTime();
        try {
            IOException error = assertThrows(IOException.class, () -> channel.exchangeHello(Duration.ofMillis(300)));
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

            assertTrue(error.getMessage().contains("hello"), error.getMessage());
            assertTrue(elapsedMillis < 5_000, "Ожидание hello превысило таймаут подключения: " + elapsedMillis + " мс");
            assertEquals("", sent(), "Клиентский hello не должен отправляться");
        } finally {
            unblock.countDown();
        }
    }

    @Test
    void queryCollectsEveryStatusElement() throws IOException {
        NetconfChannel channel = channel(SERVER_HELLO, EVPN_REPLY);
        channel.exchangeHello(HELLO_TIMEOUT);

        OperationResult<List<String>> result = channel.queryRouteStatuses();

        assertTrue(result.isSuccess());
        List<String> tokens = ((OperationResult.Success<List<String>>) result).value();
        assertEquals(3, tokens.size());
        assertEquals("Rejected", tokens.get(2).trim());
        assertTrue(sent().contains("<get-evpn-ip-prefix-database-information/>"));
        assertTrue(sent().contains("message-id=\"1\""));
    }

    @Test
    void rpcErrorBecomesFailure() {
        OperationResult<List<String>> result = channel(ERROR_REPLY).queryRouteStatuses();

        assertFalse(result.isSuccess());
        assertTrue(((OperationResult.Failure<List<String>>) result).reason().contains("syntax error"));
    }

    @Test
    void warningsDoNotFailRpc() {
        assertTrue(channel(WARNING_REPLY).restartRouting().isSuccess());
    }

    @Test
    void restartSendsRestartRpc() {
        NetconfChannel channel = channel(OK_REPLY);

        assertTrue(channel.restartRouting().isSuccess());
        assertTrue(sent().contains("<restart-routing-process/>"));
    }

    @Test
    void truncatedReplyIsFailureWithCause() {
        OperationResult<List<String>> result = channel().queryRouteStatuses();

        assertFalse(result.isSuccess());
        assertNotNull(((OperationResult.Failure<List<String>>) result).cause());
    }

    @Test
    void closeSendsCloseSessionAndReleasesOnce() {
        NetconfChannel channel = channel();

        channel.close();
        channel.close();

        assertFalse(channel.isOpen());
        assertEquals(1, released.get());
        assertTrue(sent().contains("<close-session/>"));
        assertFalse(channel.restartRouting().isSuccess(), "После close RPC невозможен");
    }
}
