package com.evpn.auditor.transport.netconf;

import com.evpn.auditor.transport.DeviceChannel;
import com.evpn.auditor.transport.OperationResult;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Сессия NETCONF поверх произвольной пары потоков.
 * Потоки и освобождение нижележащего SSH-соединения передаются извне, поэтому
 * канал можно проверять на потоках в памяти.
 */
@Slf4j
public class NetconfChannel implements DeviceChannel {

    private final String host;
    private final InputStream in;
    private final OutputStream out;
    private final Runnable releaser;

    private final AtomicInteger messageId = new AtomicInteger();
    private final AtomicBoolean open = new AtomicBoolean(true);

    NetconfChannel(String host, InputStream in, OutputStream out, Runnable releaser) {
        this.host = host;
        this.in = in;
        this.out = out;
        this.releaser = releaser;
    }

    /**
     * Обмен приветствиями: сервер присылает свой hello, клиент отвечает своим.
     * Hello является частью подключения и ограничен его таймаутом.
     */
    void exchangeHello(Duration timeout) throws IOException {
        String serverHello = awaitServerHello(timeout);
        Document hello = NetconfReplyParser.parse(serverHello);
        if (hello.getElementsByTagNameNS("*", "hello").getLength() == 0) {
            throw new IOException("Устройство " + host + " не прислало NETCONF hello");
        }
        List<String> capabilities = NetconfReplyParser.texts(hello, "capability");
        if (capabilities.stream().map(String::trim).noneMatch(JunosRpc.BASE_CAPABILITY::equals)) {
            throw new IOException("Устройство " + host + " не поддерживает " + JunosRpc.BASE_CAPABILITY);
        }
        log.debug("{}: сервер объявил {} capabilities", host, capabilities.size());
        NetconfFraming.writeMessage(out, JunosRpc.clientHello());
    }

    private String awaitServerHello(Duration timeout) throws IOException {
        CompletableFuture<String> greeting = CompletableFuture.supplyAsync(() -> {
            try {
                return NetconfFraming.readMessage(in);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        try {
            return greeting.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            greeting.cancel(true);
            throw new IOException("Устройство " + host + " не прислало NETCONF hello за " + timeout.toMillis() + " мс", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            throw new IOException("Ошибка чтения NETCONF hello от " + host, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Ожидание NETCONF hello от " + host + " прервано", e);
        }
    }

    @Override
    public OperationResult<List<String>> queryRouteStatuses() {
        return invoke(JunosRpc.EVPN_IP_PREFIX_DATABASE)
            .map(reply -> NetconfReplyParser.texts(reply, JunosRpc.ROUTE_STATUS_ELEMENT));
    }

    @Override
    public OperationResult<Void> restartRouting() {
        return invoke(JunosRpc.RESTART_ROUTING).map(reply -> null);
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    private synchronized OperationResult<Document> invoke(String operation) {
        if (!open.get()) {
            return OperationResult.failure("Сессия NETCONF с " + host + " уже закрыта");
        }
        int id = messageId.incrementAndGet();
        try {
            NetconfFraming.writeMessage(out, JunosRpc.rpc(id, operation));
            Document reply = NetconfReplyParser.parse(NetconfFraming.readMessage(in));
            List<String> errors = NetconfReplyParser.rpcErrors(reply);
            if (!errors.isEmpty()) {
                return OperationResult.failure("RPC " + operation + " завершился ошибкой: " + String.join("; ", errors));
            }
            return OperationResult.success(reply);
        } catch (IOException e) {
            return OperationResult.failure("Ошибка RPC " + operation, e);
        }
    }

    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        try {
            synchronized (this) {
                NetconfFraming.writeMessage(out, JunosRpc.rpc(messageId.incrementAndGet(), JunosRpc.CLOSE_SESSION));
            }
        } catch (IOException e) {
            log.debug("{}: close-session не отправлен: {}", host, e.getMessage());
        } finally {
            releaser.run();
        }
    }
}
