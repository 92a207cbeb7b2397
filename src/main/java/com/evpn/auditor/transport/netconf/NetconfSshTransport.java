package com.evpn.auditor.transport.netconf;

import com.evpn.auditor.config.AuditorRules;
import com.evpn.auditor.models.DeviceDescriptor;
import com.evpn.auditor.transport.DeviceChannel;
import com.evpn.auditor.transport.DeviceTransport;
import com.evpn.auditor.transport.OperationResult;
import com.jcraft.jsch.ChannelSubsystem;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.Slf4jLogger;
import com.jcraft.jsch.UIKeyboardInteractive;
import com.jcraft.jsch.UserInfo;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;

/**
 * NETCONF поверх SSH (подсистема {@code netconf}) для устройств Junos.
 *
 * <p>На каждое подключение создаётся временный known_hosts файл, в который JSch
 * записывает ключ хоста. Файл удаляется при закрытии сессии и при сбое подключения.
 */
@Slf4j
public class NetconfSshTransport implements DeviceTransport {

    static {
        JSch.setLogger(new Slf4jLogger());
    }

    private final AuditorRules.Netconf settings;

    public NetconfSshTransport(AuditorRules.Netconf settings) {
        this.settings = settings != null ? settings : new AuditorRules.Netconf();
    }

    @Override
    public OperationResult<DeviceChannel> open(DeviceDescriptor descriptor, Duration connectTimeout) {
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, Math.max(1, connectTimeout.toMillis()));
        Path knownHosts = null;
        Session session = null;
        ChannelSubsystem channel = null;
        try {
            knownHosts = Files.createTempFile("evpn-known-hosts-", ".txt");

            JSch jsch = new JSch();
            jsch.setKnownHosts(knownHosts.toString());

            session = jsch.getSession(descriptor.getUsername(), descriptor.getHost(), descriptor.getPort());
            session.setPassword(descriptor.getPassword());
            session.setUserInfo(new PasswordUserInfo(descriptor.getPassword()));
            session.setConfig("StrictHostKeyChecking", settings.isStrictHostKeyChecking() ? "yes" : "no");
            String algorithms = String.join(",", settings.getHostKeyAlgorithms());
            session.setConfig("server_host_key", algorithms);
            session.setConfig("PubkeyAcceptedAlgorithms", algorithms);
            session.setConfig("PreferredAuthentications", "password,keyboard-interactive");
            session.connect(timeoutMillis);

            channel = (ChannelSubsystem) session.openChannel("subsystem");
            channel.setSubsystem("netconf");
            BufferedInputStream in = new BufferedInputStream(channel.getInputStream());
            channel.connect(timeoutMillis);

            NetconfChannel netconf = new NetconfChannel(descriptor.getHost(), in, channel.getOutputStream(),
                releaser(descriptor.getHost(), session, channel, knownHosts));
            netconf.exchangeHello(connectTimeout);
            // подключение завершено, дальше сокет ждёт ответы RPC
            session.setTimeout((int) Math.min(Integer.MAX_VALUE, Duration.ofSeconds(settings.getRpcTimeout()).toMillis()));
            log.debug("NETCONF сессия с {}:{} установлена", descriptor.getHost(), descriptor.getPort());
            return OperationResult.success(netconf);
        } catch (JSchException e) {
            release(descriptor.getHost(), session, channel, knownHosts);
            String reason = e.getMessage() != null && e.getMessage().contains("Auth")
                ? "Ошибка аутентификации на " + descriptor.getHost()
                : "Не удалось подключиться к " + descriptor.getHost();
            return OperationResult.failure(reason, e);
        } catch (IOException | RuntimeException e) {
            release(descriptor.getHost(), session, channel, knownHosts);
            return OperationResult.failure("Ошибка установки NETCONF сессии с " + descriptor.getHost(), e);
        }
    }

    private static Runnable releaser(String host, Session session, ChannelSubsystem channel, Path knownHosts) {
        return () -> release(host, session, channel, knownHosts);
    }

    private static void release(String host, Session session, ChannelSubsystem channel, Path knownHosts) {
        if (channel != null && channel.isConnected()) {
            channel.disconnect();
        }
        if (session != null && session.isConnected()) {
            session.disconnect();
        }
        if (knownHosts != null) {
            try {
                Files.deleteIfExists(knownHosts);
            } catch (IOException e) {
                log.warn("{}: не удалось удалить временный known_hosts {}: {}", host, knownHosts, e.getMessage());
            }
        }
    }

    /**
     * Ответы на запросы пароля для password и keyboard-interactive аутентификации.
     */
    private static final class PasswordUserInfo implements UserInfo, UIKeyboardInteractive {
        private final String password;

        private PasswordUserInfo(String password) {
            this.password = password;
        }

        @Override
        public String getPassphrase() {
            return null;
        }

        @Override
        public String getPassword() {
            return password;
        }

        @Override
        public boolean promptPassword(String message) {
            return true;
        }

        @Override
        public boolean promptPassphrase(String message) {
            return false;
        }

        @Override
        public boolean promptYesNo(String message) {
            return false;
        }

        @Override
        public void showMessage(String message) {
            log.debug("SSH: {}", message);
        }

        @Override
        public String[] promptKeyboardInteractive(String destination, String name, String instruction,
                                                  String[] prompt, boolean[] echo) {
            String[] answers = new String[prompt.length];
            Arrays.fill(answers, password);
            return answers;
        }
    }
}
