package com.evpn.auditor.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Настройка Logback во время выполнения: уровень из CLI и,
 * если в правилах включён блок logging, файл с ротацией по размеру.
 */
@Slf4j
public final class LoggingConfigurator {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private LoggingConfigurator() {
    }

    /**
     * Уровень в стиле CLI (DEBUG/INFO/WARNING/ERROR) в уровень Logback.
     */
    public static Level toLevel(String name) {
        if (name == null) {
            return Level.INFO;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            normalized = "WARN";
        }
        return Level.toLevel(normalized, Level.INFO);
    }

    public static void applyLevel(String levelName) {
        rootLogger().setLevel(toLevel(levelName));
    }

    /**
     * Имя файла лога с подставленным {@code {timestamp}}.
     */
    static String resolveFileName(String template, LocalDateTime now) {
        if (template == null || template.isBlank()) {
            template = "data/logs.txt";
        }
        return template.replace("{timestamp}", TIMESTAMP.format(now));
    }

    /**
     * Перенастроить root logger по блоку logging из правил.
     *
     * @return путь к файлу лога или null, если блок выключен
     */
    public static Path applyRules(AuditorRules.Logging config) throws IOException {
        if (config == null || !config.isEnabled()) {
            return null;
        }
        Level level = toLevel(config.getLevel());
        Path logFile = Paths.get(resolveFileName(config.getFile(), LocalDateTime.now()));
        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = rootLogger();
        root.detachAndStopAllAppenders();
        root.setLevel(level);

        RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
        fileAppender.setContext(context);
        fileAppender.setName("RULES_FILE");
        fileAppender.setFile(logFile.toString());

        FixedWindowRollingPolicy rollingPolicy = new FixedWindowRollingPolicy();
        rollingPolicy.setContext(context);
        rollingPolicy.setParent(fileAppender);
        rollingPolicy.setFileNamePattern(logFile + ".%i");
        rollingPolicy.setMinIndex(1);
        rollingPolicy.setMaxIndex(Math.max(1, config.getBackupCount()));
        rollingPolicy.start();

        SizeBasedTriggeringPolicy<ILoggingEvent> triggeringPolicy = new SizeBasedTriggeringPolicy<>();
        triggeringPolicy.setContext(context);
        triggeringPolicy.setMaxFileSize(FileSize.valueOf(Math.max(1, config.getMaxSizeMb()) + "MB"));
        triggeringPolicy.start();

        fileAppender.setRollingPolicy(rollingPolicy);
        fileAppender.setTriggeringPolicy(triggeringPolicy);
        fileAppender.setEncoder(encoder(context, config.getFormat()));
        fileAppender.start();
        root.addAppender(fileAppender);

        if (config.isConsole()) {
            ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
            console.setContext(context);
            console.setName("RULES_CONSOLE");
            console.setEncoder(encoder(context, config.getFormat()));
            // консоль менее подробная, чем файл
            ThresholdFilter threshold = new ThresholdFilter();
            threshold.setContext(context);
            threshold.setLevel(Level.INFO.levelStr);
            threshold.start();
            console.addFilter(threshold);
            console.start();
            root.addAppender(console);
        }

        log.info("Логирование настроено: {} в {}", level, logFile);
        return logFile;
    }

    private static PatternLayoutEncoder encoder(LoggerContext context, String pattern) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern != null && !pattern.isBlank() ? pattern : "%d - %logger - %level - %msg%n");
        encoder.start();
        return encoder;
    }

    private static Logger rootLogger() {
        return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
}
