package com.evpn.auditor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Правила аудита из YAML файла (rules.yaml).
 * Все блоки необязательны, отсутствующие значения берутся по умолчанию.
 */
@Data
@Slf4j
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuditorRules {

    private Performance performance = new Performance();
    private Logging logging = new Logging();
    private Netconf netconf = new Netconf();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Performance {
        private Integer maxConcurrentDevices;
        private Integer connectionTimeout;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Logging {
        private boolean enabled = false;
        private String level = "INFO";
        private String file = "data/logs.txt";
        private String format = "%d{yyyy-MM-dd HH:mm:ss} - %logger - %level - %msg%n";
        private int maxSizeMb = 10;
        private int backupCount = 5;
        private boolean console = true;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Netconf {
        public static final List<String> DEFAULT_HOST_KEY_ALGORITHMS = List.of(
            "ssh-ed25519",
            "ecdsa-sha2-nistp256",
            "ecdsa-sha2-nistp384",
            "ecdsa-sha2-nistp521",
            "rsa-sha2-512",
            "rsa-sha2-256",
            "ssh-rsa");

        private List<String> hostKeyAlgorithms = new ArrayList<>(DEFAULT_HOST_KEY_ALGORITHMS);
        private boolean strictHostKeyChecking = false;
        private int rpcTimeout = 300;
    }

    static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Загрузить правила. Ошибка чтения или разбора не прерывает запуск:
     * логируется и возвращаются правила по умолчанию.
     */
    public static AuditorRules load(Path rulesFile) {
        if (rulesFile == null) {
            return new AuditorRules();
        }
        try (InputStream is = Files.newInputStream(rulesFile)) {
            ObjectMapper mapper = yamlMapper();
            JsonNode root = mapper.readTree(is);
            AuditorRules rules = root == null || root.isMissingNode() || root.isNull()
                ? new AuditorRules()
                : mapper.treeToValue(root, AuditorRules.class);
            rules.ensureDefaults();
            log.info("Загружены правила из {}", rulesFile);
            return rules;
        } catch (Exception e) {
            log.error("Не удалось загрузить правила из {}: {}", rulesFile, e.getMessage());
            return new AuditorRules();
        }
    }

    private void ensureDefaults() {
        if (performance == null) {
            performance = new Performance();
        }
        if (logging == null) {
            logging = new Logging();
        }
        if (netconf == null) {
            netconf = new Netconf();
        }
        if (netconf.getHostKeyAlgorithms() == null || netconf.getHostKeyAlgorithms().isEmpty()) {
            netconf.setHostKeyAlgorithms(new ArrayList<>(Netconf.DEFAULT_HOST_KEY_ALGORITHMS));
        }
    }
}
