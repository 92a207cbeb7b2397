package com.evpn.auditor.config;

import com.evpn.auditor.models.DeviceDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Загрузка инвентаря устройств (hosts.yaml).
 *
 * <pre>
 * defaults:
 *   admin_user: netops
 *   user_password: { netops: secret }
 *   port: 22
 * host_groups:
 *   spines:
 *     - host: 10.0.0.1
 *       name: spine-1
 *       tags: [spine]
 * </pre>
 *
 * Настройки хоста перекрывают defaults. Хост без пароля (ни прямого, ни через
 * {@code defaults.user_password[username]}) пропускается с предупреждением.
 */
@Slf4j
public class InventoryLoader {

    private final Path hostsFile;

    public InventoryLoader(Path hostsFile) {
        this.hostsFile = hostsFile;
    }

    /**
     * Загрузить устройства в порядке следования в файле.
     * При любой ошибке чтения/разбора возвращается пустой список.
     */
    public List<DeviceDescriptor> load() {
        try (InputStream is = Files.newInputStream(hostsFile)) {
            JsonNode root = AuditorRules.yamlMapper().readTree(is);
            List<DeviceDescriptor> devices = resolve(root);
            log.info("Загружено {} устройств из {}", devices.size(), hostsFile);
            return devices;
        } catch (Exception e) {
            log.error("Не удалось загрузить инвентарь из {}: {}", hostsFile, e.getMessage());
            return List.of();
        }
    }

    List<DeviceDescriptor> resolve(JsonNode root) {
        List<DeviceDescriptor> devices = new ArrayList<>();
        if (root == null || !root.isObject()) {
            return devices;
        }
        JsonNode defaults = root.path("defaults");
        JsonNode groups = root.path("host_groups");
        if (!groups.isObject()) {
            return devices;
        }

        Iterator<Map.Entry<String, JsonNode>> groupIterator = groups.fields();
        while (groupIterator.hasNext()) {
            Map.Entry<String, JsonNode> group = groupIterator.next();
            JsonNode hosts = group.getValue();
            if (hosts == null || !hosts.isArray()) {
                log.debug("Группа {} не содержит списка хостов", group.getKey());
                continue;
            }
            for (JsonNode hostConfig : hosts) {
                DeviceDescriptor descriptor = resolveHost(defaults, hostConfig, group.getKey());
                if (descriptor != null) {
                    devices.add(descriptor);
                }
            }
        }
        return devices;
    }

    private DeviceDescriptor resolveHost(JsonNode defaults, JsonNode hostConfig, String groupName) {
        if (hostConfig == null || !hostConfig.isObject()) {
            log.warn("Некорректная запись хоста в группе {}: {}", groupName, hostConfig);
            return null;
        }
        String host = text(hostConfig, "host");
        if (host == null || host.isBlank()) {
            log.warn("Запись без host в группе {} пропущена", groupName);
            return null;
        }

        ObjectNode merged = defaults.isObject() ? ((ObjectNode) defaults).deepCopy() : AuditorRules.yamlMapper().createObjectNode();
        merged.setAll((ObjectNode) hostConfig);

        String adminUser = text(defaults, "admin_user");
        String username = text(merged, "username");
        if (username == null) {
            username = adminUser;
        }

        String password = text(merged, "password");
        if (password == null || password.isEmpty()) {
            JsonNode userPasswords = defaults.path("user_password");
            if (userPasswords.isObject() && username != null) {
                password = text(userPasswords, username);
            }
        }
        if (password == null || password.isEmpty()) {
            log.warn("Не найден пароль для {}", host);
            return null;
        }

        DeviceDescriptor.DeviceDescriptorBuilder builder = DeviceDescriptor.builder()
            .host(host)
            .displayName(hostConfig.hasNonNull("name") ? hostConfig.get("name").asText() : host)
            .username(username)
            .password(password)
            .port(merged.path("port").asInt(DeviceDescriptor.DEFAULT_PORT))
            .connectTimeoutSeconds(merged.path("timeout").asInt(DeviceDescriptor.DEFAULT_CONNECT_TIMEOUT_SECONDS));

        JsonNode tags = hostConfig.path("tags");
        if (tags.isArray()) {
            tags.forEach(tag -> builder.tag(tag.asText()));
        }
        return builder.build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
