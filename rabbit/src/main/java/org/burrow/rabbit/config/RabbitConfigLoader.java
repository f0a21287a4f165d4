package org.burrow.rabbit.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads {@link RabbitConfig} from YAML rooted at {@code burrow.rabbit}.
 */
public class RabbitConfigLoader {

    /**
     * Load config from a YAML file path.
     */
    public static RabbitConfig fromYaml(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return fromYaml(is);
        }
    }

    /**
     * Load config from a classpath resource.
     */
    public static RabbitConfig fromClasspath(String resource) {
        try (InputStream is = RabbitConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Resource not found: " + resource);
            }
            return fromYaml(is);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load config from classpath: " + resource, e);
        }
    }

    /**
     * Load config from an InputStream.
     */
    @SuppressWarnings("unchecked")
    public static RabbitConfig fromYaml(InputStream is) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(is);
        if (!(loaded instanceof Map)) {
            throw new IllegalArgumentException("YAML document is empty or not a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        Map<String, Object> rabbit = getMap(getMap(root, "burrow"), "rabbit");

        RabbitConfig config = new RabbitConfig();

        Map<String, Object> connection = getMapOrEmpty(rabbit, "connection");
        RabbitConfig.ConnectionConfig conn = config.getConnection();
        if (connection.containsKey("uri")) conn.setUri(String.valueOf(connection.get("uri")));
        if (connection.containsKey("automatic-recovery"))
            conn.setAutomaticRecovery(toBoolean(connection.get("automatic-recovery")));
        if (connection.containsKey("keys-path")) conn.setKeysPath(String.valueOf(connection.get("keys-path")));
        if (connection.containsKey("client-name")) conn.setClientName(String.valueOf(connection.get("client-name")));

        Map<String, Object> lifecycle = getMapOrEmpty(rabbit, "lifecycle");
        if (lifecycle.containsKey("max-retries"))
            config.getLifecycle().setMaxRetries(toInt(lifecycle.get("max-retries"), -1));
        if (lifecycle.containsKey("reconnect-delay"))
            config.getLifecycle().setReconnectDelay(parseDuration(String.valueOf(lifecycle.get("reconnect-delay"))));

        for (Map.Entry<String, Object> entry : getMapOrEmpty(rabbit, "publishers").entrySet()) {
            config.getPublishers().put(entry.getKey(), parsePublisher(asMap(entry.getKey(), entry.getValue())));
        }
        for (Map.Entry<String, Object> entry : getMapOrEmpty(rabbit, "consumers").entrySet()) {
            config.getConsumers().put(entry.getKey(), parseConsumer(asMap(entry.getKey(), entry.getValue())));
        }

        return config;
    }

    private static RabbitConfig.PublisherConfig parsePublisher(Map<String, Object> map) {
        RabbitConfig.PublisherConfig pub = new RabbitConfig.PublisherConfig();
        if (map.containsKey("type")) pub.setType(RabbitConfig.PublisherType.valueOf(enumName(map.get("type"))));
        if (map.containsKey("exchange")) pub.setExchange(String.valueOf(map.get("exchange")));
        if (map.containsKey("enable-acks")) pub.setEnableAcks(toBoolean(map.get("enable-acks")));
        if (map.containsKey("content-type")) pub.setContentType(String.valueOf(map.get("content-type")));
        if (map.containsKey("max-queue-depth")) pub.setMaxQueueDepth(toInt(map.get("max-queue-depth"), -1));
        if (map.containsKey("confirm-timeout"))
            pub.setConfirmTimeout(parseDuration(String.valueOf(map.get("confirm-timeout"))));
        if (map.containsKey("exchange-declaration"))
            pub.setExchangeDeclaration(parseExchange(getMap(map, "exchange-declaration")));
        return pub;
    }

    private static RabbitConfig.ConsumerConfig parseConsumer(Map<String, Object> map) {
        RabbitConfig.ConsumerConfig con = new RabbitConfig.ConsumerConfig();
        if (map.containsKey("type")) con.setType(RabbitConfig.ConsumerType.valueOf(enumName(map.get("type"))));
        if (map.containsKey("exchange")) con.setExchange(String.valueOf(map.get("exchange")));
        if (map.containsKey("queue")) con.setQueue(String.valueOf(map.get("queue")));
        if (map.containsKey("routing-keys")) con.setRoutingKeys(toStringList(map.get("routing-keys")));
        if (map.containsKey("prefetch-count")) con.setPrefetchCount(toInt(map.get("prefetch-count"), 0));
        if (map.containsKey("auto-ack")) con.setAutoAck(toBoolean(map.get("auto-ack")));
        if (map.containsKey("nack-on-false")) con.setNackOnFalse(toBoolean(map.get("nack-on-false")));
        if (map.containsKey("requeue-on-nack")) con.setRequeueOnNack(toBoolean(map.get("requeue-on-nack")));
        if (map.containsKey("management-uri")) con.setManagementUri(String.valueOf(map.get("management-uri")));
        if (map.containsKey("exchange-declaration"))
            con.setExchangeDeclaration(parseExchange(getMap(map, "exchange-declaration")));
        if (map.containsKey("queue-declaration"))
            con.setQueueDeclaration(parseQueue(getMap(map, "queue-declaration")));
        return con;
    }

    private static RabbitConfig.ExchangeConfig parseExchange(Map<String, Object> map) {
        RabbitConfig.ExchangeConfig ex = new RabbitConfig.ExchangeConfig();
        if (map.containsKey("passive")) ex.setPassive(toBoolean(map.get("passive")));
        if (map.containsKey("type")) ex.setType(String.valueOf(map.get("type")));
        if (map.containsKey("durable")) ex.setDurable(toBoolean(map.get("durable")));
        if (map.containsKey("auto-delete")) ex.setAutoDelete(toBoolean(map.get("auto-delete")));
        ex.setArguments(getMapOrEmpty(map, "arguments"));
        return ex;
    }

    private static RabbitConfig.QueueConfig parseQueue(Map<String, Object> map) {
        RabbitConfig.QueueConfig q = new RabbitConfig.QueueConfig();
        if (map.containsKey("passive")) q.setPassive(toBoolean(map.get("passive")));
        if (map.containsKey("exclusive")) q.setExclusive(toBoolean(map.get("exclusive")));
        if (map.containsKey("type")) q.setType(String.valueOf(map.get("type")));
        if (map.containsKey("durable")) q.setDurable(toBoolean(map.get("durable")));
        if (map.containsKey("auto-delete")) q.setAutoDelete(toBoolean(map.get("auto-delete")));
        q.setArguments(getMapOrEmpty(map, "arguments"));
        return q;
    }

    // ========== Utility ==========

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        throw new IllegalArgumentException("Missing or invalid key: " + key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMapOrEmpty(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(String name, Object val) {
        if (val instanceof Map) return (Map<String, Object>) val;
        if (val == null) return new LinkedHashMap<>();
        throw new IllegalArgumentException("Entry " + name + " must be a mapping");
    }

    private static List<String> toStringList(Object val) {
        List<String> result = new ArrayList<>();
        if (val instanceof List<?> list) {
            for (Object item : list) result.add(String.valueOf(item));
        } else if (val != null) {
            for (String item : String.valueOf(val).split(",")) {
                if (!item.isBlank()) result.add(item.trim());
            }
        }
        return result;
    }

    private static String enumName(Object val) {
        return String.valueOf(val).trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    private static boolean toBoolean(Object val) {
        return Boolean.parseBoolean(String.valueOf(val));
    }

    private static int toInt(Object val, int defaultVal) {
        if (val == null) return defaultVal;
        if (val instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(val).trim());
        } catch (NumberFormatException e) {
            return defaultVal;
        }
    }

    /**
     * Parse simple duration strings: "500ms", "5s", "30m", "1h".
     * Falls back to seconds if no unit specified.
     */
    static Duration parseDuration(String str) {
        if (str == null || str.isBlank()) return Duration.ofSeconds(5);
        str = str.trim().toLowerCase(Locale.ROOT);
        if (str.endsWith("ms")) return Duration.ofMillis(Long.parseLong(str.replace("ms", "").trim()));
        if (str.endsWith("s")) return Duration.ofSeconds(Long.parseLong(str.replace("s", "").trim()));
        if (str.endsWith("m")) return Duration.ofMinutes(Long.parseLong(str.replace("m", "").trim()));
        if (str.endsWith("h")) return Duration.ofHours(Long.parseLong(str.replace("h", "").trim()));
        return Duration.ofSeconds(Long.parseLong(str));
    }
}
