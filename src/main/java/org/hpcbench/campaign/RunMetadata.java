package org.hpcbench.campaign;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.bson.Document;

/**
 * Run descriptor written once when a campaign is deployed: recipe, its hash, target and the
 * deployment descriptors.
 */
public final class RunMetadata {
    private final String campaignId;
    private final Instant createdAt;
    private final String target;
    private final Map<String, Object> recipe;
    private final String recipeHash;
    private final Map<String, Object> service;
    private final List<Map<String, Object>> clients;

    public RunMetadata(
        String campaignId,
        Instant createdAt,
        String target,
        Map<String, ?> recipe,
        Map<String, ?> service,
        List<? extends Map<String, ?>> clients
    ) {
        this.campaignId = Objects.requireNonNull(campaignId, "campaignId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.target = Objects.requireNonNull(target, "target");
        this.recipe = copy(Objects.requireNonNull(recipe, "recipe"));
        this.recipeHash = recipeHash(this.recipe);
        this.service = service == null ? new LinkedHashMap<>() : copy(service);
        List<Map<String, Object>> clientCopies = new ArrayList<>();
        if (clients != null) {
            for (Map<String, ?> client : clients) {
                clientCopies.add(copy(client));
            }
        }
        this.clients = clientCopies;
    }

    public String campaignId() {
        return campaignId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public String target() {
        return target;
    }

    public Map<String, Object> recipe() {
        return copy(recipe);
    }

    /**
     * SHA-256 over the key-sorted recipe JSON.
     */
    public String recipeHash() {
        return recipeHash;
    }

    public Map<String, Object> service() {
        return copy(service);
    }

    public List<Map<String, Object>> clients() {
        List<Map<String, Object>> copies = new ArrayList<>();
        for (Map<String, Object> client : clients) {
            copies.add(copy(client));
        }
        return copies;
    }

    /**
     * Copy with the {@code hostname} of the named clients replaced.
     */
    public RunMetadata withClientHosts(Map<String, String> hostsByClient) {
        List<Map<String, Object>> updated = clients();
        for (Map<String, Object> client : updated) {
            String host = hostsByClient.get(String.valueOf(client.get("name")));
            if (host != null) {
                client.put("hostname", host);
            }
        }
        return new RunMetadata(campaignId, createdAt, target, recipe, service, updated);
    }

    public Document toDocument() {
        Document document = new Document();
        document.put("benchmark_id", campaignId);
        document.put("created_at", createdAt.toString());
        document.put("target", target);
        document.put("recipe_hash", recipeHash);
        document.put("recipe", new Document(recipe));
        document.put("service", new Document(service));
        List<Document> clientDocuments = new ArrayList<>();
        for (Map<String, Object> client : clients) {
            clientDocuments.add(new Document(client));
        }
        document.put("clients", clientDocuments);
        return document;
    }

    @SuppressWarnings("unchecked")
    public static RunMetadata fromDocument(Map<String, ?> document) {
        Objects.requireNonNull(document, "document");
        Object recipe = document.get("recipe");
        Object service = document.get("service");
        List<Map<String, Object>> clients = new ArrayList<>();
        if (document.get("clients") instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?>) {
                    clients.add((Map<String, Object>) item);
                }
            }
        }
        Object createdAt = document.get("created_at");
        return new RunMetadata(
            String.valueOf(document.get("benchmark_id")),
            createdAt == null ? Instant.EPOCH : Instant.parse(String.valueOf(createdAt)),
            document.get("target") == null ? "unknown" : String.valueOf(document.get("target")),
            recipe instanceof Map<?, ?> ? (Map<String, Object>) recipe : Map.of(),
            service instanceof Map<?, ?> ? (Map<String, Object>) service : Map.of(),
            clients
        );
    }

    /**
     * SHA-256 hex digest of the recipe serialized with sorted keys, {@code ", "} and {@code ": "}
     * separators and ASCII-escaped strings.
     */
    public static String recipeHash(Map<String, ?> recipe) {
        String canonical = canonicalJson(recipe);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String canonicalJson(Object value) {
        StringBuilder sb = new StringBuilder();
        appendCanonical(sb, value);
        return sb.toString();
    }

    private static void appendCanonical(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            map.forEach((key, nested) -> sorted.put(String.valueOf(key), nested));
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, Object> entry : sorted.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                appendString(sb, entry.getKey());
                sb.append(": ");
                appendCanonical(sb, entry.getValue());
            }
            sb.append('}');
        } else if (value instanceof Collection<?> collection) {
            sb.append('[');
            boolean first = true;
            for (Object item : collection) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                appendCanonical(sb, item);
            }
            sb.append(']');
        } else if (value instanceof Boolean flag) {
            sb.append(flag ? "true" : "false");
        } else if (value instanceof Number number) {
            sb.append(number);
        } else {
            appendString(sb, String.valueOf(value));
        }
    }

    private static void appendString(StringBuilder sb, String text) {
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    private static Map<String, Object> copy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, deepCopy(value)));
        return copy;
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(String.valueOf(key), deepCopy(nested)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(item -> copy.add(deepCopy(item)));
            return copy;
        }
        return value;
    }
}
