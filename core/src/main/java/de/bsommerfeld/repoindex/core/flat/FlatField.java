package de.bsommerfeld.repoindex.core.flat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.repoindex.core.error.IndexFormatException;
import de.bsommerfeld.repoindex.core.model.Permission;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One named field of the flat index format, bound to a getter on the
 * catalog record and a setter on its builder.
 *
 * <p>
 * A field owns its external name, its {@link Presence} rule and its JSON
 * encoding, so writing and reading a record are driven by the same table
 * and cannot drift apart.
 *
 * @param <T> catalog record type
 * @param <B> builder type used when reading
 */
public final class FlatField<T, B> {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final String name;
    private final Presence presence;
    private final Function<T, ?> getter;
    private final Function<Object, JsonNode> encoder;
    private final BiConsumer<B, JsonNode> decoder;

    private FlatField(String name, Presence presence, Function<T, ?> getter,
            Function<Object, JsonNode> encoder, BiConsumer<B, JsonNode> decoder) {
        this.name = name;
        this.presence = presence;
        this.getter = getter;
        this.encoder = encoder;
        this.decoder = decoder;
    }

    public String name() {
        return name;
    }

    public boolean isPresent(T record) {
        return presence.test(getter.apply(record));
    }

    /** Puts this field into {@code target} if it is present on {@code record}. */
    public void write(T record, ObjectNode target) {
        Object value = getter.apply(record);
        if (presence.test(value)) {
            target.set(name, encoder.apply(value));
        }
    }

    /** Applies this field from {@code source} to {@code builder}, if the key exists. */
    public void read(JsonNode source, B builder) {
        JsonNode value = source.get(name);
        if (value != null && !value.isNull()) {
            decoder.accept(builder, value);
        }
    }

    // =====================================================================
    // Field kinds
    // =====================================================================

    public static <T, B> FlatField<T, B> text(String name, Function<T, String> getter,
            BiConsumer<B, String> setter) {
        return new FlatField<>(name, Presence.NON_EMPTY_TEXT, getter,
                v -> NODES.textNode((String) v),
                (b, node) -> setter.accept(b, node.asText()));
    }

    public static <T, B> FlatField<T, B> integer(String name, Function<T, Integer> getter,
            BiConsumer<B, Integer> setter) {
        return new FlatField<>(name, Presence.NON_ZERO, getter,
                v -> NODES.numberNode((Integer) v),
                (b, node) -> setter.accept(b, asInt(name, node)));
    }

    public static <T, B> FlatField<T, B> longValue(String name, Function<T, Long> getter,
            BiConsumer<B, Long> setter) {
        return new FlatField<>(name, Presence.NON_ZERO, getter,
                v -> NODES.numberNode((Long) v),
                (b, node) -> setter.accept(b, node.asLong()));
    }

    /**
     * An integer published as a decimal string, the way version codes
     * declared in metadata files have always been published.
     */
    public static <T, B> FlatField<T, B> integerAsText(String name, Function<T, Integer> getter,
            BiConsumer<B, Integer> setter) {
        return new FlatField<>(name, Presence.NON_ZERO, getter,
                v -> NODES.textNode(String.valueOf(v)),
                (b, node) -> setter.accept(b, asInt(name, node)));
    }

    public static <T, B> FlatField<T, B> textList(String name, Function<T, List<String>> getter,
            BiConsumer<B, List<String>> setter) {
        return new FlatField<>(name, Presence.NON_EMPTY_LIST, getter,
                v -> {
                    ArrayNode array = NODES.arrayNode();
                    for (Object item : (List<?>) v) {
                        array.add((String) item);
                    }
                    return array;
                },
                (b, node) -> {
                    List<String> values = new ArrayList<>();
                    node.forEach(item -> values.add(item.asText()));
                    setter.accept(b, values);
                });
    }

    /** A point in time, published as epoch milliseconds. */
    public static <T, B> FlatField<T, B> instant(String name, Function<T, Instant> getter,
            BiConsumer<B, Instant> setter) {
        return new FlatField<>(name, Presence.NON_NULL_INSTANT, getter,
                v -> NODES.numberNode(((Instant) v).toEpochMilli()),
                (b, node) -> setter.accept(b, Instant.ofEpochMilli(node.asLong())));
    }

    /** Permissions, published as {@code [name, maxSdkVersion]} pairs. */
    public static <T, B> FlatField<T, B> permissions(String name, Function<T, List<Permission>> getter,
            BiConsumer<B, List<Permission>> setter) {
        return new FlatField<>(name, Presence.NON_EMPTY_LIST, getter,
                v -> {
                    ArrayNode array = NODES.arrayNode();
                    for (Object item : (List<?>) v) {
                        Permission permission = (Permission) item;
                        ArrayNode pair = array.addArray().add(permission.name());
                        if (permission.maxSdkVersion() == null) {
                            pair.addNull();
                        } else {
                            pair.add(permission.maxSdkVersion());
                        }
                    }
                    return array;
                },
                (b, node) -> {
                    List<Permission> values = new ArrayList<>();
                    for (JsonNode pair : node) {
                        if (!pair.isArray() || pair.isEmpty()) {
                            throw new IndexFormatException("Malformed permission in '" + name + "': " + pair);
                        }
                        JsonNode maxSdk = pair.get(1);
                        values.add(new Permission(pair.get(0).asText(),
                                maxSdk == null || maxSdk.isNull() ? null : maxSdk.asInt()));
                    }
                    setter.accept(b, values);
                });
    }

    private static int asInt(String name, JsonNode node) {
        if (node.isNumber()) {
            return node.asInt();
        }
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IndexFormatException("Invalid number for '" + name + "': " + node, e);
        }
    }
}
