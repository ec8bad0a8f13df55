package com.questrail.msgrpc.msgpack;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from extension tag to {@link ExtensionCodec}, with the
 * reverse lookup from domain type to codec.
 */
public final class ExtensionRegistry
{
    private static final ExtensionRegistry EMPTY = new ExtensionRegistry(Map.of(), Map.of());

    private final Map<Integer, ExtensionCodec<?>> byTag;
    private final Map<Class<?>, ExtensionCodec<?>> byType;

    private ExtensionRegistry(Map<Integer, ExtensionCodec<?>> byTag,
                              Map<Class<?>, ExtensionCodec<?>> byType) {
        this.byTag = Collections.unmodifiableMap(new HashMap<>(byTag));
        this.byType = Collections.unmodifiableMap(new HashMap<>(byType));
    }

    public static ExtensionRegistry empty() {
        return EMPTY;
    }

    public Optional<ExtensionCodec<?>> forTag(int tag) {
        return Optional.ofNullable(byTag.get(tag));
    }

    /**
     * Finds the codec responsible for {@code type}, or for the nearest
     * superclass of it that has one.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<ExtensionCodec<T>> forType(Class<T> type) {
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            ExtensionCodec<?> codec = byType.get(c);
            if (codec != null) {
                return Optional.of((ExtensionCodec<T>) codec);
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return byTag.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Integer, ExtensionCodec<?>> byTag = new HashMap<>();
        private final Map<Class<?>, ExtensionCodec<?>> byType = new HashMap<>();

        public Builder register(ExtensionCodec<?> codec) {
            Objects.requireNonNull(codec, "codec");
            int tag = codec.type();
            if (tag < Byte.MIN_VALUE || tag > Byte.MAX_VALUE) {
                throw new IllegalArgumentException("Extension tag must be -128..127: " + tag);
            }
            Class<?> valueType = Objects.requireNonNull(codec.valueType(), "codec.valueType()");
            ExtensionCodec<?> previous = byType.get(valueType);
            if (previous != null && previous.type() != tag) {
                throw new IllegalArgumentException(valueType.getName()
                        + " is already bound to extension tag " + previous.type());
            }
            ExtensionCodec<?> replaced = byTag.put(tag, codec);
            if (replaced != null) {
                byType.remove(replaced.valueType());
            }
            byType.put(valueType, codec);
            return this;
        }

        public ExtensionRegistry build() {
            if (byTag.isEmpty()) {
                return EMPTY;
            }
            return new ExtensionRegistry(byTag, byType);
        }
    }
}
