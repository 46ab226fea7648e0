package com.columnduck.format;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-format table of text serializers and deserializers.
 *
 * <p>Each format and direction is looked up independently; an absent entry is
 * an empty {@link Optional}, never a stub that throws. Tables are immutable
 * once built.
 *
 * <p>Example:
 * <pre>
 *   FormatCapabilities formats = FormatCapabilities.builder()
 *       .serializer(TextFormat.JSON, this::serializeJson)
 *       .deserializer(TextFormat.JSON, this::deserializeJson)
 *       .build();
 * </pre>
 */
public final class FormatCapabilities {

    private static final FormatCapabilities NONE = new FormatCapabilities(
        new EnumMap<>(TextFormat.class), new EnumMap<>(TextFormat.class));

    private final Map<TextFormat, TextSerializer> serializers;
    private final Map<TextFormat, TextDeserializer> deserializers;

    private FormatCapabilities(EnumMap<TextFormat, TextSerializer> serializers,
                               EnumMap<TextFormat, TextDeserializer> deserializers) {
        this.serializers = Collections.unmodifiableMap(serializers);
        this.deserializers = Collections.unmodifiableMap(deserializers);
    }

    /**
     * Returns the empty table.
     *
     * @return a table with no entries
     */
    public static FormatCapabilities none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<TextSerializer> serializer(TextFormat format) {
        return Optional.ofNullable(serializers.get(format));
    }

    public Optional<TextDeserializer> deserializer(TextFormat format) {
        return Optional.ofNullable(deserializers.get(format));
    }

    public Set<TextFormat> serializableFormats() {
        return serializers.keySet();
    }

    public Set<TextFormat> deserializableFormats() {
        return deserializers.keySet();
    }

    public boolean isEmpty() {
        return serializers.isEmpty() && deserializers.isEmpty();
    }

    @Override
    public String toString() {
        return "FormatCapabilities(serialize=" + serializers.keySet() + ", deserialize=" + deserializers.keySet() + ")";
    }

    /**
     * Builder for {@link FormatCapabilities}.
     */
    public static final class Builder {

        private final EnumMap<TextFormat, TextSerializer> serializers = new EnumMap<>(TextFormat.class);
        private final EnumMap<TextFormat, TextDeserializer> deserializers = new EnumMap<>(TextFormat.class);

        private Builder() {}

        public Builder serializer(TextFormat format, TextSerializer serializer) {
            serializers.put(Objects.requireNonNull(format, "format must not be null"),
                Objects.requireNonNull(serializer, "serializer must not be null"));
            return this;
        }

        public Builder deserializer(TextFormat format, TextDeserializer deserializer) {
            deserializers.put(Objects.requireNonNull(format, "format must not be null"),
                Objects.requireNonNull(deserializer, "deserializer must not be null"));
            return this;
        }

        /**
         * Registers the same serializer and deserializer for several formats.
         */
        public Builder all(Set<TextFormat> formats, TextSerializer serializer, TextDeserializer deserializer) {
            for (TextFormat format : formats) {
                serializer(format, serializer);
                deserializer(format, deserializer);
            }
            return this;
        }

        public FormatCapabilities build() {
            return new FormatCapabilities(new EnumMap<>(serializers), new EnumMap<>(deserializers));
        }
    }
}
