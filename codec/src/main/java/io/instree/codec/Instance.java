package io.instree.codec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-instance data of a document: a display name, the class of the
 * instance, and a bag of named properties.
 * <p>
 * Shallowly immutable value: the property map itself cannot be changed, but
 * nested lists or maps inside it are shared, not copied. Property values are
 * plain JSON-compatible objects (strings, numbers, booleans, lists, maps);
 * property order is preserved.
 */
public final class Instance {
    private final String name;
    private final String className;
    private final Map<String, Object> properties;

    @JsonCreator
    public Instance(
            @JsonProperty("Name") String name,
            @JsonProperty("ClassName") String className,
            @JsonProperty("Properties") Map<String, Object> properties
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.className = Objects.requireNonNull(className, "className");
        if (className.isBlank()) throw new IllegalArgumentException("className must not be blank");
        this.properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static Instance of(String className, String name) {
        return new Instance(name, className, Map.of());
    }

    @JsonProperty("Name")
    public String name() { return name; }

    @JsonProperty("ClassName")
    public String className() { return className; }

    @JsonProperty("Properties")
    public Map<String, Object> properties() { return properties; }

    public Instance withName(String newName) {
        return new Instance(newName, className, properties);
    }

    /** Copy of this instance with {@code key} set to {@code value}. */
    public Instance withProperty(String key, Object value) {
        var m = new LinkedHashMap<>(properties);
        m.put(Objects.requireNonNull(key, "key"), value);
        return new Instance(name, className, m);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instance other)) return false;
        return name.equals(other.name) && className.equals(other.className) && properties.equals(other.properties);
    }

    @Override public int hashCode() { return Objects.hash(name, className, properties); }

    @Override public String toString() { return className + " \"" + name + "\" " + properties; }
}
