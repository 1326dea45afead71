package io.instree.core;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque identity of an instance.
 * <p>
 * Design:
 *  - Value object: equals/hashCode based purely on the wrapped UUID.
 *  - Unique for the lifetime of the process when obtained via {@link #newUnique()}.
 *  - Immutable and cheap to copy around as a map key.
 */
public record InstanceId(UUID uuid) {

    public InstanceId {
        Objects.requireNonNull(uuid, "uuid");
    }

    /** Fresh random identifier. */
    public static InstanceId newUnique() {
        return new InstanceId(UUID.randomUUID());
    }

    /**
     * Parse the textual form produced by {@link #toString()}.
     * Only the canonical 36-character form is accepted (case-insensitive), so
     * two different strings never name the same id.
     *
     * @throws IllegalArgumentException if {@code text} is not a canonical UUID
     */
    public static InstanceId parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("instance id must not be blank");
        String trimmed = text.trim();
        var id = new InstanceId(UUID.fromString(trimmed));
        if (!id.toString().equalsIgnoreCase(trimmed)) {
            throw new IllegalArgumentException("instance id not in canonical form: " + trimmed);
        }
        return id;
    }

    @Override public String toString() { return uuid.toString(); }
}
