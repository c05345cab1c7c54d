package org.Resq.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.Resq.planning.ObjectNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Immutable external-id index over a collection of scenario objects.
 *
 * <p>Ids map to dense internal indices in input order. Every failed lookup goes through
 * {@link #require(String)}, which raises {@link ObjectNotFoundException}.</p>
 *
 * @param <T> indexed object type.
 */
public final class ObjectIndex<T> {
    private static final int MISSING = -1;

    private final String objectKind;
    // external id -> dense index
    private final Object2IntOpenHashMap<String> forward;
    // dense index -> object
    private final List<T> values;

    private ObjectIndex(String objectKind, Object2IntOpenHashMap<String> forward, List<T> values) {
        this.objectKind = objectKind;
        this.forward = forward;
        this.values = values;
    }

    /**
     * Indexes the given objects by the id extracted from each one.
     *
     * @param objectKind object kind used in not-found errors (for example {@code hospital}).
     * @param objects objects to index; iteration order defines internal indices.
     * @param idOf id extractor.
     * @throws IllegalArgumentException on null/blank or duplicate ids.
     */
    public static <T> ObjectIndex<T> of(String objectKind, Collection<? extends T> objects, Function<? super T, String> idOf) {
        Objects.requireNonNull(objectKind, "objectKind");
        Objects.requireNonNull(objects, "objects");
        Objects.requireNonNull(idOf, "idOf");

        Object2IntOpenHashMap<String> forward = new Object2IntOpenHashMap<>(objects.size());
        forward.defaultReturnValue(MISSING);
        List<T> values = new ArrayList<>(objects.size());

        for (T object : objects) {
            T nonNull = Objects.requireNonNull(object, objectKind);
            String id = idOf.apply(nonNull);
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException(objectKind + " id must be non-blank");
            }
            if (forward.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate " + objectKind + " id: " + id);
            }
            forward.put(id, values.size());
            values.add(nonNull);
        }
        forward.trim();
        return new ObjectIndex<>(objectKind, forward, Collections.unmodifiableList(values));
    }

    /**
     * Returns the object registered under {@code id}.
     *
     * @throws ObjectNotFoundException if the id is unknown.
     */
    public T require(String id) {
        int index = id == null ? MISSING : forward.getInt(id);
        if (index == MISSING) {
            throw new ObjectNotFoundException(objectKind, String.valueOf(id));
        }
        return values.get(index);
    }

    /**
     * Returns the object registered under {@code id}, if any.
     */
    public Optional<T> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        int index = forward.getInt(id);
        return index == MISSING ? Optional.empty() : Optional.of(values.get(index));
    }

    /**
     * Returns the dense internal index of {@code id}.
     *
     * @throws ObjectNotFoundException if the id is unknown.
     */
    public int indexOf(String id) {
        int index = id == null ? MISSING : forward.getInt(id);
        if (index == MISSING) {
            throw new ObjectNotFoundException(objectKind, String.valueOf(id));
        }
        return index;
    }

    public boolean contains(String id) {
        return id != null && forward.containsKey(id);
    }

    /**
     * Returns all indexed objects in internal index order.
     */
    public List<T> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public String objectKind() {
        return objectKind;
    }
}
