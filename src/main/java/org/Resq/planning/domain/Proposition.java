package org.Resq.planning.domain;

import java.util.List;
import java.util.Objects;

/**
 * Ground atom: a predicate tag applied to an ordered list of object identifiers.
 *
 * <p>Equality is structural over predicate and arguments. The canonical key
 * {@code Predicate(arg1, arg2)} is used for rendering and ordering only.</p>
 *
 * @param predicate predicate tag.
 * @param arguments ordered object identifiers (possibly empty).
 */
public record Proposition(String predicate, List<String> arguments) implements Comparable<Proposition> {

    public Proposition {
        predicate = requireToken(predicate, "predicate");
        Objects.requireNonNull(arguments, "arguments");
        for (String argument : arguments) {
            requireToken(argument, "argument");
        }
        arguments = List.copyOf(arguments);
    }

    /**
     * Creates a proposition from a predicate and its arguments.
     */
    public static Proposition of(String predicate, String... arguments) {
        return new Proposition(predicate, List.of(arguments));
    }

    /**
     * Returns the canonical key, e.g. {@code PatientAt(ACC3, H1)}.
     */
    public String key() {
        if (arguments.isEmpty()) {
            return predicate;
        }
        return predicate + "(" + String.join(", ", arguments) + ")";
    }

    public int arity() {
        return arguments.size();
    }

    /**
     * Returns whether {@code objectId} appears among the arguments.
     */
    public boolean mentions(String objectId) {
        return arguments.contains(objectId);
    }

    public boolean hasPredicate(String tag) {
        return predicate.equals(tag);
    }

    /**
     * Returns the complementary proposition.
     *
     * <p>Predicates with a declared complement (see {@link Predicates#complementOf(String)})
     * map onto it with the same arguments; any other proposition is wrapped as
     * {@code Not(<key>)}, and unwrapping a {@code Not} returns the original.</p>
     */
    public Proposition negation() {
        if (predicate.equals(Predicates.NOT) && arguments.size() == 1) {
            return Predicates.parse(arguments.get(0));
        }
        String complement = Predicates.complementOf(predicate);
        if (complement != null) {
            return new Proposition(complement, arguments);
        }
        return Proposition.of(Predicates.NOT, key());
    }

    @Override
    public int compareTo(Proposition other) {
        return key().compareTo(other.key());
    }

    @Override
    public String toString() {
        return key();
    }

    private static String requireToken(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must be non-blank");
        }
        return value;
    }
}
