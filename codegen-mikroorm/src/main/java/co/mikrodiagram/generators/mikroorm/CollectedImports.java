package co.mikrodiagram.generators.mikroorm;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * What one class needs to import: ORM decorators, other generated types, standalone enums and
 * interfaces, plus whether the {@code Collection} and {@code Cascade} helpers are used.
 *
 * <p>Immutable. Partial results are combined with {@link #plus(CollectedImports)}; every set is
 * kept sorted so rendering is deterministic.
 */
public record CollectedImports(
    SortedSet<String> decorators,
    SortedSet<String> relatedTypes,
    SortedSet<String> referencedEnums,
    SortedSet<String> referencedInterfaces,
    boolean needsCollection,
    boolean needsCascade
) {
    private static final SortedSet<String> NONE = Collections.emptySortedSet();

    public static final CollectedImports EMPTY = new CollectedImports(NONE, NONE, NONE, NONE, false, false);

    public CollectedImports {
        decorators = sorted(decorators);
        relatedTypes = sorted(relatedTypes);
        referencedEnums = sorted(referencedEnums);
        referencedInterfaces = sorted(referencedInterfaces);
    }

    public static CollectedImports decorator(String name) {
        return new CollectedImports(single(name), NONE, NONE, NONE, false, false);
    }

    public static CollectedImports relatedType(String name) {
        return new CollectedImports(NONE, single(name), NONE, NONE, false, false);
    }

    public static CollectedImports referencedEnum(String name) {
        return new CollectedImports(NONE, NONE, single(name), NONE, false, false);
    }

    public static CollectedImports referencedInterface(String name) {
        return new CollectedImports(NONE, NONE, NONE, single(name), false, false);
    }

    public CollectedImports withCollection() {
        return new CollectedImports(decorators, relatedTypes, referencedEnums, referencedInterfaces, true, needsCascade);
    }

    public CollectedImports withCascade() {
        return new CollectedImports(decorators, relatedTypes, referencedEnums, referencedInterfaces, needsCollection, true);
    }

    /** Union of both sides; flags are OR-ed. */
    public CollectedImports plus(CollectedImports other) {
        return new CollectedImports(
            union(decorators, other.decorators),
            union(relatedTypes, other.relatedTypes),
            union(referencedEnums, other.referencedEnums),
            union(referencedInterfaces, other.referencedInterfaces),
            needsCollection || other.needsCollection,
            needsCascade || other.needsCascade);
    }

    private static SortedSet<String> single(String value) {
        return new TreeSet<>(Set.of(value));
    }

    private static SortedSet<String> union(Set<String> a, Set<String> b) {
        SortedSet<String> result = new TreeSet<>(a);
        result.addAll(b);
        return result;
    }

    private static SortedSet<String> sorted(SortedSet<String> values) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }
}
