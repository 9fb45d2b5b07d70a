package com.elementanchor.driver;

import com.elementanchor.model.Operation;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable, statically declared description of the extended operation forms a
 * driver binding accepts.
 */
public final class DriverCapabilities {

    private static final DriverCapabilities MINIMAL = new DriverCapabilities(EnumSet.noneOf(Operation.class));

    private static final ClassValue<DriverCapabilities> DECLARED = new ClassValue<>() {
        @Override
        protected DriverCapabilities computeValue(Class<?> type) {
            SupportsExtended declared = type.getAnnotation(SupportsExtended.class);
            if (declared == null || declared.value().length == 0) return MINIMAL;
            EnumSet<Operation> ops = EnumSet.noneOf(Operation.class);
            Collections.addAll(ops, declared.value());
            return new DriverCapabilities(ops);
        }
    };

    private final Set<Operation> extended;

    private DriverCapabilities(EnumSet<Operation> extended) {
        this.extended = Collections.unmodifiableSet(extended);
    }

    /** Minimal forms only. */
    public static DriverCapabilities minimal() {
        return MINIMAL;
    }

    public static DriverCapabilities of(Operation first, Operation... rest) {
        return new DriverCapabilities(EnumSet.of(first, rest));
    }

    /** Reads the {@link SupportsExtended} declaration of the given binding class. */
    public static DriverCapabilities declaredBy(Class<?> bindingType) {
        return DECLARED.get(bindingType);
    }

    public boolean supportsExtended(Operation operation) {
        return extended.contains(operation);
    }

    public Set<Operation> getExtendedOperations() {
        return extended;
    }

    @Override
    public String toString() {
        return "DriverCapabilities{extended=" + extended + "}";
    }
}
