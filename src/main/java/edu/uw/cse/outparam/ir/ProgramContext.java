package edu.uw.cse.outparam.ir;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable type context shared by every function of one program.
 * Passed explicitly to whatever needs to answer type questions.
 */
public final class ProgramContext {

    public static final ProgramContext EMPTY = new ProgramContext(Map.of());

    private final Map<String, AggregateType> aggregates;

    private ProgramContext(Map<String, AggregateType> aggregates) {
        this.aggregates = Map.copyOf(aggregates);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<AggregateType> aggregate(String name) {
        return Optional.ofNullable(aggregates.get(name));
    }

    /**
     * The aggregate a pointer type points to, if {@code type} is a pointer to
     * a named aggregate declared in this context.
     */
    public Optional<AggregateType> pointedAggregate(TypeRef type) {
        if (type instanceof TypeRef.Pointer pointer
            && pointer.pointee() instanceof TypeRef.Named named) {
            return aggregate(named.name());
        }
        return Optional.empty();
    }

    public static final class Builder {
        private final Map<String, AggregateType> aggregates = new LinkedHashMap<>();

        public Builder add(AggregateType aggregate) {
            aggregates.put(aggregate.name(), aggregate);
            return this;
        }

        public ProgramContext build() {
            return new ProgramContext(aggregates);
        }
    }
}
