package edu.uw.cse.outparam.analysis;

import edu.uw.cse.outparam.ir.AggregateType;
import edu.uw.cse.outparam.ir.Parameter;
import edu.uw.cse.outparam.ir.Place;
import edu.uw.cse.outparam.ir.SourceLocation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Classification of one function's pointer parameters.
 *
 * The place sets partition the written, never-read-first places of the
 * parameters: {@code mustWrites} are written before every return,
 * {@code mayWrites} only on some paths.
 */
public class FunctionClassification {

    public enum ParamStatus {
        EXCLUDED,
        MUST_WRITE,
        MAY_WRITE
    }

    private final String qualifiedName;
    private final SourceLocation location;
    private final List<Parameter> parameters;
    private final Set<Place> mustWrites;
    private final Set<Place> mayWrites;
    private final Map<Integer, AggregateType> candidateAggregates;

    public FunctionClassification(String qualifiedName, SourceLocation location,
                                  List<Parameter> parameters, Set<Place> mustWrites,
                                  Set<Place> mayWrites,
                                  Map<Integer, AggregateType> candidateAggregates) {
        this.qualifiedName = qualifiedName;
        this.location = location;
        this.parameters = List.copyOf(parameters);
        this.mustWrites = Set.copyOf(mustWrites);
        this.mayWrites = Set.copyOf(mayWrites);
        this.candidateAggregates = Map.copyOf(candidateAggregates);
    }

    public String getQualifiedName() {
        return qualifiedName;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public Set<Place> getMustWrites() {
        return mustWrites;
    }

    public Set<Place> getMayWrites() {
        return mayWrites;
    }

    public SortedMap<Integer, Set<Place>> mustWritesByParameter() {
        return byParameter(mustWrites);
    }

    public SortedMap<Integer, Set<Place>> mayWritesByParameter() {
        return byParameter(mayWrites);
    }

    /** Field list of the aggregate parameter {@code index} points to, if it is a candidate. */
    public Optional<AggregateType> candidateAggregate(int index) {
        return Optional.ofNullable(candidateAggregates.get(index));
    }

    public SortedMap<Integer, AggregateType> getCandidateAggregates() {
        return new TreeMap<>(candidateAggregates);
    }

    /**
     * A parameter with any may-write place is a may-write parameter; one whose
     * classified places are all must-writes is a must-write parameter.
     */
    public ParamStatus statusOf(int index) {
        boolean may = mayWrites.stream().anyMatch(p -> p.local() == index);
        if (may) return ParamStatus.MAY_WRITE;
        boolean must = mustWrites.stream().anyMatch(p -> p.local() == index);
        return must ? ParamStatus.MUST_WRITE : ParamStatus.EXCLUDED;
    }

    public List<OutputParam> outputParams() {
        List<OutputParam> result = new ArrayList<>();
        for (Parameter param : parameters) {
            ParamStatus status = statusOf(param.index());
            if (status == ParamStatus.EXCLUDED) continue;
            String aggregate = candidateAggregate(param.index()).map(AggregateType::name).orElse(null);
            result.add(new OutputParam(param.index(), param.name(),
                status == ParamStatus.MUST_WRITE, aggregate));
        }
        return result;
    }

    private static SortedMap<Integer, Set<Place>> byParameter(Set<Place> places) {
        SortedMap<Integer, Set<Place>> map = new TreeMap<>();
        for (Place p : places) {
            map.computeIfAbsent(p.local(), k -> new HashSet<>()).add(p);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionClassification other)) return false;
        return qualifiedName.equals(other.qualifiedName)
            && location.equals(other.location)
            && mustWrites.equals(other.mustWrites)
            && mayWrites.equals(other.mayWrites)
            && candidateAggregates.equals(other.candidateAggregates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifiedName, location, mustWrites, mayWrites);
    }

    @Override
    public String toString() {
        return qualifiedName + " must=" + mustWrites + " may=" + mayWrites;
    }
}
