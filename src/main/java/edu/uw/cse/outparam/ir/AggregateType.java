package edu.uw.cse.outparam.ir;

import java.util.List;

/**
 * A named record-like type and its fields, in declaration order where the
 * front end knows it.
 */
public record AggregateType(String name, List<FieldDecl> fields) {

    public record FieldDecl(String name, TypeRef type) {
        @Override
        public String toString() {
            return name + ": " + type;
        }
    }

    public AggregateType {
        fields = List.copyOf(fields);
    }
}
