package edu.uw.cse.outparam.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * The control-flow graph of one function, as handed over by a front end.
 * Block 0 is the entry. Read-only once built.
 */
public final class FunctionBody {

    private final String qualifiedName;
    private final SourceLocation location;
    private final List<Parameter> parameters;
    private final int localCount;
    private final List<BasicBlock> blocks;

    // derived, computed once
    private List<List<Integer>> predecessors;

    public FunctionBody(String qualifiedName, SourceLocation location, List<Parameter> parameters,
                        int localCount, List<BasicBlock> blocks) {
        this.qualifiedName = Objects.requireNonNull(qualifiedName);
        this.location = Objects.requireNonNull(location);
        this.parameters = List.copyOf(parameters);
        this.localCount = localCount;
        this.blocks = List.copyOf(blocks);
    }

    public static Builder builder(String qualifiedName) {
        return new Builder(qualifiedName);
    }

    public String getQualifiedName() {
        return qualifiedName;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public int parameterCount() {
        return parameters.size();
    }

    /** Locals 1..n are parameters; 0 is the return slot. */
    public boolean isParameter(int local) {
        return local > 0 && local <= parameters.size();
    }

    public int getLocalCount() {
        return localCount;
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public BasicBlock block(int index) {
        return blocks.get(index);
    }

    public int blockCount() {
        return blocks.size();
    }

    public synchronized List<Integer> predecessors(int block) {
        if (predecessors == null) {
            List<List<Integer>> preds = new ArrayList<>();
            for (int i = 0; i < blocks.size(); i++) {
                preds.add(new ArrayList<>());
            }
            for (BasicBlock b : blocks) {
                for (int s : b.successors()) {
                    preds.get(s).add(b.index());
                }
            }
            List<List<Integer>> frozen = new ArrayList<>();
            for (List<Integer> p : preds) {
                frozen.add(List.copyOf(p));
            }
            predecessors = frozen;
        }
        return predecessors.get(block);
    }

    /**
     * Blocks reachable from the entry, in postorder.
     */
    public List<Integer> postorder() {
        List<Integer> order = new ArrayList<>();
        if (blocks.isEmpty()) return order;
        BitSet visited = new BitSet(blocks.size());
        Deque<int[]> stack = new ArrayDeque<>(); // {block, next successor position}
        stack.push(new int[]{0, 0});
        visited.set(0);
        while (!stack.isEmpty()) {
            int[] top = stack.peek();
            List<Integer> succ = blocks.get(top[0]).successors();
            if (top[1] < succ.size()) {
                int next = succ.get(top[1]++);
                if (!visited.get(next)) {
                    visited.set(next);
                    stack.push(new int[]{next, 0});
                }
            } else {
                order.add(top[0]);
                stack.pop();
            }
        }
        return order;
    }

    public List<Integer> reversePostorder() {
        List<Integer> order = postorder();
        Collections.reverse(order);
        return order;
    }

    public BitSet reachableBlocks() {
        BitSet reachable = new BitSet(blocks.size());
        for (int b : postorder()) {
            reachable.set(b);
        }
        return reachable;
    }

    /**
     * Checks that every block, successor edge and place is defined.
     *
     * @throws MalformedBodyException on the first inconsistency found
     */
    public void validate() {
        if (blocks.isEmpty()) {
            throw new MalformedBodyException(qualifiedName, "body has no blocks");
        }
        if (localCount <= parameters.size()) {
            throw new MalformedBodyException(qualifiedName,
                "local count " + localCount + " does not cover " + parameters.size() + " parameters");
        }
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).index() != i + 1) {
                throw new MalformedBodyException(qualifiedName,
                    "parameter " + parameters.get(i).name() + " has index "
                        + parameters.get(i).index() + ", expected " + (i + 1));
            }
        }
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            if (block.index() != i) {
                throw new MalformedBodyException(qualifiedName,
                    "block at position " + i + " is numbered " + block.index());
            }
            for (Statement stmt : block.statements()) {
                if (stmt instanceof Statement.Assign assign) {
                    checkPlace(assign.lhs(), i);
                    for (Place p : referencedPlaces(assign.rhs())) {
                        checkPlace(p, i);
                    }
                }
            }
            Terminator term = block.terminator();
            for (int s : term.getSuccessors()) {
                if (s < 0 || s >= blocks.size()) {
                    throw new MalformedBodyException(qualifiedName,
                        "block " + i + " jumps to undefined block " + s);
                }
            }
            for (Operand arg : term.getArgs()) {
                arg.place().ifPresent(p -> checkPlace(p, block.index()));
            }
            term.getDestination().ifPresent(p -> checkPlace(p, block.index()));
        }
    }

    private void checkPlace(Place place, int block) {
        if (place.local() >= localCount) {
            throw new MalformedBodyException(qualifiedName,
                "block " + block + " uses undefined local _" + place.local());
        }
        for (Projection p : place.projections()) {
            if (p instanceof Projection.Index index && index.getLocal() >= localCount) {
                throw new MalformedBodyException(qualifiedName,
                    "block " + block + " indexes with undefined local _" + index.getLocal());
            }
        }
    }

    /** Every place mentioned by a right-hand side, read or not. */
    private static List<Place> referencedPlaces(Rvalue rvalue) {
        List<Place> places = new ArrayList<>();
        if (rvalue instanceof Rvalue.Use r) {
            r.operand().place().ifPresent(places::add);
        } else if (rvalue instanceof Rvalue.Repeat r) {
            r.operand().place().ifPresent(places::add);
            r.count().place().ifPresent(places::add);
        } else if (rvalue instanceof Rvalue.Cast r) {
            r.operand().place().ifPresent(places::add);
        } else if (rvalue instanceof Rvalue.UnaryOp r) {
            r.operand().place().ifPresent(places::add);
        } else if (rvalue instanceof Rvalue.ShallowInitBox r) {
            r.operand().place().ifPresent(places::add);
        } else if (rvalue instanceof Rvalue.BinaryOp r) {
            r.left().place().ifPresent(places::add);
            r.right().place().ifPresent(places::add);
        } else if (rvalue instanceof Rvalue.Aggregate r) {
            for (Operand o : r.operands()) {
                o.place().ifPresent(places::add);
            }
        } else if (rvalue instanceof Rvalue.CopyForDeref r) {
            places.add(r.place());
        } else if (rvalue instanceof Rvalue.Ref r) {
            places.add(r.place());
        } else if (rvalue instanceof Rvalue.AddressOf r) {
            places.add(r.place());
        } else if (rvalue instanceof Rvalue.Len r) {
            places.add(r.place());
        } else if (rvalue instanceof Rvalue.Discriminant r) {
            places.add(r.place());
        }
        return places;
    }

    @Override
    public String toString() {
        return qualifiedName + " (" + blocks.size() + " blocks)";
    }

    /**
     * Assembles a body block by block; parameters take locals 1..n in the
     * order they are added, later locals come from {@link #newLocal()}.
     */
    public static final class Builder {
        private final String qualifiedName;
        private SourceLocation location = SourceLocation.UNKNOWN;
        private final List<Parameter> parameters = new ArrayList<>();
        private final List<BasicBlock> blocks = new ArrayList<>();
        private int nextLocal = 1;

        private Builder(String qualifiedName) {
            this.qualifiedName = qualifiedName;
        }

        public Builder location(SourceLocation location) {
            this.location = location;
            return this;
        }

        /** Adds a parameter and returns its local. Must precede {@link #newLocal()}. */
        public int parameter(String name, TypeRef type) {
            if (nextLocal != parameters.size() + 1) {
                throw new IllegalStateException("parameters must be declared before temporaries");
            }
            int local = nextLocal++;
            parameters.add(new Parameter(local, name, type));
            return local;
        }

        public int newLocal() {
            return nextLocal++;
        }

        /** Index the next {@link #block} call will receive. */
        public int nextBlock() {
            return blocks.size();
        }

        public Builder block(List<Statement> statements, Terminator terminator) {
            blocks.add(new BasicBlock(blocks.size(), statements, terminator));
            return this;
        }

        public FunctionBody build() {
            return new FunctionBody(qualifiedName, location, parameters, nextLocal, blocks);
        }
    }
}
