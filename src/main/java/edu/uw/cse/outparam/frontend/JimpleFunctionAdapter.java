package edu.uw.cse.outparam.frontend;

import edu.uw.cse.outparam.ir.BasicBlock;
import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.Operand;
import edu.uw.cse.outparam.ir.Parameter;
import edu.uw.cse.outparam.ir.Place;
import edu.uw.cse.outparam.ir.Projection;
import edu.uw.cse.outparam.ir.Rvalue;
import edu.uw.cse.outparam.ir.SourceLocation;
import edu.uw.cse.outparam.ir.Statement;
import edu.uw.cse.outparam.ir.Terminator;
import edu.uw.cse.outparam.ir.TypeRef;
import sootup.core.graph.StmtGraph;
import sootup.core.jimple.basic.Local;
import sootup.core.jimple.basic.NoPositionInformation;
import sootup.core.jimple.basic.Value;
import sootup.core.jimple.common.constant.Constant;
import sootup.core.jimple.common.constant.IntConstant;
import sootup.core.jimple.common.expr.AbstractBinopExpr;
import sootup.core.jimple.common.expr.AbstractInstanceInvokeExpr;
import sootup.core.jimple.common.expr.AbstractInvokeExpr;
import sootup.core.jimple.common.expr.JCastExpr;
import sootup.core.jimple.common.expr.JInstanceOfExpr;
import sootup.core.jimple.common.expr.JLengthExpr;
import sootup.core.jimple.common.expr.JNegExpr;
import sootup.core.jimple.common.expr.JNewArrayExpr;
import sootup.core.jimple.common.expr.JNewExpr;
import sootup.core.jimple.common.ref.JArrayRef;
import sootup.core.jimple.common.ref.JInstanceFieldRef;
import sootup.core.jimple.common.ref.JParameterRef;
import sootup.core.jimple.common.stmt.JAssignStmt;
import sootup.core.jimple.common.stmt.JIdentityStmt;
import sootup.core.jimple.common.stmt.JInvokeStmt;
import sootup.core.jimple.common.stmt.JReturnStmt;
import sootup.core.jimple.common.stmt.JReturnVoidStmt;
import sootup.core.jimple.common.stmt.JThrowStmt;
import sootup.core.jimple.common.stmt.Stmt;
import sootup.core.model.Position;
import sootup.core.types.ArrayType;
import sootup.core.types.ClassType;
import sootup.core.types.Type;
import sootup.java.core.JavaSootMethod;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates the Jimple body of one method into a {@link FunctionBody}.
 *
 * Every Jimple statement becomes its own basic block, so block edges are
 * exactly the statement graph's edges. Parameter {@code k} (0-based in
 * Jimple) becomes local {@code k + 1}; the receiver and all other Jimple
 * locals get fresh locals after the parameters. Reference-typed values are
 * pointers, so {@code p.<C: int f> = v} writes {@code (*p).f}.
 *
 * Calls are block terminators with their exceptional successors as unwind
 * edges. Any other statement covered by a trap becomes two blocks: an empty
 * one that branches to the handlers or on to a block holding the statement,
 * so a handler sees the state from before the statement took effect.
 * {@code return v} assigns {@code v} to the return slot, local 0.
 */
public class JimpleFunctionAdapter {

    private final JavaSootMethod method;
    private final Map<String, Integer> locals = new HashMap<>();
    private int nextLocal;

    // statements split off from their trap check, numbered after the statement blocks
    private final List<BasicBlock> guardedBlocks = new ArrayList<>();
    private int firstGuardedBlock;

    public JimpleFunctionAdapter(JavaSootMethod method) {
        this.method = method;
    }

    public FunctionBody adapt() {
        StmtGraph<?> cfg = method.getBody().getStmtGraph();

        // entry first, then the rest in graph order
        Stmt start = cfg.getStartingStmt();
        List<Stmt> stmts = new ArrayList<>();
        stmts.add(start);
        for (Stmt stmt : cfg.getStmts()) {
            if (stmt != start) stmts.add(stmt);
        }
        Map<Stmt, Integer> blockOf = new IdentityHashMap<>();
        for (int i = 0; i < stmts.size(); i++) {
            blockOf.put(stmts.get(i), i);
        }

        List<Type> paramTypes = method.getSignature().getParameterTypes();
        String[] paramNames = new String[paramTypes.size()];
        for (Stmt stmt : stmts) {
            if (!(stmt instanceof JIdentityStmt identity)) continue;
            Value lhs = identity.getLeftOp();
            Value rhs = identity.getRightOp();
            if (lhs instanceof Local local && rhs instanceof JParameterRef paramRef) {
                locals.put(local.getName(), paramRef.getIndex() + 1);
                paramNames[paramRef.getIndex()] = local.getName();
            }
        }
        List<Parameter> parameters = new ArrayList<>();
        for (int i = 0; i < paramTypes.size(); i++) {
            String name = paramNames[i] != null ? paramNames[i] : "arg" + i;
            parameters.add(new Parameter(i + 1, name, typeRef(paramTypes.get(i))));
        }
        nextLocal = paramTypes.size() + 1;

        guardedBlocks.clear();
        firstGuardedBlock = stmts.size();
        List<BasicBlock> blocks = new ArrayList<>();
        for (int i = 0; i < stmts.size(); i++) {
            Stmt stmt = stmts.get(i);
            List<Integer> normal = new ArrayList<>();
            for (Stmt succ : cfg.successors(stmt)) {
                normal.add(blockOf.get(succ));
            }
            List<Integer> exceptional = new ArrayList<>();
            for (Stmt handler : cfg.exceptionalSuccessors(stmt).values()) {
                exceptional.add(blockOf.get(handler));
            }
            blocks.add(translate(i, stmt, normal, exceptional));
        }
        blocks.addAll(guardedBlocks);

        return new FunctionBody(qualifiedName(), sourceLocation(stmts), parameters, nextLocal, blocks);
    }

    private BasicBlock translate(int index, Stmt stmt, List<Integer> normal, List<Integer> exceptional) {
        List<Statement> statements = new ArrayList<>();
        Terminator terminator;

        if (stmt instanceof JAssignStmt assign
            && assign.getRightOp() instanceof AbstractInvokeExpr invoke) {
            terminator = call(invoke, placeOf(assign.getLeftOp()), normal, exceptional);
        } else if (stmt instanceof JInvokeStmt invokeStmt) {
            terminator = call(invokeStmt.getInvokeExpr(), null, normal, exceptional);
        } else if (stmt instanceof JAssignStmt assign) {
            Place lhs = placeOf(assign.getLeftOp());
            if (lhs != null) {
                statements.add(new Statement.Assign(lhs, rvalueOf(assign.getRightOp())));
            } else {
                statements.add(new Statement.Nop(stmt.toString()));
            }
            terminator = flow(normal);
        } else if (stmt instanceof JIdentityStmt identity) {
            // binds parameters and the receiver; parameters are already mapped
            Value lhs = identity.getLeftOp();
            if (lhs instanceof Local local) {
                local(local);
            }
            statements.add(new Statement.Nop(stmt.toString()));
            terminator = flow(normal);
        } else if (stmt instanceof JReturnStmt ret) {
            statements.add(new Statement.Assign(Place.local(0), new Rvalue.Use(operandOf(ret.getOp()))));
            terminator = Terminator.returns();
        } else if (stmt instanceof JReturnVoidStmt) {
            terminator = Terminator.returns();
        } else if (stmt instanceof JThrowStmt) {
            terminator = Terminator.throwsTo(exceptional);
        } else {
            // if, goto, switch, nop, monitors: control flow only
            terminator = flow(normal);
        }

        Terminator.Kind kind = terminator.getKind();
        if (exceptional.isEmpty() || kind == Terminator.Kind.CALL || kind == Terminator.Kind.THROW) {
            return new BasicBlock(index, statements, terminator);
        }
        int guarded = firstGuardedBlock + guardedBlocks.size();
        guardedBlocks.add(new BasicBlock(guarded, statements, terminator));
        List<Integer> targets = new ArrayList<>();
        targets.add(guarded);
        targets.addAll(exceptional);
        return new BasicBlock(index, List.of(), Terminator.branch(targets));
    }

    private static Terminator flow(List<Integer> successors) {
        if (successors.isEmpty()) return Terminator.unreachable();
        if (successors.size() == 1) return Terminator.gotoBlock(successors.get(0));
        return Terminator.branch(successors);
    }

    private Terminator call(AbstractInvokeExpr invoke, Place destination,
                            List<Integer> normal, List<Integer> exceptional) {
        List<Operand> args = new ArrayList<>();
        if (invoke instanceof AbstractInstanceInvokeExpr instanceInvoke) {
            args.add(operandOf(instanceInvoke.getBase()));
        }
        for (Value arg : invoke.getArgs()) {
            args.add(operandOf(arg));
        }
        Integer target = normal.isEmpty() ? null : normal.get(0);
        return Terminator.call(invoke.getMethodSignature().toString(), args, destination,
            target, exceptional);
    }

    /** The place an lvalue or rvalue denotes, or null if it is not a local place. */
    private Place placeOf(Value value) {
        if (value instanceof Local local) {
            return Place.local(local(local));
        }
        if (value instanceof JInstanceFieldRef fieldRef) {
            return new Place(local((Local) fieldRef.getBase()),
                List.of(Projection.DEREF, Projection.field(fieldRef.getFieldSignature().getName())));
        }
        if (value instanceof JArrayRef arrayRef) {
            Value index = arrayRef.getIndex();
            Projection element;
            if (index instanceof Local indexLocal) {
                element = Projection.index(local(indexLocal));
            } else if (index instanceof IntConstant constant) {
                element = Projection.constantIndex(constant.getValue());
            } else {
                return null;
            }
            return new Place(local((Local) arrayRef.getBase()), List.of(Projection.DEREF, element));
        }
        // static fields and anything else live outside the function's locals
        return null;
    }

    private Operand operandOf(Value value) {
        Place place = placeOf(value);
        if (place != null) {
            return Operand.copy(place);
        }
        return Operand.constant(value.toString());
    }

    private Rvalue rvalueOf(Value rhs) {
        if (rhs instanceof Local || rhs instanceof Constant
            || rhs instanceof JInstanceFieldRef || rhs instanceof JArrayRef) {
            return new Rvalue.Use(operandOf(rhs));
        }
        if (rhs instanceof JCastExpr cast) {
            return new Rvalue.Cast(operandOf(cast.getOp()), typeRef(cast.getType()));
        }
        if (rhs instanceof JInstanceOfExpr instanceOf) {
            return new Rvalue.UnaryOp("instanceof", operandOf(instanceOf.getOp()));
        }
        if (rhs instanceof JNegExpr neg) {
            return new Rvalue.UnaryOp("neg", operandOf(neg.getOp()));
        }
        if (rhs instanceof JLengthExpr length && length.getOp() instanceof Local array) {
            return new Rvalue.Len(Place.deref(local(array)));
        }
        if (rhs instanceof AbstractBinopExpr binop) {
            return new Rvalue.BinaryOp(binop.getClass().getSimpleName(),
                operandOf(binop.getOp1()), operandOf(binop.getOp2()), false);
        }
        if (rhs instanceof JNewExpr newExpr) {
            return new Rvalue.Aggregate(newExpr.getType().getFullyQualifiedName(), List.of());
        }
        if (rhs instanceof JNewArrayExpr newArray) {
            return new Rvalue.Repeat(Operand.constant("default"), operandOf(newArray.getSize()));
        }
        return new Rvalue.Opaque(rhs.toString());
    }

    private int local(Local local) {
        return locals.computeIfAbsent(local.getName(), name -> nextLocal++);
    }

    private String qualifiedName() {
        List<String> simpleTypes = method.getSignature().getParameterTypes()
            .stream()
            .map(Type::toString)
            .map(t -> { int dot = t.lastIndexOf('.'); return dot >= 0 ? t.substring(dot + 1) : t; })
            .toList();
        return method.getDeclaringClassType().getFullyQualifiedName() + "." + method.getName()
            + "(" + String.join(",", simpleTypes) + ")";
    }

    private SourceLocation sourceLocation(List<Stmt> stmts) {
        int minLine = Integer.MAX_VALUE;
        for (Stmt stmt : stmts) {
            Position pos = stmt.getPositionInfo().getStmtPosition();
            if (pos instanceof NoPositionInformation) continue;
            if (pos.getFirstLine() > 0) minLine = Math.min(minLine, pos.getFirstLine());
        }
        String unit = method.getDeclaringClassType().getFullyQualifiedName();
        return new SourceLocation(unit, minLine == Integer.MAX_VALUE ? -1 : minLine);
    }

    /** Java references are pointers; class types point to a named aggregate. */
    static TypeRef typeRef(Type type) {
        if (type instanceof ClassType classType) {
            return TypeRef.pointerTo(TypeRef.named(classType.getFullyQualifiedName()));
        }
        if (type instanceof ArrayType) {
            return TypeRef.pointerTo(TypeRef.scalar(type.toString()));
        }
        return TypeRef.scalar(type.toString());
    }
}
