package edu.uw.cse.outparam.frontend;

import edu.uw.cse.outparam.AnalysisConfig;
import edu.uw.cse.outparam.ir.AggregateType;
import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.ProgramContext;
import sootup.java.bytecode.inputlocation.JavaClassPathAnalysisInputLocation;
import sootup.java.core.JavaSootClass;
import sootup.java.core.JavaSootField;
import sootup.java.core.JavaSootMethod;
import sootup.java.core.views.JavaView;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Loads compiled classes via SootUp's JavaView and turns them into a
 * {@link LoadedProgram}: every loaded class becomes an aggregate of its
 * instance fields, every concrete method a function body.
 */
public class JimpleProgramLoader {

    private final AnalysisConfig config;

    public JimpleProgramLoader(AnalysisConfig config) {
        this.config = config;
    }

    public LoadedProgram load(Path classDir) {
        JavaClassPathAnalysisInputLocation inputLocation =
            new JavaClassPathAnalysisInputLocation(classDir.toString());
        JavaView view = new JavaView(inputLocation);

        List<JavaSootClass> classes = new ArrayList<>(view.getClasses());
        classes.sort(Comparator.comparing(JavaSootClass::getName));

        ProgramContext.Builder context = ProgramContext.builder();
        for (JavaSootClass sootClass : classes) {
            context.add(toAggregate(sootClass));
        }

        List<FunctionBody> functions = new ArrayList<>();
        for (JavaSootClass sootClass : classes) {
            for (JavaSootMethod method : sootClass.getMethods()) {
                if (!method.isConcrete()) continue;
                if (!config.accepts(method.getName())) continue;

                try {
                    functions.add(new JimpleFunctionAdapter(method).adapt());
                } catch (RuntimeException e) {
                    System.err.println("Warning: could not load body of "
                        + method.getSignature() + ": " + e.getMessage());
                }
            }
        }
        functions.sort(Comparator.comparing(FunctionBody::getQualifiedName));

        if (config.debug) {
            System.out.println("Debug== [loader] " + classes.size() + " classes, "
                + functions.size() + " methods from " + classDir);
        }
        return new LoadedProgram(context.build(), functions);
    }

    /** A class as an aggregate of its instance fields, sorted by name. */
    static AggregateType toAggregate(JavaSootClass sootClass) {
        Collection<JavaSootField> fields = sootClass.getFields();
        List<AggregateType.FieldDecl> decls = new ArrayList<>();
        for (JavaSootField field : fields) {
            if (field.isStatic()) continue;
            decls.add(new AggregateType.FieldDecl(field.getName(),
                JimpleFunctionAdapter.typeRef(field.getType())));
        }
        decls.sort(Comparator.comparing(AggregateType.FieldDecl::name));
        return new AggregateType(sootClass.getName(), decls);
    }
}
