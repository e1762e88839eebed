package edu.uw.cse.outparam;

import edu.uw.cse.outparam.analysis.FunctionClassification;
import edu.uw.cse.outparam.analysis.OutputParamClassifier;
import edu.uw.cse.outparam.frontend.JimpleProgramLoader;
import edu.uw.cse.outparam.frontend.LoadedProgram;
import edu.uw.cse.outparam.ir.FunctionBody;
import edu.uw.cse.outparam.ir.MalformedBodyException;
import edu.uw.cse.outparam.ir.ProgramContext;
import edu.uw.cse.outparam.output.ClassificationSink;
import edu.uw.cse.outparam.output.CollectingSink;
import edu.uw.cse.outparam.output.ResultPrinter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the output-parameter classification over a batch of functions and
 * hands every outcome to a sink.
 *
 * Functions are independent: with more than one configured thread they are
 * spread over a fixed pool, and the sink is the only shared state. A function
 * that fails is reported unchanged and the batch goes on.
 */
public class OutputParamAnalysisRunner {

    private final AnalysisConfig config;

    public OutputParamAnalysisRunner(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * Load every class under {@code classDir}, analyze its methods and print
     * the results.
     */
    public CollectingSink run(Path classDir) {
        LoadedProgram program = new JimpleProgramLoader(config).load(classDir);
        if (program.functions().isEmpty()) {
            System.out.println("No methods found in: " + classDir);
        }
        CollectingSink sink = new CollectingSink();
        run(program.context(), program.functions(), sink);
        ResultPrinter.print(sink);
        return sink;
    }

    public void run(ProgramContext context, List<FunctionBody> functions, ClassificationSink sink) {
        OutputParamClassifier classifier = new OutputParamClassifier(context, config.debug);

        List<FunctionBody> selected = new ArrayList<>();
        for (FunctionBody body : functions) {
            if (config.accepts(simpleName(body.getQualifiedName()))) {
                selected.add(body);
            }
        }

        if (config.threads == 1) {
            for (FunctionBody body : selected) {
                analyzeFunction(classifier, body, sink);
            }
            return;
        }

        ExecutorService pool = Executors.newFixedThreadPool(config.threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (FunctionBody body : selected) {
                futures.add(pool.submit(() -> analyzeFunction(classifier, body, sink)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for analysis workers", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("analysis worker failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private void analyzeFunction(OutputParamClassifier classifier, FunctionBody body,
                                 ClassificationSink sink) {
        String name = body.getQualifiedName();
        Optional<FunctionClassification> result;
        try {
            result = classifier.classify(body);
        } catch (MalformedBodyException e) {
            System.err.println("Warning: skipping malformed function " + e.getMessage());
            sink.unchanged(name, "malformed: " + e.getMessage());
            return;
        } catch (RuntimeException e) {
            System.err.println("Error analyzing " + name + ": " + e.getMessage());
            e.printStackTrace();
            sink.unchanged(name, "error: " + e.getMessage());
            return;
        }

        if (result.isPresent()) {
            sink.classified(result.get());
        } else {
            sink.unchanged(name, "no output parameters");
        }
    }

    /** "pkg.Cls.name(int,Point)" -> "name" */
    static String simpleName(String qualifiedName) {
        int paren = qualifiedName.indexOf('(');
        String s = paren >= 0 ? qualifiedName.substring(0, paren) : qualifiedName;
        int dot = s.lastIndexOf('.');
        return dot >= 0 ? s.substring(dot + 1) : s;
    }
}
