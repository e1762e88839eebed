package edu.uw.cse.outparam.frontend;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Compiles the Java fixtures under src/test/resources/testcases so the
 * front-end tests can load them back through SootUp.
 */
final class FixtureCompiler {

    static final Path TESTCASES = Path.of("src", "test", "resources", "testcases");

    private FixtureCompiler() {
    }

    /**
     * @param fixtures file names relative to the testcases directory
     * @return a fresh directory holding the compiled classes
     */
    static Path compile(String... fixtures) throws IOException {
        JavaCompiler javac = ToolProvider.getSystemJavaCompiler();
        if (javac == null) {
            throw new IllegalStateException("no system Java compiler; run the tests on a JDK");
        }

        Path classDir = Files.createTempDirectory("outparam-fixtures");
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager files = javac.getStandardFileManager(diagnostics, null, null)) {
            Iterable<? extends JavaFileObject> units = files.getJavaFileObjectsFromPaths(
                List.of(fixtures).stream().map(TESTCASES::resolve).toList());
            // -g keeps the line numbers that end up in the report locations
            List<String> options = List.of("-d", classDir.toString(), "-g", "--release", "17");
            if (!javac.getTask(null, files, diagnostics, options, null, units).call()) {
                StringBuilder errors = new StringBuilder("fixture compilation failed:");
                for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
                    errors.append("\n  ").append(d);
                }
                throw new IllegalStateException(errors.toString());
            }
        }
        return classDir;
    }
}
