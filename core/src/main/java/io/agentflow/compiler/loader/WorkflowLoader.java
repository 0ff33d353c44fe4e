package io.agentflow.compiler.loader;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.TreeNode;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.error.WorkflowLoadException;
import io.agentflow.compiler.model.CompilationResult;
import io.agentflow.compiler.sourcemap.SourceMap;
import io.agentflow.runtime.Workflow;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.OutputStream;
import java.lang.reflect.InvocationTargetException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles generated workflow source in memory with the platform Java compiler and instantiates
 * the resulting {@link Workflow}. Nothing is written to disk.
 *
 * <p>
 * javac errors are reported as internal errors and mapped back to the workflow source through
 * the result's source map, since valid compiler output must always compile.
 *
 * <p>
 * Requires a JDK. Thread-safe: every load uses its own file manager and class loader.
 */
public final class WorkflowLoader {

    private static final Logger LOG = LoggerFactory.getLogger(WorkflowLoader.class);

    private final JavaCompiler compiler;
    private final ClassLoader parent;
    private final String classPath;

    /**
     * @throws IllegalStateException when running on a JRE without a Java compiler
     */
    public WorkflowLoader() {
        this(Workflow.class.getClassLoader());
    }

    /** @param parent class loader that provides the runtime and Jackson to generated classes */
    public WorkflowLoader(ClassLoader parent) {
        this.compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new IllegalStateException("No Java compiler available. Are you running on a JDK (not a JRE)?");
        }
        this.parent = parent;
        this.classPath = classPath();
    }

    /**
     * Compiles and instantiates the workflow of a successful compilation.
     *
     * @throws IllegalArgumentException if the result carries no generated source
     * @throws WorkflowLoadException    if the source does not compile or cannot be instantiated
     */
    public Workflow load(CompilationResult result) {
        String source = result.javaSource()
                .orElseThrow(() -> new IllegalArgumentException("No generated source in " + result));
        String className = result.className().orElseThrow();
        return instantiate(define(result.fileId(), className, source, result.sourceMap()), result.fileId());
    }

    /**
     * Compiles one source file and loads the named class.
     *
     * @param fileId    file reported in diagnostics
     * @param className fully qualified name of the workflow class
     * @throws WorkflowLoadException if the source does not compile or the class is not a workflow
     */
    public Class<? extends Workflow> define(String fileId, String className, String source, SourceMap sourceMap) {
        long started = System.nanoTime();
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        StandardJavaFileManager standard = compiler.getStandardFileManager(diagnostics, Locale.ROOT, null);
        InMemoryFileManager fileManager = new InMemoryFileManager(standard);
        List<String> options = List.of("-classpath", classPath, "-proc:none", "-g");
        boolean compiled = compiler.getTask(
                        null, fileManager, diagnostics, options, null, List.of(new SourceObject(className, source)))
                .call();
        if (!compiled) {
            throw compileFailure(fileId, className, diagnostics, sourceMap);
        }
        Class<?> loaded;
        try {
            loaded = new BytesClassLoader(fileManager.classes, parent).loadClass(className);
        } catch (ClassNotFoundException e) {
            throw failure(fileId, "generated class " + className + " was not produced", e);
        }
        if (!Workflow.class.isAssignableFrom(loaded)) {
            throw failure(fileId, className + " does not extend " + Workflow.class.getName(), null);
        }
        LOG.debug("Loaded workflow class: file={}, class={}, classes={}, duration_ms={}",
                fileId, className, fileManager.classes.size(), (System.nanoTime() - started) / 1_000_000);
        return loaded.asSubclass(Workflow.class);
    }

    private static Workflow instantiate(Class<? extends Workflow> type, String fileId) {
        try {
            return type.getDeclaredConstructor().newInstance();
        } catch (InvocationTargetException e) {
            throw failure(fileId, "constructor of " + type.getName() + " failed: " + e.getCause(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw failure(fileId, "cannot instantiate " + type.getName() + ": " + e.getMessage(), e);
        }
    }

    private static WorkflowLoadException compileFailure(
            String fileId, String className, DiagnosticCollector<JavaFileObject> diagnostics, SourceMap sourceMap) {
        List<javax.tools.Diagnostic<? extends JavaFileObject>> errors = diagnostics.getDiagnostics().stream()
                .filter(d -> d.getKind() == javax.tools.Diagnostic.Kind.ERROR)
                .collect(Collectors.toList());
        StringBuilder detail = new StringBuilder("generated class " + className + " does not compile");
        List<String> origins = new ArrayList<>();
        for (javax.tools.Diagnostic<? extends JavaFileObject> error : errors) {
            long line = error.getLineNumber();
            detail.append("; line ").append(line).append(": ").append(error.getMessage(Locale.ROOT));
            if (line > 0) {
                sourceMap.resolve((int) line).ifPresent(entry ->
                        origins.add(entry.file() + ":" + entry.originalLine()));
            }
        }
        LOG.warn("Generated source failed to compile: file={}, class={}, errors={}", fileId, className, errors.size());
        Diagnostic diagnostic = Diagnostic.of(ErrorCode.E9999, fileId, null, Map.of("detail", detail.toString()));
        if (!origins.isEmpty()) {
            diagnostic = diagnostic.withHelp("generated from " + String.join(", ", origins));
        }
        return new WorkflowLoadException(diagnostic);
    }

    private static WorkflowLoadException failure(String fileId, String detail, Throwable cause) {
        Diagnostic diagnostic = Diagnostic.of(ErrorCode.E9999, fileId, null, Map.of("detail", detail));
        return cause == null ? new WorkflowLoadException(diagnostic) : new WorkflowLoadException(diagnostic, cause);
    }

    /** The running class path plus the jars of the types generated code compiles against. */
    private static String classPath() {
        Set<String> entries = new LinkedHashSet<>();
        String current = System.getProperty("java.class.path");
        if (current != null && !current.isEmpty()) {
            for (String entry : current.split(File.pathSeparator)) {
                entries.add(entry);
            }
        }
        for (Class<?> type : List.of(Workflow.class, JsonNode.class, TreeNode.class, JsonProperty.class, Logger.class)) {
            CodeSource codeSource = type.getProtectionDomain().getCodeSource();
            if (codeSource == null || codeSource.getLocation() == null) {
                continue;
            }
            try {
                entries.add(Path.of(codeSource.getLocation().toURI()).toString());
            } catch (URISyntaxException | IllegalArgumentException e) {
                LOG.debug("Skipping class path location of {}: {}", type.getName(), e.toString());
            }
        }
        return String.join(File.pathSeparator, entries);
    }

    /** Source held in a string. */
    private static final class SourceObject extends SimpleJavaFileObject {
        private final String code;

        SourceObject(String className, String code) {
            super(URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension), Kind.SOURCE);
            this.code = code;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return code;
        }
    }

    /** Class file written to memory. */
    private static final class ClassObject extends SimpleJavaFileObject {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        ClassObject(String className) {
            super(URI.create("bytes:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
        }

        @Override
        public OutputStream openOutputStream() {
            return bytes;
        }
    }

    /** Collects compiled classes, including nested and lambda-bearing ones, by binary name. */
    private static final class InMemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {
        private final Map<String, ClassObject> classes = new ConcurrentHashMap<>();

        InMemoryFileManager(StandardJavaFileManager fileManager) {
            super(fileManager);
        }

        @Override
        public JavaFileObject getJavaFileForOutput(
                Location location, String className, JavaFileObject.Kind kind, FileObject sibling) {
            ClassObject output = new ClassObject(className);
            classes.put(className, output);
            return output;
        }
    }

    private static final class BytesClassLoader extends ClassLoader {
        private final Map<String, ClassObject> classes;

        BytesClassLoader(Map<String, ClassObject> classes, ClassLoader parent) {
            super(parent);
            this.classes = classes;
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            ClassObject compiled = classes.get(name);
            if (compiled == null) {
                throw new ClassNotFoundException(name);
            }
            byte[] bytes = compiled.bytes.toByteArray();
            return defineClass(name, bytes, 0, bytes.length);
        }
    }
}
