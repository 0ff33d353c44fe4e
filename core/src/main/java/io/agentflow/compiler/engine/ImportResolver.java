package io.agentflow.compiler.engine;

import io.agentflow.compiler.ast.CompilationUnit;
import io.agentflow.compiler.ast.Declaration;
import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.error.CompilerException;
import io.agentflow.compiler.source.SourceFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and parses the local imports of a unit, depth first.
 *
 * <p>
 * An import path is resolved against the directory of the importing file; the file id of the
 * imported unit is that resolved path. Each file is parsed once even when imported from several
 * places. Units come back dependencies first, so a later unit may override an earlier one.
 * External imports ({@code import name from source}) are recorded by the code generator only.
 *
 * <p>
 * Not thread-safe; one instance per compilation.
 */
final class ImportResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ImportResolver.class);

    private final Function<SourceFile, CompilationUnit> parser;
    private final List<CompilationUnit> units = new ArrayList<>();
    private final List<SourceFile> sources = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<Path> done = new HashSet<>();
    private final Deque<Path> stack = new ArrayDeque<>();

    /**
     * Outcome of import resolution.
     *
     * @param units       imported units, dependencies first
     * @param sources     texts of the imported files
     * @param diagnostics E0005, E0006 and lexical or syntax errors of imported files
     */
    record Resolution(List<CompilationUnit> units, List<SourceFile> sources, List<Diagnostic> diagnostics) {

        boolean hasErrors() {
            return diagnostics.stream().anyMatch(Diagnostic::isError);
        }
    }

    /** @param parser lexes, parses and transforms one file; throws {@link CompilerException} */
    ImportResolver(Function<SourceFile, CompilationUnit> parser) {
        this.parser = parser;
    }

    Resolution resolve(CompilationUnit root) {
        Path rootPath = key(Path.of(root.fileId()));
        stack.push(rootPath);
        done.add(rootPath);
        visit(root);
        stack.pop();
        return new Resolution(List.copyOf(units), List.copyOf(sources), List.copyOf(diagnostics));
    }

    private void visit(CompilationUnit unit) {
        for (Declaration.ImportStmt importStmt : unit.imports()) {
            if (!importStmt.isLocal()) {
                continue;
            }
            Path target = Path.of(unit.fileId()).resolveSibling(importStmt.path()).normalize();
            Path targetKey = key(target);
            if (stack.contains(targetKey)) {
                diagnostics.add(Diagnostic.of(
                        ErrorCode.E0006, unit.fileId(), importStmt.span(), Map.of("cycle", cycle(targetKey, target))));
                continue;
            }
            if (!done.add(targetKey)) {
                continue;
            }
            load(unit, importStmt, target, targetKey);
        }
    }

    private void load(CompilationUnit importer, Declaration.ImportStmt importStmt, Path target, Path targetKey) {
        String fileId = fileId(target);
        String text;
        try {
            text = Files.readString(target, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Import could not be read: file={}, import={}, reason={}", importer.fileId(), fileId, e.toString());
            diagnostics.add(Diagnostic.of(
                            ErrorCode.E0005, importer.fileId(), importStmt.span(), Map.of("path", importStmt.path()))
                    .withHelp("resolved to " + fileId));
            return;
        }
        SourceFile source = new SourceFile(fileId, text);
        sources.add(source);
        CompilationUnit imported;
        try {
            imported = parser.apply(source);
        } catch (CompilerException e) {
            diagnostics.add(e.diagnostic());
            return;
        }
        stack.push(targetKey);
        visit(imported);
        stack.pop();
        units.add(imported);
        LOG.debug("Resolved import: file={}, import={}, declarations={}",
                importer.fileId(), fileId, imported.declarations().size());
    }

    /** {@code a.af -> b.af -> a.af}, from the first visit of {@code target} down to the importer. */
    private String cycle(Path targetKey, Path target) {
        List<Path> path = new ArrayList<>(stack);
        Collections.reverse(path);
        int start = path.indexOf(targetKey);
        List<String> names = path.subList(start, path.size()).stream()
                .map(ImportResolver::fileName)
                .collect(Collectors.toCollection(ArrayList::new));
        names.add(fileName(target));
        return String.join(" -> ", names);
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static String fileId(Path path) {
        return path.toString().replace('\\', '/');
    }
}
