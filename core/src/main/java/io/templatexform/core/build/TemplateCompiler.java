package io.templatexform.core.build;

import io.templatexform.core.build.dsl.DslHandlerRegistry;
import io.templatexform.core.error.SourceParseException;
import io.templatexform.core.model.BuildResult;
import io.templatexform.core.model.ImportDeclaration;
import io.templatexform.core.model.Root;
import io.templatexform.core.model.TemplateOutput;
import io.templatexform.core.parse.MarkupParser;
import io.templatexform.core.parse.TsxParser;
import io.templatexform.core.parse.ast.Program;
import io.templatexform.core.spi.TemplateRenderer;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the build stage: parses component source and lowers it into an annotated tree.
 *
 * <p>Thread-safe as long as the parser and the DSL handler registry are: a fresh {@link
 * TreeBuilder} is created for every call.
 */
public final class TemplateCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateCompiler.class);
    private static final Pattern PASCAL_CASE = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");

    private final MarkupParser parser;
    private final DslHandlerRegistry dslHandlers;

    /** Creates a compiler with the default TSX parser and the built-in DSL handlers. */
    public TemplateCompiler() {
        this(new TsxParser(), DslHandlerRegistry.withDefaults());
    }

    public TemplateCompiler(MarkupParser parser, DslHandlerRegistry dslHandlers) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.dslHandlers = Objects.requireNonNull(dslHandlers, "dslHandlers must not be null");
    }

    public DslHandlerRegistry dslHandlers() {
        return dslHandlers;
    }

    /**
     * Builds the annotated tree of one component source. Parse failures and unexpected internal
     * errors are reported through {@link BuildResult#errors()}; this method does not throw for bad
     * input.
     *
     * @param source  component source text
     * @param options build options, {@code null} for defaults
     */
    public BuildResult buildTree(String source, BuildOptions options) {
        Objects.requireNonNull(source, "source must not be null");
        BuildOptions effective = options != null ? options : BuildOptions.defaults();
        String sourceFile = effective.sourceFile();

        Program program;
        try {
            program = parser.parse(source, sourceFile);
        } catch (SourceParseException e) {
            LOG.warn("tree.parse_failed: source={}, line={}, column={}, error={}",
                    sourceFile, e.line(), e.column(), e.getMessage());
            return BuildResult.failed(sourceFile, e.toDiagnostic());
        }

        try {
            TreeBuilder builder = new TreeBuilder(program, effective, dslHandlers);
            Root tree = builder.build();
            List<String> dependencies = dependencies(tree);
            LOG.info(
                    "tree.built: source={}, component={}, type={}, elements={}, warnings={}",
                    sourceFile,
                    tree.meta().componentName(),
                    tree.meta().componentType(),
                    TreeQueries.countElements(tree),
                    builder.warnings().size());
            return new BuildResult(
                    tree,
                    TreeQueries.collectVariables(tree),
                    builder.referencedIdentifiers(),
                    dependencies,
                    builder.warnings(),
                    List.of());
        } catch (RuntimeException e) {
            LOG.error("tree.build_failed: source={}", sourceFile, e);
            String file = sourceFile != null ? sourceFile : "<source>";
            return BuildResult.failed(sourceFile, file + ": internal error: " + e);
        }
    }

    /**
     * Builds a tree and renders it with {@code renderer}, which must already be initialized. The
     * output is {@code null} when the build failed or produced an empty tree.
     */
    public CompileOutcome compile(String source, BuildOptions options, TemplateRenderer renderer) {
        Objects.requireNonNull(renderer, "renderer must not be null");
        BuildResult build = buildTree(source, options);
        if (build.hasErrors() || build.isEmpty()) {
            return new CompileOutcome(build, null);
        }
        TemplateOutput output = renderer.transform(build.tree());
        return new CompileOutcome(build, output);
    }

    private static List<String> dependencies(Root tree) {
        SortedSet<String> dependencies = new TreeSet<>(TreeQueries.collectDependencies(tree));
        for (ImportDeclaration declaration : tree.meta().imports()) {
            if (declaration.typeOnly() || !declaration.isRelative()) {
                continue;
            }
            if (isComponentName(declaration.defaultImport())) {
                dependencies.add(declaration.defaultImport());
            }
            for (String specifier : declaration.namedImports()) {
                if (specifier.startsWith("type ")) {
                    continue;
                }
                int alias = specifier.indexOf(" as ");
                String local = alias >= 0 ? specifier.substring(alias + 4).trim() : specifier.trim();
                if (isComponentName(local)) {
                    dependencies.add(local);
                }
            }
        }
        return List.copyOf(dependencies);
    }

    private static boolean isComponentName(String name) {
        return name != null && PASCAL_CASE.matcher(name).matches();
    }
}
