package com.protogen.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protogen.generator.codegen.model.CompileJob;
import com.protogen.generator.codegen.model.GeneratedFile;
import com.protogen.generator.codegen.model.ToolDiagnostics;
import com.protogen.generator.exception.SchemaException;
import com.protogen.generator.exception.UnresolvedImportException;
import com.protogen.generator.model.ExtendDescriptor;
import com.protogen.generator.model.ProtoDescriptor;
import com.protogen.generator.model.TypeDescriptor;
import com.protogen.generator.parser.ProtoResolver;
import com.protogen.generator.resolver.ExtensionMerger;
import com.protogen.generator.resolver.SymbolTable;
import com.protogen.generator.resolver.TypeIndexer;
import com.protogen.generator.resolver.TypeResolver;

/**
 * A compilation session: loads schema files with their imports, resolves every type reference
 * across them and renders registered jobs through templates.
 *
 * Paths given to the setters are relative to the base path. The file cache and symbol table
 * belong to this instance only. Not thread-safe.
 *
 * <pre>
 * Project project = new Project(baseDir)
 *         .setTemplateDir("templates")
 *         .setOutDir("genfiles");
 * project.addJob("protos/person.proto", "java.ftl", ".java");
 * project.compile();
 * </pre>
 */
public class Project {
    private static final Logger log = LoggerFactory.getLogger(Project.class);

    static final String DEFAULT_SUFFIX = ".txt";
    static final String DEFAULT_OUT_DIR = "genfiles";

    private final Path basePath;
    private List<Path> protoPaths;
    private Path templateDir;
    private Path defaultOutDir;
    private final Map<String, Path> outDirsBySuffix = new HashMap<>();
    private String defaultSuffix = DEFAULT_SUFFIX;
    private OutputFunction outputFunction = OutputFunction.WRITE_FILE;
    private TemplateRenderer renderer;

    private ProtoResolver protoResolver;
    private final SymbolTable symbolTable = new SymbolTable();
    private final ExtensionMerger extensionMerger = new ExtensionMerger();
    private final Set<ExtendDescriptor> reportedExtends = new HashSet<>();
    private final List<CompileJob> jobs = new ArrayList<>();
    private final ToolDiagnostics diagnostics = new ToolDiagnostics();
    /** First indexing or resolution failure; the loaded set is unusable once set. */
    private SchemaException resolutionFailure;

    public Project(Path basePath) {
        this.basePath = Objects.requireNonNull(basePath, "basePath").toAbsolutePath().normalize();
        this.protoPaths = List.of(this.basePath);
        this.templateDir = this.basePath;
        this.defaultOutDir = this.basePath.resolve(DEFAULT_OUT_DIR);
    }

    public Path getBasePath() {
        return basePath;
    }

    /**
     * Replaces the import search roots. The bundled classpath include root is always searched last.
     *
     * @throws IllegalStateException once a file has been loaded
     */
    public Project setProtoPaths(List<Path> paths) {
        if (protoResolver != null) {
            throw new IllegalStateException("Proto paths cannot change after files have been loaded");
        }
        List<Path> resolved = new ArrayList<>();
        for (Path path : paths) {
            resolved.add(basePath.resolve(path).normalize());
        }
        this.protoPaths = List.copyOf(resolved);
        return this;
    }

    public List<Path> getProtoPaths() {
        return protoPaths;
    }

    public Project setTemplateDir(String dir) {
        return setTemplateDir(Path.of(dir));
    }

    public Project setTemplateDir(Path dir) {
        this.templateDir = basePath.resolve(dir).normalize();
        this.renderer = null;
        return this;
    }

    public Project setOutDir(String dir) {
        return setOutDir(Path.of(dir));
    }

    public Project setOutDir(Path dir) {
        this.defaultOutDir = basePath.resolve(dir).normalize();
        return this;
    }

    /**
     * Output directory for jobs with the given suffix only.
     */
    public Project setOutDir(String dir, String suffix) {
        outDirsBySuffix.put(suffix, basePath.resolve(dir).normalize());
        return this;
    }

    public Project setDefaultSuffix(String suffix) {
        this.defaultSuffix = Objects.requireNonNull(suffix, "suffix");
        return this;
    }

    public Project setOutputFunction(OutputFunction outputFunction) {
        this.outputFunction = Objects.requireNonNull(outputFunction, "outputFunction");
        return this;
    }

    public Project setRenderer(TemplateRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        return this;
    }

    /**
     * Loads a file and everything it imports, then indexes and resolves every newly loaded file.
     * Loading a file that is already cached returns the cached instance. A file or import that
     * cannot be found leaves nothing behind, so the call can be retried. A failure while indexing or
     * resolving types is final for this project.
     *
     * @throws UnresolvedImportException if the file or one of its imports cannot be found
     * @throws com.protogen.generator.exception.ProtoSyntaxException on malformed source
     * @throws com.protogen.generator.exception.UnresolvedTypeException if a type reference cannot be bound
     * @throws IllegalStateException if an earlier call failed to index or resolve its files
     */
    public ProtoDescriptor addProto(String fileName) {
        checkNotFailed();
        ProtoDescriptor proto = protoResolver().load(fileName);

        List<ProtoDescriptor> loaded = protoResolver.drainPending();
        if (!loaded.isEmpty()) {
            try {
                // every new file is indexed before any reference in them is bound
                new TypeIndexer(symbolTable).index(loaded);
                new TypeResolver(symbolTable).resolve(loaded);
            } catch (SchemaException e) {
                resolutionFailure = e;
                throw e;
            }
            log.info("Loaded {} proto files for {} ({} types known)", loaded.size(), fileName, symbolTable.size());
        }
        return proto;
    }

    /**
     * Registers a render job, loading the file if needed.
     *
     * @param suffix output suffix, or {@code null} for the default suffix
     */
    public Project addJob(String fileName, String templateName, String suffix) {
        ProtoDescriptor proto = addProto(fileName);
        jobs.add(new CompileJob(proto, templateName, suffix != null ? suffix : defaultSuffix));
        return this;
    }

    public Project addJob(String fileName, String templateName) {
        return addJob(fileName, templateName, null);
    }

    public List<CompileJob> getJobs() {
        return Collections.unmodifiableList(jobs);
    }

    /**
     * Every loaded file in discovery order.
     */
    public List<ProtoDescriptor> getProtos() {
        return protoResolver == null ? List.of() : protoResolver.getLoadedProtos();
    }

    /**
     * A single loaded file.
     *
     * @throws IllegalArgumentException if the file has not been loaded
     */
    public ProtoDescriptor getProtos(String fileName) {
        if (protoResolver == null) {
            throw new IllegalArgumentException("Unknown proto file: " + fileName);
        }
        try {
            return protoResolver.find(fileName)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown proto file: " + fileName));
        } catch (UnresolvedImportException e) {
            throw new IllegalArgumentException("Unknown proto file: " + fileName, e);
        }
    }

    /**
     * Message or enum registered under a qualified name, with or without a leading dot.
     */
    public Optional<TypeDescriptor> findType(String fullName) {
        return symbolTable.find(fullName.startsWith(".") ? fullName.substring(1) : fullName);
    }

    public ToolDiagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Merges extensions, freezes every loaded message and renders each job through the output function.
     */
    public List<GeneratedFile> compile() throws IOException {
        checkNotFailed();
        mergeExtensions();
        getProtos().forEach(ProtoDescriptor::freeze);

        List<GeneratedFile> generated = new ArrayList<>();
        for (CompileJob job : jobs) {
            ProtoDescriptor proto = job.getProto();
            String contents = renderer().render(job.getTemplateName(), proto.toTemplateObject());
            Path outputPath = getOutputPath(proto, job.getSuffix());

            outputFunction.write(proto, outputPath, contents);
            log.info("Generated {} -> {}", proto.getName(), outputPath);
            generated.add(new GeneratedFile(proto, outputPath, contents));
        }
        return generated;
    }

    /**
     * Applies every extend block whose target is loaded. Safe to call repeatedly.
     */
    public void mergeExtensions() {
        for (ExtendDescriptor skipped : extensionMerger.merge(getProtos())) {
            if (reportedExtends.add(skipped)) {
                diagnostics.getInfos().add("Extension of " + skipped.getTargetName() + " declared in "
                        + skipped.getSourceFile() + " has no loaded target and was skipped");
            }
        }
    }

    /**
     * Output location for a file rendered with the given suffix.
     *
     * The path mirrors the file's location under the base path. For {@code .java} the file name
     * becomes the {@code java_outer_classname} option and for {@code .h}/{@code .m} the
     * {@code ios_classname} option, when the file sets it.
     */
    public Path getOutputPath(ProtoDescriptor proto, String suffix) {
        Path outDir = outDirsBySuffix.getOrDefault(suffix, defaultOutDir);

        Path relative = relativeSourcePath(proto);
        String fileName = relative.getFileName().toString();

        Object className = null;
        if (".java".equals(suffix)) {
            className = proto.getOption("java_outer_classname");
        } else if (".h".equals(suffix) || ".m".equals(suffix)) {
            className = proto.getOption("ios_classname");
        }
        if (className != null) {
            fileName = className.toString();
        }

        Path parent = relative.getParent();
        Path target = parent != null ? outDir.resolve(parent) : outDir;
        return target.resolve(fileName + suffix);
    }

    private Path relativeSourcePath(ProtoDescriptor proto) {
        Path sourcePath = proto.getSourcePath();
        if (sourcePath != null) {
            Path base = realBasePath();
            if (sourcePath.startsWith(base)) {
                return base.relativize(sourcePath);
            }
        }
        // classpath includes and files outside the base path keep their import name
        return Path.of(proto.getLogicalName());
    }

    private Path realBasePath() {
        try {
            return basePath.toRealPath();
        } catch (IOException e) {
            // nothing can be loaded from a base path that does not exist
            return basePath;
        }
    }

    private void checkNotFailed() {
        if (resolutionFailure != null) {
            throw new IllegalStateException("Project cannot continue after a failed resolution: "
                    + resolutionFailure.getMessage(), resolutionFailure);
        }
    }

    private ProtoResolver protoResolver() {
        if (protoResolver == null) {
            protoResolver = new ProtoResolver(protoPaths);
        }
        return protoResolver;
    }

    private TemplateRenderer renderer() throws IOException {
        if (renderer == null) {
            renderer = new FreemarkerTemplateRenderer(templateDir);
        }
        return renderer;
    }
}
