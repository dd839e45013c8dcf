package com.protogen.generator.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protogen.generator.exception.UnresolvedImportException;
import com.protogen.generator.model.ProtoDescriptor;

import lombok.Value;

/**
 * Locates, parses and links schema files and everything they import.
 *
 * Each file is parsed at most once: the cache is keyed by canonical location and a file is
 * cached before its imports are followed, which is also what makes import cycles terminate.
 */
public class ProtoResolver {
    private static final Logger log = LoggerFactory.getLogger(ProtoResolver.class);

    /** Classpath root searched after every directory, e.g. for google/protobuf/descriptor.proto. */
    static final String BUNDLED_INCLUDE_ROOT = "include/";
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final List<Path> searchPaths;

    /** Parsed files by canonical location, in discovery order. */
    private final Map<String, ProtoDescriptor> parsedProtos = new LinkedHashMap<>();

    /** Files parsed since the last {@link #drainPending()}, in discovery order. */
    private final List<ProtoDescriptor> pendingProtos = new ArrayList<>();

    public ProtoResolver(List<Path> searchPaths) {
        Objects.requireNonNull(searchPaths, "searchPaths");
        this.searchPaths = List.copyOf(searchPaths);
    }

    public List<Path> getSearchPaths() {
        return searchPaths;
    }

    /**
     * Load a file and, depth-first, every file it imports. Returns the cached instance if the
     * file was loaded before.
     *
     * If any file of the load fails, every file this call added is dropped from the cache again,
     * so a retry starts from scratch instead of returning a partially linked file.
     */
    public ProtoDescriptor load(String fileName) {
        Set<String> cachedBefore = new HashSet<>(parsedProtos.keySet());
        int pendingBefore = pendingProtos.size();
        try {
            return load(fileName, null);
        } catch (RuntimeException e) {
            parsedProtos.keySet().retainAll(cachedBefore);
            pendingProtos.subList(pendingBefore, pendingProtos.size()).clear();
            log.debug("Discarded partial load of {}", fileName);
            throw e;
        }
    }

    private ProtoDescriptor load(String fileName, ProtoDescriptor importer) {
        ProtoSource source = locate(fileName, importer);

        ProtoDescriptor cached = parsedProtos.get(source.getKey());
        if (cached != null) {
            return cached;
        }

        log.info("Parsing proto: {}", source.getKey());
        String content = read(source);

        ProtoTokenizer tokenizer = new ProtoTokenizer(content, source.getKey());
        List<ProtoToken> tokens = tokenizer.tokenize();

        ProtoParser parser = new ProtoParser(tokens, source.getKey());
        ProtoDescriptor proto = parser.parse();
        proto.setSourcePath(source.getPath());
        proto.setLogicalName(fileName);

        // Cache before following imports so that a cycle back to this file is a cache hit.
        parsedProtos.put(source.getKey(), proto);
        pendingProtos.add(proto);

        for (String importName : proto.getImportNames()) {
            ProtoDescriptor imported = load(importName, proto);
            proto.addImport(imported);
            log.info("Resolved import {} -> {}", importName, imported.getFilePath());
        }

        return proto;
    }

    /**
     * A previously loaded file, looked up by the name it would be resolved from.
     *
     * @throws UnresolvedImportException if the name does not resolve on any search root
     */
    public Optional<ProtoDescriptor> find(String fileName) {
        return Optional.ofNullable(parsedProtos.get(locate(fileName, null).getKey()));
    }

    /**
     * Every loaded file in discovery order: roots first, imports as encountered.
     */
    public List<ProtoDescriptor> getLoadedProtos() {
        return new ArrayList<>(parsedProtos.values());
    }

    /**
     * Files loaded since the previous call, in discovery order.
     */
    public List<ProtoDescriptor> drainPending() {
        List<ProtoDescriptor> drained = new ArrayList<>(pendingProtos);
        pendingProtos.clear();
        return drained;
    }

    /**
     * Canonical location of a file name: the first search root that contains it, then the bundled
     * classpath root.
     */
    public String resolve(String fileName) {
        return locate(fileName, null).getKey();
    }

    private ProtoSource locate(String fileName, ProtoDescriptor importer) {
        List<String> attempted = new ArrayList<>();

        for (Path searchPath : searchPaths) {
            Path candidate = searchPath.resolve(fileName).toAbsolutePath().normalize();
            attempted.add(candidate.toString());
            if (Files.isRegularFile(candidate)) {
                Path canonical = canonicalize(candidate);
                return new ProtoSource(canonical.toString(), canonical, null);
            }
        }

        String resourceName = BUNDLED_INCLUDE_ROOT + stripLeadingSlash(fileName);
        attempted.add(CLASSPATH_PREFIX + resourceName);
        URL resource = ProtoResolver.class.getClassLoader().getResource(resourceName);
        if (resource != null) {
            return new ProtoSource(CLASSPATH_PREFIX + resourceName, null, resourceName);
        }

        throw new UnresolvedImportException(fileName, importer != null ? importer.getFilePath() : null, attempted);
    }

    private String read(ProtoSource source) {
        try {
            if (source.getPath() != null) {
                return Files.readString(source.getPath(), StandardCharsets.UTF_8);
            }
            try (InputStream in = ProtoResolver.class.getClassLoader().getResourceAsStream(source.getResourceName())) {
                if (in == null) {
                    throw new IOException("Resource disappeared: " + source.getResourceName());
                }
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read proto " + source.getKey(), e);
        }
    }

    private static Path canonicalize(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to canonicalize " + path, e);
        }
    }

    private static String stripLeadingSlash(String name) {
        return name.startsWith("/") ? name.substring(1) : name;
    }

    @Value
    private static class ProtoSource {
        String key;
        Path path;
        String resourceName;
    }
}
