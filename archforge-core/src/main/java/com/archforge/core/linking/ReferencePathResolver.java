package com.archforge.core.linking;

import com.archforge.core.config.ProjectConfig.LinkingConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves module specifiers between artifacts.
 *
 * <p>All paths are output-root relative with forward slashes. Resolution order:
 * <ol>
 *   <li>alias prefixes from the alias table, longest first, substituted relative to the
 *       referencing file's package root ({@code backend}, {@code frontend}, {@code shared})</li>
 *   <li>relative specifiers ({@code ./}, {@code ../}) against the referencing file's directory</li>
 *   <li>anything else is an external package and never resolved</li>
 * </ol>
 */
public class ReferencePathResolver {

    private static final List<String> EXTENSIONS = List.of(".ts", ".tsx", ".js", ".jsx");

    private final List<Map.Entry<String, String>> aliases;

    public ReferencePathResolver() {
        this(LinkingConfig.DEFAULT_ALIASES);
    }

    public ReferencePathResolver(Map<String, String> aliasTable) {
        this.aliases = new ArrayList<>(aliasTable.entrySet());
        this.aliases.sort(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed());
    }

    /**
     * Returns true for relative and alias-prefixed specifiers.
     *
     * @param specifier module specifier
     * @return false for external packages
     */
    public boolean isLocal(String specifier) {
        return isRelative(specifier) || matchAlias(specifier).isPresent();
    }

    /**
     * Resolves a specifier to an extensionless output-root relative path.
     *
     * @param fromFile referencing file
     * @param specifier module specifier
     * @return resolved path, empty for external packages
     */
    public Optional<String> resolve(String fromFile, String specifier) {
        Optional<Map.Entry<String, String>> alias = matchAlias(specifier);
        if (alias.isPresent()) {
            String substituted = alias.get().getValue() + specifier.substring(alias.get().getKey().length());
            String packageRoot = packageRoot(fromFile);
            return Optional.of(normalize(packageRoot.isEmpty() ? substituted : packageRoot + "/" + substituted));
        }
        if (isRelative(specifier)) {
            String directory = directoryOf(fromFile);
            return Optional.of(normalize(directory.isEmpty() ? specifier : directory + "/" + specifier));
        }
        return Optional.empty();
    }

    /**
     * Finds the known file a resolved path refers to, trying extensions and index files.
     *
     * @param resolved extensionless resolved path
     * @param knownFiles output-root relative paths of all artifacts
     * @return matching known file
     */
    public Optional<String> matchKnownFile(String resolved, Set<String> knownFiles) {
        if (knownFiles.contains(resolved)) {
            return Optional.of(resolved);
        }
        for (String extension : EXTENSIONS) {
            if (knownFiles.contains(resolved + extension)) {
                return Optional.of(resolved + extension);
            }
        }
        for (String extension : EXTENSIONS) {
            if (knownFiles.contains(resolved + "/index" + extension)) {
                return Optional.of(resolved + "/index" + extension);
            }
        }
        return Optional.empty();
    }

    /**
     * Computes the relative specifier from one artifact to another.
     *
     * @param fromFile referencing file
     * @param targetFile referenced file
     * @return specifier such as {@code ../models/Order} or {@code ./utils}
     */
    public String specifierFor(String fromFile, String targetFile) {
        String target = stripExtension(targetFile);
        if (target.endsWith("/index")) {
            target = target.substring(0, target.length() - "/index".length());
        }
        String directory = directoryOf(fromFile);
        String relative = Path.of(directory.isEmpty() ? "." : directory).normalize()
            .relativize(Path.of(target).normalize())
            .toString()
            .replace('\\', '/');
        if (relative.isEmpty()) {
            return ".";
        }
        return relative.startsWith("..") ? relative : "./" + relative;
    }

    private Optional<Map.Entry<String, String>> matchAlias(String specifier) {
        return aliases.stream().filter(e -> specifier.startsWith(e.getKey())).findFirst();
    }

    private static boolean isRelative(String specifier) {
        return specifier.equals(".") || specifier.equals("..") || specifier.startsWith("./") || specifier.startsWith("../");
    }

    private static String stripExtension(String path) {
        for (String extension : EXTENSIONS) {
            if (path.endsWith(extension)) {
                return path.substring(0, path.length() - extension.length());
            }
        }
        return path;
    }

    private static String directoryOf(String file) {
        int slash = file.lastIndexOf('/');
        return slash < 0 ? "" : file.substring(0, slash);
    }

    private static String packageRoot(String file) {
        int slash = file.indexOf('/');
        return slash < 0 ? "" : file.substring(0, slash);
    }

    private static String normalize(String path) {
        return Path.of(path).normalize().toString().replace('\\', '/');
    }
}
