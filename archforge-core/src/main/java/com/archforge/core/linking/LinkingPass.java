package com.archforge.core.linking;

import com.archforge.core.composer.ComposeContext;
import com.archforge.core.composer.StructureComposer;
import com.archforge.core.consistency.ConsistencyEngine;
import com.archforge.core.consistency.DriftWarning;
import com.archforge.core.consistency.SourceReconciliation;
import com.archforge.core.generator.GeneratedArtifact;
import com.archforge.core.generator.GeneratorRegistry;
import com.archforge.core.model.Unit;
import com.archforge.core.planner.Task;
import com.archforge.core.registry.SymbolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BooleanSupplier;
import java.util.regex.Pattern;

/**
 * Two-stage generation and linking.
 *
 * <p><b>Pass A (generate and register):</b> for each task in plan order, generate its
 * artifact, write it, and register its exports at once so later tasks can reference them.
 * A failing task is recorded and skipped; independent tasks still run.
 *
 * <p><b>Pass B (link and fix):</b> for every script artifact, import identifiers that are
 * used but not defined and are exported elsewhere, drop unused imports of local modules,
 * repoint local imports whose target no longer exists, and reconcile service and controller
 * signatures against the registry. A file that fails keeps its Pass A content.
 *
 * <p>Pass B is idempotent: running it again over its own output makes no edits.
 */
public class LinkingPass {

    private static final Logger log = LoggerFactory.getLogger(LinkingPass.class);

    private static final Pattern STATEMENT_END = Pattern.compile("(?s).*['\"]\\s*;?\\s*$");
    private static final int MAX_IMPORT_LINES = 50;

    private final GeneratorRegistry generators;
    private final StructureComposer composer;
    private final ComposeContext composeContext;
    private final SymbolRegistry registry;
    private final ConsistencyEngine consistencyEngine;
    private final ReferencePathResolver resolver;

    public LinkingPass(GeneratorRegistry generators, StructureComposer composer, ComposeContext composeContext,
                       SymbolRegistry registry, ConsistencyEngine consistencyEngine, ReferencePathResolver resolver) {
        this.generators = generators;
        this.composer = composer;
        this.composeContext = composeContext;
        this.registry = registry;
        this.consistencyEngine = consistencyEngine;
        this.resolver = resolver;
    }

    /**
     * Creates a pass that only links, for re-running Pass B over an existing output tree.
     */
    public LinkingPass(StructureComposer composer, ComposeContext composeContext, SymbolRegistry registry,
                       ConsistencyEngine consistencyEngine, ReferencePathResolver resolver) {
        this(null, composer, composeContext, registry, consistencyEngine, resolver);
    }

    /**
     * Runs Pass A over tasks in generation order.
     *
     * @param orderedTasks tasks in plan order
     * @param stopRequested checked before each task; true stops the pass
     * @return generated artifacts and per-task failures
     */
    public GenerationPassResult generateAndRegister(List<Task> orderedTasks, BooleanSupplier stopRequested) {
        if (generators == null) {
            throw new IllegalStateException("This linking pass has no generators and cannot run Pass A");
        }
        log.info("Pass A: generating {} tasks", orderedTasks.size());
        List<GeneratedArtifact> artifacts = new ArrayList<>();
        List<String> stubbed = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        boolean stopped = false;

        for (Task task : orderedTasks) {
            if (stopRequested.getAsBoolean()) {
                log.warn("Pass A stopped before {} ({} of {} tasks done)", task.id(), artifacts.size(), orderedTasks.size());
                stopped = true;
                break;
            }
            try {
                GeneratedArtifact artifact = generators.forTask(task).generate(task, List.copyOf(artifacts));
                if (artifact.isScript()) {
                    artifact = artifact.withDependencies(references(artifact.path(), artifact.content()));
                }
                composer.write(artifact, composeContext);
                registry.registerExports(artifact.path(), artifact.exports(), task.category().layer());
                artifacts.add(artifact);
                if (artifact.stub()) {
                    stubbed.add(task.id());
                }
                log.debug("Generated {} -> {} (exports: {})", task.id(), artifact.path(), artifact.exports());
            } catch (RuntimeException e) {
                log.error("Failed to generate {}: {}", task.id(), e.getMessage());
                failures.put(task.id(), e.getMessage());
            }
        }

        log.info("Pass A finished: {} artifacts, {} stubs, {} failures", artifacts.size(), stubbed.size(), failures.size());
        return new GenerationPassResult(artifacts, stubbed, failures, stopped);
    }

    /**
     * Runs Pass B over artifacts and writes every changed file.
     *
     * @param artifacts artifacts to link, typically the output of Pass A
     * @return linking findings and the linked artifacts
     */
    public LinkingResult linkAndFix(List<GeneratedArtifact> artifacts) {
        log.info("Pass B: linking {} artifacts", artifacts.size());
        Set<String> knownFiles = new LinkedHashSet<>();
        artifacts.forEach(a -> knownFiles.add(a.path()));

        List<GeneratedArtifact> linked = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> fixedFiles = new ArrayList<>();
        Map<String, List<String>> addedImports = new LinkedHashMap<>();
        Map<String, List<String>> removedImports = new LinkedHashMap<>();
        List<DriftWarning> reconciled = new ArrayList<>();

        for (GeneratedArtifact artifact : artifacts) {
            if (!artifact.isScript()) {
                linked.add(artifact);
                continue;
            }
            try {
                FileLink link = linkFile(artifact.path(), artifact.content(), knownFiles);
                SourceReconciliation reconciliation = reconcile(artifact.path(), link.content());
                String content = reconciliation.content();

                warnings.addAll(link.warnings());
                List<String> references = references(artifact.path(), content);
                if (content.equals(artifact.content())) {
                    linked.add(artifact.withDependencies(references));
                    continue;
                }

                GeneratedArtifact updated = artifact.withContent(content).withDependencies(references);
                composer.write(updated, composeContext);
                linked.add(updated);
                fixedFiles.add(artifact.path());
                if (!link.added().isEmpty()) {
                    addedImports.put(artifact.path(), link.added());
                }
                if (!link.removed().isEmpty()) {
                    removedImports.put(artifact.path(), link.removed());
                }
                reconciled.addAll(reconciliation.drifts());
            } catch (RuntimeException e) {
                log.error("Failed to link {}: {}", artifact.path(), e.getMessage());
                errors.add(artifact.path() + ": " + e.getMessage());
                linked.add(artifact);
            }
        }

        LinkingResult result = new LinkingResult(errors.isEmpty(), errors, warnings, fixedFiles,
            addedImports, removedImports, reconciled, linked);
        log.info("Pass B finished: {} files fixed, {} edits, {} errors", fixedFiles.size(), result.editCount(), errors.size());
        return result;
    }

    /**
     * Links one file's import section against the registry.
     *
     * @param path output-root relative path of the file
     * @param content file content
     * @param knownFiles paths of all artifacts in the run
     * @return linked content with the names added and removed
     */
    FileLink linkFile(String path, String content, Set<String> knownFiles) {
        String[] lines = content.split("\n", -1);
        List<ImportBlock> blocks = findImportBlocks(lines);
        String body = body(lines, blocks);

        Set<String> referenced = IdentifierScanner.referencedIdentifiers(body);
        Set<String> defined = IdentifierScanner.localDefinitions(body);
        Set<String> bound = new LinkedHashSet<>();
        blocks.forEach(b -> b.statement().ifPresent(s -> bound.addAll(s.boundNames())));

        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<ImportBlock, Optional<ImportStatement>> replacements = new LinkedHashMap<>();

        for (ImportBlock block : blocks) {
            if (block.statement().isEmpty() || block.statement().get().sideEffect()
                || !resolver.isLocal(block.statement().get().source())) {
                continue;
            }
            ImportStatement original = block.statement().get();
            ImportStatement statement = repointIfMissing(path, original, knownFiles, warnings);
            statement = dropUnused(statement, referenced, removed);
            if (!statement.equals(original)) {
                replacements.put(block, statement.isEmpty() ? Optional.empty() : Optional.of(statement));
            }
        }

        Map<String, TreeSet<String>> missingBySource = new LinkedHashMap<>();
        for (String identifier : referenced) {
            if (defined.contains(identifier) || bound.contains(identifier)) {
                continue;
            }
            Optional<String> owner = registry.resolveExport(identifier).filter(file -> !file.equals(path));
            if (owner.isPresent()) {
                String source = resolver.specifierFor(path, owner.get());
                missingBySource.computeIfAbsent(source, s -> new TreeSet<>()).add(identifier);
            }
        }

        List<ImportStatement> newStatements = new ArrayList<>();
        for (Map.Entry<String, TreeSet<String>> missing : missingBySource.entrySet()) {
            added.addAll(missing.getValue());
            Optional<ImportBlock> target = mergeTarget(path, missing.getKey(), blocks, replacements, knownFiles);
            if (target.isPresent()) {
                ImportStatement current = currentStatement(target.get(), replacements);
                List<String> merged = new ArrayList<>(current.named());
                merged.addAll(missing.getValue());
                replacements.put(target.get(), Optional.of(current.withNamed(merged)));
            } else {
                newStatements.add(ImportStatement.named(missing.getKey(), new ArrayList<>(missing.getValue())));
            }
        }
        newStatements.sort((a, b) -> a.source().compareTo(b.source()));

        if (replacements.isEmpty() && newStatements.isEmpty()) {
            return new FileLink(content, List.of(), List.of(), warnings);
        }
        return new FileLink(rebuild(lines, blocks, replacements, newStatements), added, removed, warnings);
    }

    /**
     * Returns the names a script uses that another file of the run exports, in order of first use.
     *
     * @param path output-root relative path of the file
     * @param content file content
     * @return referenced symbol names
     */
    List<String> references(String path, String content) {
        String[] lines = content.split("\n", -1);
        String body = body(lines, findImportBlocks(lines));
        Set<String> defined = IdentifierScanner.localDefinitions(body);
        List<String> references = new ArrayList<>();
        for (String identifier : IdentifierScanner.referencedIdentifiers(body)) {
            if (!defined.contains(identifier)
                && registry.resolveExport(identifier).filter(file -> !file.equals(path)).isPresent()) {
                references.add(identifier);
            }
        }
        return references;
    }

    // Only the unit's own file is reconciled; tests and mocks named after it are left alone.
    private SourceReconciliation reconcile(String path, String content) {
        String className = baseName(path);
        Optional<Unit> unit = registry.getUnit(className);
        if (ConsistencyEngine.resourceOf(className).isEmpty() || unit.isEmpty() || !unit.get().filePath().equals(path)) {
            return new SourceReconciliation(content, List.of());
        }
        return consistencyEngine.reconcileSource(className, content, registry);
    }

    private static String body(String[] lines, List<ImportBlock> blocks) {
        StringBuilder body = new StringBuilder();
        int next = 0;
        for (ImportBlock block : blocks) {
            for (int i = next; i < block.start(); i++) {
                body.append(lines[i]).append('\n');
            }
            next = block.end() + 1;
        }
        for (int i = next; i < lines.length; i++) {
            body.append(lines[i]).append('\n');
        }
        return body.toString();
    }

    private ImportStatement repointIfMissing(String path, ImportStatement statement, Set<String> knownFiles,
                                             List<String> warnings) {
        Optional<String> resolved = resolver.resolve(path, statement.source());
        if (resolved.isEmpty() || resolver.matchKnownFile(resolved.get(), knownFiles).isPresent()) {
            return statement;
        }

        Set<String> owners = new LinkedHashSet<>();
        for (String entry : statement.named()) {
            String imported = importedName(entry);
            registry.resolveExport(imported).ifPresent(owners::add);
        }
        if (statement.defaultName() == null && statement.namespace() == null
            && !statement.named().isEmpty() && owners.size() == 1) {
            String owner = owners.iterator().next();
            if (!owner.equals(path)) {
                String source = resolver.specifierFor(path, owner);
                log.debug("Repointing import '{}' in {} to '{}'", statement.source(), path, source);
                return statement.withSource(source);
            }
        }
        warnings.add("Unresolved import '" + statement.source() + "' in " + path);
        return statement;
    }

    private static ImportStatement dropUnused(ImportStatement statement, Set<String> referenced, List<String> removed) {
        ImportStatement result = statement;
        List<String> kept = new ArrayList<>();
        for (String entry : statement.named()) {
            if (referenced.contains(ImportStatement.localName(entry))) {
                kept.add(entry);
            } else {
                removed.add(ImportStatement.localName(entry));
            }
        }
        if (kept.size() != statement.named().size()) {
            result = result.withNamed(kept);
        }
        if (statement.defaultName() != null && !referenced.contains(statement.defaultName())) {
            removed.add(statement.defaultName());
            result = result.withoutDefault();
        }
        if (statement.namespace() != null && !referenced.contains(statement.namespace())) {
            removed.add(statement.namespace());
            result = result.withoutNamespace();
        }
        return result;
    }

    private Optional<ImportBlock> mergeTarget(String path, String source, List<ImportBlock> blocks,
                                              Map<ImportBlock, Optional<ImportStatement>> replacements,
                                              Set<String> knownFiles) {
        Optional<String> targetFile = resolver.resolve(path, source).flatMap(r -> resolver.matchKnownFile(r, knownFiles));
        for (ImportBlock block : blocks) {
            if (block.statement().isEmpty() || (replacements.containsKey(block) && replacements.get(block).isEmpty())) {
                continue;
            }
            ImportStatement current = currentStatement(block, replacements);
            if (current.sideEffect() || current.typeOnly() || current.namespace() != null) {
                continue;
            }
            if (current.source().equals(source)) {
                return Optional.of(block);
            }
            Optional<String> currentFile = resolver.resolve(path, current.source())
                .flatMap(r -> resolver.matchKnownFile(r, knownFiles));
            if (targetFile.isPresent() && targetFile.equals(currentFile)) {
                return Optional.of(block);
            }
        }
        return Optional.empty();
    }

    private static ImportStatement currentStatement(ImportBlock block, Map<ImportBlock, Optional<ImportStatement>> replacements) {
        if (replacements.containsKey(block)) {
            return replacements.get(block).orElseThrow();
        }
        return block.statement().orElseThrow();
    }

    private static String rebuild(String[] lines, List<ImportBlock> blocks,
                                  Map<ImportBlock, Optional<ImportStatement>> replacements,
                                  List<ImportStatement> newStatements) {
        List<String> out = new ArrayList<>();
        int insertAt = blocks.isEmpty() ? -1 : blocks.get(blocks.size() - 1).end();

        if (insertAt < 0 && !newStatements.isEmpty()) {
            newStatements.forEach(s -> out.add(s.format()));
            if (lines.length > 0 && !lines[0].isBlank()) {
                out.add("");
            }
        }

        int i = 0;
        int blockIndex = 0;
        while (i < lines.length) {
            ImportBlock block = blockIndex < blocks.size() ? blocks.get(blockIndex) : null;
            if (block != null && block.start() == i) {
                if (replacements.containsKey(block)) {
                    replacements.get(block).ifPresent(s -> out.add(s.format()));
                } else {
                    for (int j = block.start(); j <= block.end(); j++) {
                        out.add(lines[j]);
                    }
                }
                if (block.end() == insertAt) {
                    newStatements.forEach(s -> out.add(s.format()));
                }
                i = block.end() + 1;
                blockIndex++;
            } else {
                out.add(lines[i]);
                i++;
            }
        }
        return String.join("\n", out);
    }

    private static List<ImportBlock> findImportBlocks(String[] lines) {
        List<ImportBlock> blocks = new ArrayList<>();
        int i = 0;
        while (i < lines.length) {
            String trimmed = lines[i].trim();
            if (isImportStart(trimmed)) {
                int end = i;
                StringBuilder text = new StringBuilder(lines[i]);
                while (!isComplete(text) && end + 1 < lines.length && end - i < MAX_IMPORT_LINES) {
                    end++;
                    text.append('\n').append(lines[end]);
                }
                blocks.add(new ImportBlock(i, end, ImportStatement.parse(text.toString())));
                i = end + 1;
            } else {
                i++;
            }
        }
        return blocks;
    }

    private static boolean isComplete(CharSequence text) {
        return STATEMENT_END.matcher(text).matches() || text.toString().stripTrailing().endsWith(";");
    }

    private static boolean isImportStart(String trimmed) {
        return trimmed.startsWith("import ") || trimmed.startsWith("import{")
            || trimmed.startsWith("import'") || trimmed.startsWith("import\"");
    }

    private static String importedName(String entry) {
        String name = entry.startsWith("type ") ? entry.substring(5).trim() : entry;
        int alias = name.indexOf(" as ");
        return alias >= 0 ? name.substring(0, alias).trim() : name;
    }

    private static String baseName(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    /**
     * Lines {@code start..end} (inclusive) holding one import statement.
     */
    private record ImportBlock(int start, int end, Optional<ImportStatement> statement) {
    }

    /**
     * Linking outcome of one file.
     */
    record FileLink(String content, List<String> added, List<String> removed, List<String> warnings) {
    }
}
