package com.archforge.core.consistency;

import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.model.MethodSpec;
import com.archforge.core.model.Parameter;
import com.archforge.core.model.Unit;
import com.archforge.core.model.UnitKind;
import com.archforge.core.parser.base.DiagramPatterns;
import com.archforge.core.registry.MethodSignature;
import com.archforge.core.registry.SymbolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps method signatures consistent across the entity, service and controller of a resource.
 *
 * <p>For a resource {@code R} the entity {@code R} is canonical; {@code RService} and
 * {@code RController} are its dependents. For every canonical method that a dependent
 * also declares, return types are compared after {@link ReturnTypeNormalizer normalization}
 * and parameters are compared exactly. Matching dependents are marked consistent in the
 * registry; drifted ones are rewritten to the canonical parameters and return type (kept in
 * the dependent's async wrapper) and reported as {@link DriftWarning}s. Methods missing from
 * a dependent are never invented here.
 *
 * <p>The engine runs twice per run:
 * <ol>
 *   <li>{@link #reconcile(ArchitectureModel, SymbolRegistry)} on the parsed model, so prompts
 *       carry aligned signatures</li>
 *   <li>{@link #reconcileSource(String, String, SymbolRegistry)} on generated code after
 *       linking, to fix drift the generated text introduced</li>
 * </ol>
 */
public class ConsistencyEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyEngine.class);

    static final List<String> DEPENDENT_SUFFIXES = List.of("Service", "Controller");

    private static final Pattern SOURCE_METHOD = Pattern.compile(
        "^(\\s*)((?:(?:public|private|protected|static|async|readonly|override)\\s+)*)(\\w+)\\s*\\(([^()]*)\\)\\s*:\\s*([^{;=]+?)\\s*(\\{.*|;.*)?$");

    private static final List<String> NOT_METHODS = List.of("if", "for", "while", "switch", "catch", "function", "return", "constructor");

    /**
     * Reconciles the dependents of every entity in the model.
     *
     * @param model parsed model
     * @param registry run registry; its signatures are rewritten and flags recomputed
     * @return repaired model plus drift and consistency findings
     */
    public ConsistencyReport reconcile(ArchitectureModel model, SymbolRegistry registry) {
        ArchitectureModel current = model;
        List<DriftWarning> drifts = new ArrayList<>();
        List<String> consistent = new ArrayList<>();

        for (Unit entity : model.unitsOfKind(UnitKind.DATA_ENTITY)) {
            for (MethodSpec canonical : entity.methods()) {
                boolean allMatched = true;
                boolean anyDependent = false;

                for (String suffix : DEPENDENT_SUFFIXES) {
                    Optional<Unit> dependent = current.findUnit(entity.name() + suffix);
                    if (dependent.isEmpty()) {
                        continue;
                    }
                    Optional<MethodSpec> found = dependent.get().findMethod(canonical.name());
                    if (found.isEmpty()) {
                        log.debug("{} does not declare {}, nothing to reconcile", dependent.get().name(), canonical.name());
                        continue;
                    }

                    anyDependent = true;
                    Unit unit = dependent.get();
                    MethodSpec method = found.get();
                    if (matches(canonical, method.parameters(), method.returnType())) {
                        registry.markConsistency(unit.name(), method.name(), true);
                        consistent.add(unit.name() + "." + method.name());
                        continue;
                    }

                    allMatched = false;
                    String recorded = registry.getMethodSignature(unit.name(), method.name())
                        .map(MethodSignature::returnType)
                        .orElse(null);
                    String target = rewriteTarget(canonical.returnType(), method.returnType(), recorded, false);
                    MethodSpec rewritten = method.withSignature(canonical.parameters(), target);

                    current = current.withUnit(unit.replaceMethod(rewritten));
                    registry.updateMethodSignature(unit.name(), method.name(), canonical.parameters(), target);
                    registry.markConsistency(unit.name(), method.name(), false);

                    DriftWarning drift = new DriftWarning(entity.name(), unit.name(), method.name(), method.signature(), rewritten.signature());
                    log.warn("Signature drift: {}", drift.message());
                    drifts.add(drift);
                }

                if (anyDependent) {
                    registry.markConsistency(entity.name(), canonical.name(), allMatched);
                }
            }
        }

        log.info("Consistency check: {} consistent methods, {} drifts corrected", consistent.size(), drifts.size());
        return new ConsistencyReport(current, drifts, consistent);
    }

    /**
     * Reconciles method declarations in generated source text of a service or controller.
     *
     * <p>Only single-line method headers of the form {@code [modifiers] name(params): Type}
     * are inspected. Drifted headers are rewritten in place; everything else in the content
     * is left untouched, so running this twice is a no-op the second time.
     *
     * @param className dependent unit the content belongs to (e.g. {@code OrderService})
     * @param content generated source text
     * @param registry run registry holding canonical signatures
     * @return rewritten content and the drift found
     */
    public SourceReconciliation reconcileSource(String className, String content, SymbolRegistry registry) {
        Optional<String> resource = resourceOf(className);
        if (resource.isEmpty()) {
            return new SourceReconciliation(content, List.of());
        }

        String[] lines = content.split("\n", -1);
        List<DriftWarning> drifts = new ArrayList<>();

        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = SOURCE_METHOD.matcher(lines[i]);
            if (!matcher.matches() || NOT_METHODS.contains(matcher.group(3))) {
                continue;
            }
            String methodName = matcher.group(3);
            Optional<MethodSignature> canonical = registry.getMethodSignature(resource.get(), methodName);
            if (canonical.isEmpty()) {
                continue;
            }

            List<Parameter> parameters = DiagramPatterns.parseParameters(matcher.group(4));
            String returnType = matcher.group(5).trim();
            MethodSpec canonicalSpec = canonical.get().toMethodSpec();
            if (matches(canonicalSpec, parameters, returnType)) {
                registry.markConsistency(className, methodName, true);
                continue;
            }

            boolean async = matcher.group(2).contains("async");
            String recorded = registry.getMethodSignature(className, methodName)
                .map(MethodSignature::returnType)
                .orElse(null);
            String target = rewriteTarget(canonicalSpec.returnType(), returnType, recorded, async);
            MethodSpec rewritten = MethodSpec.of(methodName, canonicalSpec.parameters(), target);

            String tail = matcher.group(6) == null ? "" : " " + matcher.group(6);
            lines[i] = matcher.group(1) + matcher.group(2) + rewritten.signature() + tail;

            if (registry.getMethodSignature(className, methodName).isPresent()) {
                registry.updateMethodSignature(className, methodName, canonicalSpec.parameters(), target);
                registry.markConsistency(className, methodName, false);
            }

            DriftWarning drift = new DriftWarning(resource.get(), className, methodName,
                methodName + "(" + matcher.group(4).trim() + "): " + returnType, rewritten.signature());
            log.warn("Signature drift in generated code: {}", drift.message());
            drifts.add(drift);
        }

        if (drifts.isEmpty()) {
            return new SourceReconciliation(content, List.of());
        }
        return new SourceReconciliation(String.join("\n", lines), drifts);
    }

    /**
     * Returns the resource (entity) name a service or controller belongs to.
     *
     * @param className dependent unit name
     * @return entity name, empty when the name has no dependent suffix
     */
    public static Optional<String> resourceOf(String className) {
        for (String suffix : DEPENDENT_SUFFIXES) {
            if (className.endsWith(suffix) && className.length() > suffix.length()) {
                return Optional.of(className.substring(0, className.length() - suffix.length()));
            }
        }
        return Optional.empty();
    }

    private static boolean matches(MethodSpec canonical, List<Parameter> parameters, String returnType) {
        return sameParameters(canonical.parameters(), parameters)
            && ReturnTypeNormalizer.equivalent(canonical.returnType(), returnType);
    }

    private static boolean sameParameters(List<Parameter> expected, List<Parameter> actual) {
        if (expected.size() != actual.size()) {
            return false;
        }
        for (int i = 0; i < expected.size(); i++) {
            Parameter e = expected.get(i);
            Parameter a = actual.get(i);
            if (!e.name().equals(a.name())
                || !ReturnTypeNormalizer.normalize(e.type()).equals(ReturnTypeNormalizer.normalize(a.type()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Picks the return type a drifted dependent is rewritten to.
     *
     * <p>The canonical type is kept in the async wrapper the dependent uses now, or failing
     * that the one the registry last recorded for it; {@code async} source methods fall back
     * to {@code Promise}.
     */
    private static String rewriteTarget(String canonical, String current, String recorded, boolean async) {
        Optional<String> wrapper = ReturnTypeNormalizer.asyncWrapper(current)
            .or(() -> ReturnTypeNormalizer.asyncWrapper(recorded))
            .or(() -> async ? Optional.of("Promise") : Optional.empty());
        return wrapper.map(w -> ReturnTypeNormalizer.wrap(w, canonical)).orElse(canonical);
    }
}
