package com.archforge.core.registry;

import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.model.Layer;
import com.archforge.core.model.MethodSpec;
import com.archforge.core.model.Parameter;
import com.archforge.core.model.Property;
import com.archforge.core.model.Relationship;
import com.archforge.core.model.Unit;
import com.archforge.core.model.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Index of every symbol a run knows about: units, their properties and methods
 * from the model, plus names exported by artifacts generated so far.
 *
 * <p>The registry is the single source of truth for signature facts within a run.
 * Generators read it, the consistency engine rewrites method signatures in it, and
 * the linking pass registers exports and resolves identifiers against it.
 *
 * <p><b>Query surface:</b>
 * <ul>
 *   <li>{@link #findByName(String)} - exact simple name</li>
 *   <li>{@link #getMethodSignature(String, String)} - by class and method</li>
 *   <li>{@link #symbolsInFile(String)} - by owning file</li>
 *   <li>{@link #resolveExport(String)} - file that exports a name</li>
 * </ul>
 *
 * <p>Not thread-safe. Each run owns its own instance.
 */
public class SymbolRegistry {

    private static final Logger log = LoggerFactory.getLogger(SymbolRegistry.class);

    private static final Pattern TYPE_NAME = Pattern.compile("[A-Za-z_]\\w*");

    private final Map<String, Entry> symbols = new LinkedHashMap<>();
    private final Map<String, MethodSignature> signatures = new LinkedHashMap<>();
    private final Map<String, Unit> units = new LinkedHashMap<>();
    private final Map<String, String> exports = new LinkedHashMap<>();

    /**
     * Builds a registry holding every unit, property and method of the model.
     *
     * @param model parsed model
     * @return populated registry
     */
    public static SymbolRegistry fromModel(ArchitectureModel model) {
        SymbolRegistry registry = new SymbolRegistry();
        model.units().forEach(registry::registerUnit);
        for (Unit unit : model.units()) {
            registry.linkUnitDependencies(unit);
        }
        log.info("Symbol registry built: {} symbols, {} method signatures",
            registry.symbols.size(), registry.signatures.size());
        return registry;
    }

    /**
     * Registers a unit and its members. Re-registering a unit replaces its member symbols.
     *
     * @param unit unit to register
     */
    public void registerUnit(Unit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        String unitId = unitId(unit);
        if (units.containsKey(unit.name())) {
            removeMembers(unit.name());
        }
        units.put(unit.name(), unit);

        Entry classEntry = symbols.computeIfAbsent(unitId,
            id -> new Entry(id, unit.name(), unit.name(), SymbolType.CLASS, unit.filePath(), unit.layer(), Visibility.PUBLIC));
        classEntry.filePath = unit.filePath();

        for (Property property : unit.properties()) {
            Entry entry = new Entry(memberId(unit, property.name()), property.name(), unit.name(),
                SymbolType.PROPERTY, unit.filePath(), unit.layer(), property.visibility());
            symbols.put(entry.id, entry);
            addEdge(entry.id, unitId);
        }
        for (MethodSpec method : unit.methods()) {
            Entry entry = new Entry(memberId(unit, method.name()), method.name(), unit.name(),
                SymbolType.METHOD, unit.filePath(), unit.layer(), method.visibility());
            symbols.put(entry.id, entry);
            addEdge(entry.id, unitId);
            signatures.put(signatureKey(unit.name(), method.name()),
                new MethodSignature(unit.name(), method.name(), method.parameters(), method.returnType(), unit.filePath(), false));
        }
        linkUnitDependencies(unit);
    }

    /**
     * Registers names exported by a generated artifact.
     *
     * <p>A name matching a known unit keeps the unit's symbol and adopts the artifact path;
     * any other name becomes an {@link SymbolType#EXPORT} symbol with id {@code <layer>_<name>}.
     * When two files export the same name, the unit's declared file wins, otherwise the first
     * registration wins.
     *
     * @param filePath artifact path
     * @param names exported names
     * @param layer layer of the producing task
     */
    public void registerExports(String filePath, Collection<String> names, Layer layer) {
        for (String name : names) {
            Unit unit = units.get(name);
            String symbolId;
            if (unit != null) {
                symbolId = unitId(unit);
            } else {
                symbolId = layer.prefix() + "_" + name;
                symbols.computeIfAbsent(symbolId,
                    id -> new Entry(id, name, name, SymbolType.EXPORT, filePath, layer, Visibility.PUBLIC));
            }

            String previous = exports.get(name);
            boolean declaredHome = unit != null && unit.filePath().equals(filePath);
            if (previous == null || declaredHome) {
                exports.put(name, filePath);
                symbols.get(symbolId).filePath = filePath;
            } else if (!previous.equals(filePath)) {
                log.warn("Export {} from {} ignored, already provided by {}", name, filePath, previous);
            }
        }
    }

    /**
     * Returns the file that exports a name.
     *
     * @param name exported name
     * @return exporting file path, if any artifact exported it
     */
    public Optional<String> resolveExport(String name) {
        return Optional.ofNullable(exports.get(name));
    }

    /**
     * Returns every exported name with its file, in registration order.
     *
     * @return unmodifiable export index
     */
    public Map<String, String> exports() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(exports));
    }

    /**
     * Returns all symbols with the given simple name.
     *
     * @param name simple name
     * @return matching symbols in registration order
     */
    public List<Symbol> findByName(String name) {
        return symbols.values().stream()
            .filter(e -> e.name.equals(name))
            .map(Entry::snapshot)
            .toList();
    }

    public Optional<Symbol> getSymbol(String id) {
        return Optional.ofNullable(symbols.get(id)).map(Entry::snapshot);
    }

    /**
     * Returns all symbols defined by a file.
     *
     * @param filePath artifact path
     * @return symbols whose owning file is {@code filePath}
     */
    public List<Symbol> symbolsInFile(String filePath) {
        return symbols.values().stream()
            .filter(e -> filePath.equals(e.filePath))
            .map(Entry::snapshot)
            .toList();
    }

    public List<Symbol> allSymbols() {
        return symbols.values().stream().map(Entry::snapshot).toList();
    }

    /**
     * Looks up a method signature.
     *
     * @param className owning unit name
     * @param methodName method name
     * @return the signature, if the unit declares the method
     */
    public Optional<MethodSignature> getMethodSignature(String className, String methodName) {
        return Optional.ofNullable(signatures.get(signatureKey(className, methodName)));
    }

    /**
     * Returns all method signatures of a unit in declaration order.
     *
     * @param className owning unit name
     * @return signatures, empty when the unit is unknown
     */
    public List<MethodSignature> methodSignatures(String className) {
        return signatures.values().stream()
            .filter(s -> s.className().equals(className))
            .toList();
    }

    /**
     * Overwrites a registered signature.
     *
     * @param className owning unit name
     * @param methodName method name
     * @param parameters replacement parameters
     * @param returnType replacement return type
     * @throws IllegalArgumentException if the method is not registered
     */
    public void updateMethodSignature(String className, String methodName, List<Parameter> parameters, String returnType) {
        String key = signatureKey(className, methodName);
        MethodSignature existing = signatures.get(key);
        if (existing == null) {
            throw new IllegalArgumentException("Unknown method signature: " + key);
        }
        signatures.put(key, existing.withSignature(parameters, returnType));
        Unit unit = units.get(className);
        if (unit != null) {
            unit.findMethod(methodName).ifPresent(m ->
                units.put(className, unit.replaceMethod(m.withSignature(parameters, returnType))));
        }
    }

    /**
     * Sets the cross-layer consistency flag of a registered signature.
     *
     * @param className owning unit name
     * @param methodName method name
     * @param consistent new flag value
     */
    public void markConsistency(String className, String methodName, boolean consistent) {
        signatures.computeIfPresent(signatureKey(className, methodName), (k, s) -> s.withConsistency(consistent));
    }

    public Optional<Unit> getUnit(String name) {
        return Optional.ofNullable(units.get(name));
    }

    /**
     * Builds the data-contract view of a unit.
     *
     * @param unitName unit name
     * @return contract, if the unit is known
     */
    public Optional<DataContract> dataContract(String unitName) {
        Unit unit = units.get(unitName);
        if (unit == null) {
            return Optional.empty();
        }
        Set<String> dependencyIds = new LinkedHashSet<>();
        for (Entry entry : symbols.values()) {
            if (entry.owner.equals(unitName) && entry.type != SymbolType.EXPORT) {
                dependencyIds.addAll(entry.dependencies);
            }
        }
        List<String> dependencies = classNames(dependencyIds, unitName);
        List<String> usedBy = classNames(symbols.get(unitId(unit)).dependents, unitName);
        List<MethodSpec> methods = methodSignatures(unitName).stream().map(MethodSignature::toMethodSpec).toList();
        return Optional.of(new DataContract(unitName, unit.properties(), methods, dependencies, usedBy));
    }

    public int size() {
        return symbols.size();
    }

    /**
     * Returns the id of a unit's own symbol.
     *
     * @param unit unit
     * @return {@code <layer>_<name>}
     */
    public static String unitId(Unit unit) {
        return unit.layer().prefix() + "_" + unit.name();
    }

    /**
     * Returns the id of a unit member symbol.
     *
     * @param unit owning unit
     * @param member member name
     * @return {@code <layer>_<owner>_<member>}
     */
    public static String memberId(Unit unit, String member) {
        return unitId(unit) + "_" + member;
    }

    private void linkUnitDependencies(Unit unit) {
        String unitId = unitId(unit);
        for (Relationship relationship : unit.relationships()) {
            linkTo(unitId, relationship.target());
        }
        for (String dependency : unit.dependencies()) {
            linkTo(unitId, dependency);
        }
        for (Property property : unit.properties()) {
            referencedUnits(property.type()).forEach(target -> linkTo(memberId(unit, property.name()), target));
        }
        for (MethodSpec method : unit.methods()) {
            String methodId = memberId(unit, method.name());
            referencedUnits(method.returnType()).forEach(target -> linkTo(methodId, target));
            for (Parameter parameter : method.parameters()) {
                referencedUnits(parameter.type()).forEach(target -> linkTo(methodId, target));
            }
        }
    }

    private void linkTo(String fromId, String targetUnitName) {
        Unit target = units.get(targetUnitName);
        if (target == null) {
            log.debug("Dependency {} -> {} does not name a known unit", fromId, targetUnitName);
            return;
        }
        String targetId = unitId(target);
        if (!targetId.equals(fromId)) {
            addEdge(fromId, targetId);
        }
    }

    private Set<String> referencedUnits(String typeText) {
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = TYPE_NAME.matcher(typeText);
        while (matcher.find()) {
            if (units.containsKey(matcher.group())) {
                found.add(matcher.group());
            }
        }
        return found;
    }

    private void addEdge(String fromId, String toId) {
        Entry from = symbols.get(fromId);
        Entry to = symbols.get(toId);
        if (from == null || to == null) {
            return;
        }
        from.dependencies.add(toId);
        to.dependents.add(fromId);
    }

    private void removeMembers(String unitName) {
        List<String> memberIds = symbols.values().stream()
            .filter(e -> e.owner.equals(unitName) && e.type != SymbolType.CLASS && e.type != SymbolType.EXPORT)
            .map(e -> e.id)
            .toList();
        for (String id : memberIds) {
            Entry removed = symbols.remove(id);
            removed.dependencies.forEach(dep -> {
                Entry target = symbols.get(dep);
                if (target != null) {
                    target.dependents.remove(id);
                }
            });
            removed.dependents.forEach(dep -> {
                Entry source = symbols.get(dep);
                if (source != null) {
                    source.dependencies.remove(id);
                }
            });
        }
        signatures.keySet().removeIf(key -> key.startsWith(unitName + "."));
    }

    private List<String> classNames(Set<String> ids, String self) {
        List<String> names = new ArrayList<>();
        for (String id : ids) {
            Entry entry = symbols.get(id);
            if (entry != null && !entry.owner.equals(self) && !names.contains(entry.owner)) {
                names.add(entry.owner);
            }
        }
        return names;
    }

    private static String signatureKey(String className, String methodName) {
        return className + "." + methodName;
    }

    /**
     * Mutable registry entry; callers only ever see {@link Symbol} snapshots.
     */
    private static final class Entry {
        private final String id;
        private final String name;
        private final String owner;
        private final SymbolType type;
        private final Layer layer;
        private final Visibility visibility;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private final Set<String> dependents = new LinkedHashSet<>();
        private String filePath;

        private Entry(String id, String name, String owner, SymbolType type, String filePath, Layer layer, Visibility visibility) {
            this.id = id;
            this.name = name;
            this.owner = owner;
            this.type = type;
            this.filePath = filePath;
            this.layer = layer;
            this.visibility = visibility;
        }

        private Symbol snapshot() {
            return new Symbol(id, name, owner, type, filePath, layer, visibility, dependencies, dependents);
        }
    }
}
