package io.arbor.core.compiler;

import io.arbor.core.workflow.Identifiers;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Variables visible at one point of a generated method, keyed by id and by friendly name.
///
/// Each branch of a generated `if/else` works on its own {@link #copy()}, so locals
/// declared in one branch never leak into the other.
final class SymbolTable {

    /// A Java local or parameter bound to a workflow variable.
    record Symbol(String javaName, JavaType type) {}

    private final Map<String, Symbol> byId;
    private final Map<String, Symbol> byName;
    private final Map<String, Symbol> byIdPrefix;

    SymbolTable() {
        this(new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    private SymbolTable(
            Map<String, Symbol> byId, Map<String, Symbol> byName, Map<String, Symbol> byIdPrefix) {
        this.byId = byId;
        this.byName = byName;
        this.byIdPrefix = byIdPrefix;
    }

    SymbolTable copy() {
        return new SymbolTable(
                new LinkedHashMap<>(byId),
                new LinkedHashMap<>(byName),
                new LinkedHashMap<>(byIdPrefix));
    }

    void declare(String id, String name, Symbol symbol) {
        if (id != null) {
            byId.put(id, symbol);
        }
        if (name != null) {
            byName.put(name, symbol);
        }
    }

    /// Binds every id starting with the prefix, used for sub-workflow outputs whose type
    /// suffix is only known at run time.
    void declarePrefix(String idPrefix, String name, Symbol symbol) {
        byIdPrefix.put(idPrefix, symbol);
        if (name != null) {
            byName.put(name, symbol);
        }
    }

    /// Resolves by id, then by friendly name. Used for structured conditions.
    Optional<Symbol> byIdFirst(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return id(key).or(() -> Optional.ofNullable(byName.get(key)));
    }

    /// Resolves by friendly name, then by id. Used for expressions and templates.
    Optional<Symbol> byNameFirst(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Symbol named = byName.get(key);
        return named != null ? Optional.of(named) : id(key);
    }

    /// Resolves a calculation operand by id, then friendly name, then slug.
    Optional<Symbol> forOperand(String ref) {
        Optional<Symbol> direct = byIdFirst(ref);
        if (direct.isPresent()) {
            return direct;
        }
        String slug = Identifiers.slugify(ref);
        return byName.entrySet().stream()
                .filter(e -> Identifiers.slugify(e.getKey()).equals(slug))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private Optional<Symbol> id(String key) {
        Symbol symbol = byId.get(key);
        if (symbol != null) {
            return Optional.of(symbol);
        }
        return byIdPrefix.entrySet().stream()
                .filter(e -> key.startsWith(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }
}
