package io.arbor.core.execution;

import io.arbor.core.workflow.Identifiers;
import io.arbor.core.workflow.Variable;
import io.arbor.core.workflow.Workflow;
import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Mutable variable store for a single execution.
///
/// Values are keyed by id; a parallel name-to-id index gives the friendly-name view used
/// by legacy expressions, templates and input mappings.
///
/// @implNote **Not thread-safe**. One scope per (sub-)workflow run.
final class VariableScope {

    private final Map<String, Object> valuesById = new LinkedHashMap<>();
    private final Map<String, String> idsByName = new LinkedHashMap<>();

    static VariableScope of(Workflow workflow, Map<String, Object> inputsById) {
        VariableScope scope = new VariableScope();
        for (Variable variable : workflow.getVariables()) {
            scope.idsByName.putIfAbsent(variable.getName(), variable.getId());
        }
        scope.valuesById.putAll(inputsById);
        return scope;
    }

    /// Stores a value under an id and exposes it by name.
    void put(String id, String name, Object value) {
        valuesById.put(id, value);
        if (name != null) {
            idsByName.put(name, id);
        }
    }

    /// Looks a variable up by friendly name, then by id.
    Optional<Map.Entry<String, Object>> lookup(String nameOrId) {
        String id = idsByName.get(nameOrId);
        if (id != null && valuesById.containsKey(id)) {
            return Optional.of(entry(id));
        }
        if (valuesById.containsKey(nameOrId)) {
            return Optional.of(entry(nameOrId));
        }
        return Optional.empty();
    }

    /// Resolves a calculation operand: by id, then by friendly name, then by slug.
    Optional<Object> resolveOperand(String ref) {
        if (valuesById.containsKey(ref)) {
            return Optional.ofNullable(valuesById.get(ref));
        }
        String id = idsByName.get(ref);
        if (id != null && valuesById.containsKey(id)) {
            return Optional.ofNullable(valuesById.get(id));
        }
        String slug = Identifiers.slugify(ref);
        for (Map.Entry<String, String> named : idsByName.entrySet()) {
            if (Identifiers.slugify(named.getKey()).equals(slug)
                    && valuesById.containsKey(named.getValue())) {
                return Optional.ofNullable(valuesById.get(named.getValue()));
            }
        }
        return Optional.empty();
    }

    /// Values keyed by id, with names added where they do not shadow an id.
    Map<String, Object> idFirstView() {
        Map<String, Object> view = new LinkedHashMap<>(valuesById);
        idsByName.forEach(
                (name, id) -> {
                    if (valuesById.containsKey(id)) {
                        view.putIfAbsent(name, valuesById.get(id));
                    }
                });
        return view;
    }

    /// Values keyed by friendly name, with ids added where they do not shadow a name.
    Map<String, Object> nameFirstView() {
        Map<String, Object> view = new LinkedHashMap<>();
        idsByName.forEach(
                (name, id) -> {
                    if (valuesById.containsKey(id)) {
                        view.put(name, valuesById.get(id));
                    }
                });
        valuesById.forEach(view::putIfAbsent);
        return view;
    }

    Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(valuesById));
    }

    private Map.Entry<String, Object> entry(String id) {
        return new AbstractMap.SimpleImmutableEntry<>(id, valuesById.get(id));
    }
}
