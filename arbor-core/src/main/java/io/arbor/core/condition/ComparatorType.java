package io.arbor.core.condition;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// Comparators available to structured conditions, grouped by {@link ComparatorFamily}.
///
/// ```
/// Family   │ Comparators
/// ─────────┼──────────────────────────────────────────────────────────────
/// NUMERIC  │ eq, neq, lt, lte, gt, gte, within_range
/// BOOLEAN  │ is_true, is_false
/// STRING   │ str_eq, str_neq, str_contains, str_starts_with, str_ends_with
/// ENUM     │ enum_eq, enum_neq, enum_contains, enum_starts_with, enum_ends_with
/// DATE     │ date_eq, date_before, date_after, date_between
/// ```
public enum ComparatorType {
    EQ("eq", ComparatorFamily.NUMERIC),
    NEQ("neq", ComparatorFamily.NUMERIC),
    LT("lt", ComparatorFamily.NUMERIC),
    LTE("lte", ComparatorFamily.NUMERIC),
    GT("gt", ComparatorFamily.NUMERIC),
    GTE("gte", ComparatorFamily.NUMERIC),
    WITHIN_RANGE("within_range", ComparatorFamily.NUMERIC),

    IS_TRUE("is_true", ComparatorFamily.BOOLEAN),
    IS_FALSE("is_false", ComparatorFamily.BOOLEAN),

    STR_EQ("str_eq", ComparatorFamily.STRING),
    STR_NEQ("str_neq", ComparatorFamily.STRING),
    STR_CONTAINS("str_contains", ComparatorFamily.STRING),
    STR_STARTS_WITH("str_starts_with", ComparatorFamily.STRING),
    STR_ENDS_WITH("str_ends_with", ComparatorFamily.STRING),

    ENUM_EQ("enum_eq", ComparatorFamily.ENUM),
    ENUM_NEQ("enum_neq", ComparatorFamily.ENUM),
    ENUM_CONTAINS("enum_contains", ComparatorFamily.ENUM),
    ENUM_STARTS_WITH("enum_starts_with", ComparatorFamily.ENUM),
    ENUM_ENDS_WITH("enum_ends_with", ComparatorFamily.ENUM),

    DATE_EQ("date_eq", ComparatorFamily.DATE),
    DATE_BEFORE("date_before", ComparatorFamily.DATE),
    DATE_AFTER("date_after", ComparatorFamily.DATE),
    DATE_BETWEEN("date_between", ComparatorFamily.DATE);

    private final String wireName;
    private final ComparatorFamily family;

    ComparatorType(String wireName, ComparatorFamily family) {
        this.wireName = wireName;
        this.family = family;
    }

    public String wireName() {
        return wireName;
    }

    public ComparatorFamily family() {
        return family;
    }

    /// Returns whether this comparator needs a second value (`value2`).
    ///
    /// @return `true` for `within_range` and `date_between`
    public boolean isRange() {
        return this == WITHIN_RANGE || this == DATE_BETWEEN;
    }

    /// Looks up a comparator by wire name, case-insensitively.
    ///
    /// @param name the wire name, may be null
    /// @return the comparator, or empty if unknown
    public static Optional<ComparatorType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ComparatorType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /// Returns the wire names of every comparator in a family.
    ///
    /// @param family the family, not null
    /// @return wire names in declaration order, never null
    public static List<String> namesIn(ComparatorFamily family) {
        return Arrays.stream(values())
                .filter(t -> t.family == family)
                .map(ComparatorType::wireName)
                .toList();
    }
}
