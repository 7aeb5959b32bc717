package com.randomtable.engine.validator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.randomtable.engine.TableEngineException;
import com.randomtable.engine.model.CollectionTable;
import com.randomtable.engine.model.CompositeTable;
import com.randomtable.engine.model.Entry;
import com.randomtable.engine.model.Metadata;
import com.randomtable.engine.model.RandomTableDocument;
import com.randomtable.engine.model.SimpleTable;
import com.randomtable.engine.model.Table;
import com.randomtable.engine.model.Template;
import com.randomtable.engine.parser.TemplateParser;

/**
 * Structural and semantic checks on a {@link RandomTableDocument}.
 *
 * References that go through an import ({@code alias.id}) are not checked here;
 * only local ids are.
 */
public final class DocumentValidator {

    public static final String SUPPORTED_SPEC_VERSION = "1.0";

    public static final Set<String> RESERVED_WORDS = Set.of(
            "dice", "unique", "again", "true", "false", "null", "and", "or", "not",
            "contains", "matches", "shared", "math");

    private static final Pattern NAMESPACE = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*(\\.[a-zA-Z_][a-zA-Z0-9_]*)*$");
    private static final Pattern VERSION = Pattern.compile("^\\d+\\.\\d+\\.\\d+(-[a-zA-Z0-9.]+)?(\\+[a-zA-Z0-9.]+)?$");
    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    // $-prefixed names are context-sensitive variables
    private static final Pattern VARIABLE_NAME = Pattern.compile("^\\$?[a-zA-Z_][a-zA-Z0-9_]*$");

    private final List<ValidationIssue> issues = new ArrayList<>();

    private DocumentValidator() {}

    public static ValidationResult validate(RandomTableDocument doc) {
        DocumentValidator v = new DocumentValidator();
        v.run(doc);
        return new ValidationResult(v.issues);
    }

    private void run(RandomTableDocument doc) {
        if (doc == null) {
            error("INVALID_DOCUMENT", "Document is empty", null);
            return;
        }
        validateMetadata(doc.metadata);

        Set<String> tableIds = new LinkedHashSet<>();
        Set<String> templateIds = new HashSet<>();
        for (Table t : doc.tables) tableIds.add(t.id);
        for (Template t : doc.templates) templateIds.add(t.id);

        for (int i = 0; i < doc.tables.size(); i++) {
            validateTable(doc.tables.get(i), "tables[" + i + "]", tableIds);
        }
        for (int i = 0; i < doc.templates.size(); i++) {
            validateTemplate(doc.templates.get(i), "templates[" + i + "]");
        }

        if (doc.variables != null) validateVariables(doc.variables, "variables");
        if (doc.shared != null) {
            validateVariables(doc.shared, "shared");
            for (Map.Entry<String, String> e : doc.shared.entrySet()) {
                validatePattern(e.getValue(), "shared." + e.getKey());
            }
        }

        for (String id : tableIds) {
            if (templateIds.contains(id)) {
                issues.add(new ValidationIssue(ValidationSeverity.WARNING, "ID_COLLISION",
                        "Table and template share the same ID: " + id, null,
                        "Consider using unique IDs to avoid confusion"));
            }
        }

        validateInheritance(doc.tables);
    }

    // -------------------------
    // Metadata
    // -------------------------

    private void validateMetadata(Metadata meta) {
        if (meta == null) {
            error("MISSING_NAME", "Metadata name is required", "metadata.name");
            error("MISSING_NAMESPACE", "Metadata namespace is required", "metadata.namespace");
            error("MISSING_VERSION", "Metadata version is required", "metadata.version");
            error("INVALID_SPEC_VERSION", "Unsupported spec version: null", "metadata.specVersion");
            return;
        }

        if (isBlank(meta.name)) error("MISSING_NAME", "Metadata name is required", "metadata.name");

        if (isBlank(meta.namespace)) {
            error("MISSING_NAMESPACE", "Metadata namespace is required", "metadata.namespace");
        } else if (!NAMESPACE.matcher(meta.namespace).matches()) {
            issues.add(new ValidationIssue(ValidationSeverity.ERROR, "INVALID_NAMESPACE",
                    "Invalid namespace format: " + meta.namespace, "metadata.namespace",
                    "Use dot-separated segments (e.g., \"fantasy.core\")"));
        }

        if (isBlank(meta.version)) {
            error("MISSING_VERSION", "Metadata version is required", "metadata.version");
        } else if (!VERSION.matcher(meta.version).matches()) {
            issues.add(new ValidationIssue(ValidationSeverity.WARNING, "INVALID_VERSION",
                    "Version should follow semver format: " + meta.version, "metadata.version",
                    "Use semantic versioning (e.g., \"1.0.0\")"));
        }

        if (!SUPPORTED_SPEC_VERSION.equals(meta.specVersion)) {
            issues.add(new ValidationIssue(ValidationSeverity.ERROR, "INVALID_SPEC_VERSION",
                    "Unsupported spec version: " + meta.specVersion, "metadata.specVersion",
                    "Use specVersion \"" + SUPPORTED_SPEC_VERSION + "\""));
        }

        checkAtLeastOne(meta.maxRecursionDepth, "maxRecursionDepth");
        checkAtLeastOne(meta.maxExplodingDice, "maxExplodingDice");
        checkAtLeastOne(meta.maxInheritanceDepth, "maxInheritanceDepth");
    }

    private void checkAtLeastOne(Integer value, String field) {
        if (value != null && value < 1) {
            error("INVALID_CONFIG", field + " must be at least 1", "metadata." + field);
        }
    }

    // -------------------------
    // Tables
    // -------------------------

    private void validateTable(Table table, String path, Set<String> tableIds) {
        validateIdentifier(table.id, path + ".id", "Table");

        if (isBlank(table.name)) error("MISSING_TABLE_NAME", "Table name is required", path + ".name");

        if (table.extendsId != null && !table.extendsId.contains(".") && !tableIds.contains(table.extendsId)) {
            error("INVALID_EXTENDS", "Extends references unknown table: " + table.extendsId, path + ".extends");
        }

        if (table instanceof SimpleTable) {
            validateSimpleTable((SimpleTable) table, path);
        } else if (table instanceof CompositeTable) {
            validateCompositeTable((CompositeTable) table, path, tableIds);
        } else if (table instanceof CollectionTable) {
            validateCollectionTable((CollectionTable) table, path, tableIds);
        }

        if (table.defaultSets != null) {
            for (Map.Entry<String, String> e : table.defaultSets.entrySet()) {
                validatePattern(e.getValue(), path + ".defaultSets." + e.getKey());
            }
        }
        if (table.shared != null) {
            validateVariables(table.shared, path + ".shared");
            for (Map.Entry<String, String> e : table.shared.entrySet()) {
                validatePattern(e.getValue(), path + ".shared." + e.getKey());
            }
        }
    }

    private void validateSimpleTable(SimpleTable table, String path) {
        if (table.entries == null || table.entries.isEmpty()) {
            error("EMPTY_ENTRIES", "Simple table must have at least one entry", path + ".entries");
            return;
        }

        Set<String> entryIds = new HashSet<>();
        for (int i = 0; i < table.entries.size(); i++) {
            Entry entry = table.entries.get(i);
            String entryPath = path + ".entries[" + i + "]";

            if (entry.id != null) {
                if (!entryIds.add(entry.id)) {
                    error("DUPLICATE_ENTRY_ID", "Duplicate entry ID: " + entry.id, entryPath + ".id");
                }
                validateIdentifier(entry.id, entryPath + ".id", "Entry");
            }

            if (entry.weight != null && entry.range != null) {
                issues.add(new ValidationIssue(ValidationSeverity.ERROR, "WEIGHT_RANGE_CONFLICT",
                        "Entry cannot have both weight and range", entryPath,
                        "Use either weight or range, not both"));
            }

            if (entry.weight != null && entry.weight < 0) {
                error("INVALID_WEIGHT", "Entry weight cannot be negative: " + formatNumber(entry.weight),
                        entryPath + ".weight");
            }

            if (entry.range != null) {
                if (entry.range.length != 2) {
                    error("INVALID_RANGE", "Range must be a two-element array [min, max]", entryPath + ".range");
                } else if (entry.range[0] > entry.range[1]) {
                    error("INVALID_RANGE", "Range min (" + entry.range[0] + ") cannot exceed max ("
                            + entry.range[1] + ")", entryPath + ".range");
                }
            }

            // an id-bearing entry in a child table may override only weight or tags
            boolean inheritedOverride = table.extendsId != null && entry.id != null;
            if (entry.value == null && !inheritedOverride) {
                error("MISSING_VALUE", "Entry value is required", entryPath + ".value");
            }

            validatePattern(entry.value, entryPath + ".value");
            validatePattern(entry.description, entryPath + ".description");
            if (entry.sets != null) {
                for (Map.Entry<String, String> e : entry.sets.entrySet()) {
                    validatePattern(e.getValue(), entryPath + ".sets." + e.getKey());
                }
            }
        }

        // a child table's active entries may all come from its parent
        if (table.extendsId == null) {
            boolean active = false;
            for (Entry e : table.entries) {
                if (e.effectiveWeight() > 0) {
                    active = true;
                    break;
                }
            }
            if (!active) error("NO_ACTIVE_ENTRIES", "Table has no entries with positive weight", path + ".entries");
        }
    }

    private void validateCompositeTable(CompositeTable table, String path, Set<String> tableIds) {
        if (table.sources == null || table.sources.isEmpty()) {
            error("EMPTY_SOURCES", "Composite table must have at least one source", path + ".sources");
            return;
        }
        for (int i = 0; i < table.sources.size(); i++) {
            CompositeTable.Source source = table.sources.get(i);
            String sourcePath = path + ".sources[" + i + "]";
            if (source.tableId == null
                    || (!source.tableId.contains(".") && !tableIds.contains(source.tableId))) {
                error("INVALID_SOURCE", "Source references unknown table: " + source.tableId, sourcePath + ".tableId");
            }
            if (source.weight != null && source.weight < 0) {
                error("INVALID_WEIGHT", "Source weight cannot be negative: " + formatNumber(source.weight),
                        sourcePath + ".weight");
            }
        }
    }

    private void validateCollectionTable(CollectionTable table, String path, Set<String> tableIds) {
        if (table.collections == null || table.collections.isEmpty()) {
            error("EMPTY_COLLECTIONS", "Collection table must reference at least one table", path + ".collections");
            return;
        }
        for (int i = 0; i < table.collections.size(); i++) {
            String id = table.collections.get(i);
            if (id == null || (!id.contains(".") && !tableIds.contains(id))) {
                error("INVALID_COLLECTION", "Collection references unknown table: " + id,
                        path + ".collections[" + i + "]");
            }
        }
    }

    // -------------------------
    // Templates and variables
    // -------------------------

    private void validateTemplate(Template template, String path) {
        validateIdentifier(template.id, path + ".id", "Template");

        if (isBlank(template.name)) error("MISSING_TEMPLATE_NAME", "Template name is required", path + ".name");

        if (template.pattern == null) {
            error("MISSING_PATTERN", "Template pattern is required", path + ".pattern");
        } else {
            validatePattern(template.pattern, path + ".pattern");
        }

        if (template.shared != null) {
            validateVariables(template.shared, path + ".shared");
            for (Map.Entry<String, String> e : template.shared.entrySet()) {
                validatePattern(e.getValue(), path + ".shared." + e.getKey());
            }
        }
    }

    private void validateVariables(Map<String, String> variables, String path) {
        for (String name : variables.keySet()) {
            if (!VARIABLE_NAME.matcher(name).matches()) {
                issues.add(new ValidationIssue(ValidationSeverity.ERROR, "INVALID_VARIABLE_NAME",
                        "Invalid variable name: " + name, path + "." + name,
                        "Variable names must start with a letter (or $ for context-sensitive variables) "
                                + "and contain only alphanumeric characters and underscores"));
            }
            String bare = name.startsWith("$") ? name.substring(1) : name;
            if (RESERVED_WORDS.contains(bare)) {
                error("RESERVED_WORD", "Variable name is a reserved word: " + name, path + "." + name);
            }
        }
    }

    private void validatePattern(String pattern, String path) {
        if (pattern == null || !TemplateParser.hasExpressions(pattern)) return;
        try {
            TemplateParser.parseTemplate(pattern);
        } catch (TableEngineException e) {
            error("INVALID_PATTERN", e.getMessage(), path);
        }
    }

    // -------------------------
    // Inheritance
    // -------------------------

    private void validateInheritance(List<Table> tables) {
        Map<String, Table> byId = new HashMap<>();
        for (Table t : tables) byId.put(t.id, t);

        for (Table table : tables) {
            if (table.extendsId == null) continue;
            Set<String> chain = new HashSet<>();
            Table current = table;
            while (current != null && current.extendsId != null) {
                if (!chain.add(current.id)) {
                    error("CIRCULAR_INHERITANCE", "Circular inheritance detected involving table: " + current.id, "tables");
                    break;
                }
                String parentId = current.extendsId.substring(current.extendsId.lastIndexOf('.') + 1);
                current = byId.get(parentId);
            }
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    private void validateIdentifier(String id, String path, String kind) {
        if (isBlank(id)) {
            error("MISSING_ID", kind + " ID is required", path);
            return;
        }
        if (id.contains(".")) {
            issues.add(new ValidationIssue(ValidationSeverity.ERROR, "INVALID_ID",
                    kind + " ID cannot contain periods: " + id, path, "Use underscores or camelCase instead"));
        }
        if (!IDENTIFIER.matcher(id).matches()) {
            issues.add(new ValidationIssue(ValidationSeverity.ERROR, "INVALID_ID",
                    "Invalid " + kind + " ID format: " + id, path,
                    "IDs must start with a letter and contain only alphanumeric characters and underscores"));
        }
        if (RESERVED_WORDS.contains(id.toLowerCase())) {
            error("RESERVED_WORD", kind + " ID is a reserved word: " + id, path);
        }
    }

    private void error(String code, String message, String path) {
        issues.add(new ValidationIssue(ValidationSeverity.ERROR, code, message, path, null));
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static String formatNumber(double d) {
        return d == Math.rint(d) && !Double.isInfinite(d) ? Long.toString((long) d) : Double.toString(d);
    }
}
