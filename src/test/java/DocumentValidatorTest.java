import org.junit.jupiter.api.Test;

import com.randomtable.engine.model.Entry;
import com.randomtable.engine.model.RandomTableDocument;
import com.randomtable.engine.model.SimpleTable;
import com.randomtable.engine.model.Template;
import com.randomtable.engine.validator.DocumentValidator;
import com.randomtable.engine.validator.ValidationIssue;
import com.randomtable.engine.validator.ValidationResult;
import com.randomtable.engine.validator.ValidationSeverity;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentValidatorTest {

    private static RandomTableDocument minimal() {
        RandomTableDocument doc = TestDocs.doc("fantasy.core");
        doc.tables.add(TestDocs.simple("weapons", TestDocs.entry("sword", "Sword"), TestDocs.entry("Axe")));
        doc.templates.add(TestDocs.template("loadout", "{{weapons}} and {{2*unique*weapons}}"));
        return doc;
    }

    @Test
    void wellFormedDocumentIsValid() {
        ValidationResult r = DocumentValidator.validate(minimal());
        assertTrue(r.valid, r.issues.toString());
        assertTrue(r.issues.isEmpty());
    }

    @Test
    void nullDocument() {
        ValidationResult r = DocumentValidator.validate(null);
        assertFalse(r.valid);
        assertTrue(r.hasCode("INVALID_DOCUMENT"));
    }

    @Test
    void metadataChecks() {
        RandomTableDocument doc = minimal();
        doc.metadata.name = " ";
        doc.metadata.namespace = "Bad-Namespace";
        doc.metadata.version = "v1";
        doc.metadata.specVersion = "2.0";
        doc.metadata.maxRecursionDepth = 0;

        ValidationResult r = DocumentValidator.validate(doc);
        assertFalse(r.valid);
        assertTrue(r.hasCode("MISSING_NAME"));
        assertTrue(r.hasCode("INVALID_NAMESPACE"));
        assertTrue(r.hasCode("INVALID_SPEC_VERSION"));
        assertTrue(r.hasCode("INVALID_CONFIG"));

        ValidationIssue version = r.warnings().get(0);
        assertEquals("INVALID_VERSION", version.code);
        assertEquals(ValidationSeverity.WARNING, version.severity);
        assertNotNull(version.suggestion);
    }

    @Test
    void versionWarningAloneKeepsDocumentValid() {
        RandomTableDocument doc = minimal();
        doc.metadata.version = "1.0";
        ValidationResult r = DocumentValidator.validate(doc);
        assertTrue(r.valid);
        assertEquals(1, r.warnings().size());
    }

    @Test
    void identifierRules() {
        RandomTableDocument doc = minimal();
        doc.tables.add(TestDocs.simple("has.period", TestDocs.entry("x")));
        doc.tables.add(TestDocs.simple("dice", TestDocs.entry("x")));
        doc.tables.add(TestDocs.simple("9lives", TestDocs.entry("x")));

        ValidationResult r = DocumentValidator.validate(doc);
        assertTrue(r.hasCode("INVALID_ID"));
        assertTrue(r.hasCode("RESERVED_WORD"));
        long invalidIds = r.errors().stream().filter(i -> i.code.equals("INVALID_ID")).count();
        // period: both the period rule and the format rule fire
        assertEquals(3, invalidIds);
    }

    @Test
    void entryChecks() {
        RandomTableDocument doc = minimal();
        Entry both = TestDocs.entry("both", "x");
        both.weight = 2.0;
        both.range = new int[] { 1, 3 };
        Entry negative = TestDocs.entry("neg", "y");
        negative.weight = -1.0;
        Entry backwards = TestDocs.entry("back", "z");
        backwards.range = new int[] { 5, 2 };
        Entry noValue = TestDocs.entry("empty", null);
        doc.tables.add(TestDocs.simple("odd", both, negative, backwards, noValue, TestDocs.entry("both", "dup")));
        doc.tables.add(TestDocs.simple("nothing"));

        ValidationResult r = DocumentValidator.validate(doc);
        assertTrue(r.hasCode("WEIGHT_RANGE_CONFLICT"));
        assertTrue(r.hasCode("INVALID_WEIGHT"));
        assertTrue(r.hasCode("INVALID_RANGE"));
        assertTrue(r.hasCode("MISSING_VALUE"));
        assertTrue(r.hasCode("DUPLICATE_ENTRY_ID"));
        assertTrue(r.hasCode("EMPTY_ENTRIES"));
    }

    @Test
    void zeroWeightTableHasNoActiveEntriesUnlessItExtends() {
        RandomTableDocument doc = minimal();
        Entry off = TestDocs.entry("off", "Off");
        off.weight = 0.0;
        doc.tables.add(TestDocs.simple("dormant", off));
        assertTrue(DocumentValidator.validate(doc).hasCode("NO_ACTIVE_ENTRIES"));

        RandomTableDocument child = minimal();
        Entry override = TestDocs.entry("sword", null);
        override.weight = 0.0;
        SimpleTable noSwords = TestDocs.simple("noSwords", override);
        noSwords.extendsId = "weapons";
        child.tables.add(noSwords);
        ValidationResult r = DocumentValidator.validate(child);
        assertTrue(r.valid, r.issues.toString());
    }

    @Test
    void referenceChecks() {
        RandomTableDocument doc = minimal();
        SimpleTable orphan = TestDocs.simple("orphan", TestDocs.entry("x"));
        orphan.extendsId = "missing";
        doc.tables.add(orphan);
        doc.tables.add(TestDocs.composite("mix", "weapons", "ghost"));
        doc.tables.add(TestDocs.composite("none"));
        doc.tables.add(TestDocs.collection("pool", "weapons", "phantom"));
        doc.tables.add(TestDocs.collection("nopool"));
        doc.tables.add(TestDocs.composite("remote", "other.ns.weapons"));

        ValidationResult r = DocumentValidator.validate(doc);
        assertTrue(r.hasCode("INVALID_EXTENDS"));
        assertTrue(r.hasCode("INVALID_SOURCE"));
        assertTrue(r.hasCode("EMPTY_SOURCES"));
        assertTrue(r.hasCode("INVALID_COLLECTION"));
        assertTrue(r.hasCode("EMPTY_COLLECTIONS"));
        long sourceErrors = r.errors().stream().filter(i -> i.code.equals("INVALID_SOURCE")).count();
        assertEquals(1, sourceErrors);
    }

    @Test
    void circularInheritance() {
        RandomTableDocument doc = minimal();
        SimpleTable a = TestDocs.simple("a", TestDocs.entry("A"));
        a.extendsId = "b";
        SimpleTable b = TestDocs.simple("b", TestDocs.entry("B"));
        b.extendsId = "a";
        doc.tables.add(a);
        doc.tables.add(b);

        ValidationResult r = DocumentValidator.validate(doc);
        assertTrue(r.hasCode("CIRCULAR_INHERITANCE"));
    }

    @Test
    void templateAndVariableChecks() {
        RandomTableDocument doc = minimal();
        Template noPattern = TestDocs.template("blank", null);
        noPattern.name = null;
        doc.templates.add(noPattern);
        doc.templates.add(TestDocs.template("weapons", "{{weapons}}"));
        doc.variables.put("bad-name", "1");
        doc.shared.put("$unique", "{{weapons}}");

        ValidationResult r = DocumentValidator.validate(doc);
        assertTrue(r.hasCode("MISSING_PATTERN"));
        assertTrue(r.hasCode("MISSING_TEMPLATE_NAME"));
        assertTrue(r.hasCode("INVALID_VARIABLE_NAME"));
        assertTrue(r.hasCode("RESERVED_WORD"));
        assertTrue(r.warnings().stream().anyMatch(i -> i.code.equals("ID_COLLISION")));
    }

    @Test
    void malformedSwitchIsReportedWithPath() {
        RandomTableDocument doc = minimal();
        doc.tables.add(TestDocs.simple("moods",
                TestDocs.sets(TestDocs.entry("calm", "Calm"), "tone", "{{switch[$x==1 \"soft\"]}}")));

        ValidationResult r = DocumentValidator.validate(doc);
        assertFalse(r.valid);
        ValidationIssue issue = r.errors().get(0);
        assertEquals("INVALID_PATTERN", issue.code);
        assertEquals("tables[1].entries[0].sets.tone", issue.path);
    }
}
