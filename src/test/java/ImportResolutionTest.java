import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.randomtable.debug.Debug;
import com.randomtable.debug.DebugSink;
import com.randomtable.engine.EngineConfig;
import com.randomtable.engine.RandomTableEngine;
import com.randomtable.engine.TableInfo;
import com.randomtable.engine.TemplateInfo;
import com.randomtable.engine.model.Import;
import com.randomtable.engine.model.RandomTableDocument;
import com.randomtable.engine.model.SimpleTable;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class ImportResolutionTest {

    private DebugSink previousSink;
    private TestDocs.CollectingSink sink;
    private RandomTableEngine engine;

    @BeforeEach
    void setUp() {
        previousSink = Debug.get().getSink();
        sink = new TestDocs.CollectingSink();
        Debug.get().setSink(sink);
        engine = new RandomTableEngine(new EngineConfig(), new Random(3));
    }

    @AfterEach
    void tearDown() {
        Debug.get().setSink(previousSink);
    }

    private static Import imp(String path, String alias) {
        Import i = new Import();
        i.path = path;
        i.alias = alias;
        return i;
    }

    /** names (fantasy.names) <- core (fantasy.core, imports names as n) <- adventure (imports core as c). */
    private void loadChain() {
        RandomTableDocument names = TestDocs.doc("fantasy.names");
        names.tables.add(TestDocs.simple("elfNames", TestDocs.entry("Aelar")));
        SimpleTable secret = TestDocs.simple("secretNames", TestDocs.entry("Nobody"));
        secret.hidden = true;
        names.tables.add(secret);
        names.templates.add(TestDocs.template("greeting", "Hail, {{elfNames}}"));

        RandomTableDocument core = TestDocs.doc("fantasy.core");
        core.imports.add(imp("fantasy.names", "n"));
        core.tables.add(TestDocs.simple("hero", TestDocs.entry("{{n.elfNames}} the Bold")));

        RandomTableDocument adventure = TestDocs.doc("fantasy.adventure");
        adventure.imports.add(imp("core-file.json", "c"));
        adventure.templates.add(TestDocs.template("opening", "{{c.hero}} meets {{fantasy.names.elfNames}}"));

        engine.loadCollection(names, "names");
        engine.loadCollection(core, "core");
        engine.loadCollection(adventure, "adventure");
        engine.resolveImports(Map.of("core-file.json", "core"));
    }

    @Test
    void aliasAndNamespaceReferencesResolve() {
        loadChain();
        assertTrue(sink.warnings.isEmpty(), sink.warnings.toString());
        assertEquals("Aelar the Bold meets Aelar", engine.rollTemplate("opening", "adventure").text);
    }

    @Test
    void aliasedTemplateReference() {
        loadChain();
        assertEquals("Hail, Aelar", engine.evaluateRawPattern("{{n.greeting}}", "core").text);
        assertEquals("Aelar", engine.evaluateRawPattern("{{elfNames}}", "adventure").text);
    }

    @Test
    void unresolvedImportWarns() {
        RandomTableDocument lonely = TestDocs.doc("lonely");
        lonely.imports.add(imp("nowhere.json", "x"));
        lonely.templates.add(TestDocs.template("t", "[{{x.thing}}]"));
        engine.loadCollection(lonely, "lonely");
        engine.resolveImports();

        assertTrue(sink.anyContains("Unresolved import 'x'"));
        assertEquals("[]", engine.rollTemplate("t", "lonely").text);
    }

    @Test
    void listingTablesAndImports() {
        loadChain();

        List<TableInfo> own = engine.listTables("names", false);
        assertEquals(1, own.size());
        assertEquals("elfNames", own.get(0).id);
        assertEquals(Integer.valueOf(1), own.get(0).entryCount);
        assertEquals(2, engine.listTables("names", true).size());
        assertEquals(3, engine.listTables(null, true).size());

        List<TableInfo> imported = engine.listImportedTables("adventure", true);
        assertEquals(3, imported.size());
        assertEquals("c", imported.get(0).alias);
        assertEquals("fantasy.core", imported.get(0).sourceNamespace);
        assertEquals("c.n", imported.get(1).alias);

        List<TemplateInfo> templates = engine.listImportedTemplates("adventure");
        assertEquals(1, templates.size());
        assertEquals("greeting", templates.get(0).id);
        assertEquals("c.n", templates.get(0).alias);
    }

    @Test
    void updateDocumentRewiresImports() {
        loadChain();
        RandomTableDocument names = TestDocs.doc("fantasy.names");
        names.tables.add(TestDocs.simple("elfNames", TestDocs.entry("Galinndan")));
        engine.updateDocument("names", names);

        assertEquals("Galinndan the Bold", engine.roll("hero", "core").text);
        assertEquals("Galinndan the Bold meets Galinndan", engine.rollTemplate("opening", "adventure").text);
        assertFalse(sink.anyContains("Unresolved import"));
    }
}
