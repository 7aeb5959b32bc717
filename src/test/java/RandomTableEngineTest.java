import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.randomtable.debug.Debug;
import com.randomtable.debug.DebugSink;
import com.randomtable.engine.EngineConfig;
import com.randomtable.engine.RandomTableEngine;
import com.randomtable.engine.RollOptions;
import com.randomtable.engine.RollResult;
import com.randomtable.engine.TableEngineException;
import com.randomtable.engine.UniqueOverflowBehavior;
import com.randomtable.engine.model.Entry;
import com.randomtable.engine.model.RandomTableDocument;
import com.randomtable.engine.model.SimpleTable;
import com.randomtable.engine.model.Template;
import com.randomtable.engine.runtime.CaptureVariable;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RandomTableEngineTest {

    private DebugSink previousSink;
    private TestDocs.CollectingSink sink;
    private RandomTableEngine engine;

    @BeforeEach
    void setUp() {
        previousSink = Debug.get().getSink();
        sink = new TestDocs.CollectingSink();
        Debug.get().setSink(sink);
        engine = new RandomTableEngine(new EngineConfig(), new Random(42));
    }

    @AfterEach
    void tearDown() {
        Debug.get().setSink(previousSink);
    }

    private RollResult template(RandomTableDocument doc, String pattern) {
        doc.templates.add(TestDocs.template("t", pattern));
        engine.loadCollection(doc, "test");
        return engine.rollTemplate("t", "test");
    }

    private static RandomTableDocument races() {
        RandomTableDocument doc = TestDocs.doc("test.races");
        doc.tables.add(TestDocs.simple("race",
                TestDocs.sets(TestDocs.entry("elf", "Elf"), "firstName", "{{elfFirst}}", "surname", "{{elfSurname}}")));
        doc.tables.add(TestDocs.simple("elfFirst", TestDocs.entry("Aelar")));
        doc.tables.add(TestDocs.simple("elfSurname", TestDocs.entry("Moonwhisper")));
        return doc;
    }

    // -------------------------
    // Placeholders and sets
    // -------------------------

    @Test
    void templateSharedRollFeedsPlaceholders() {
        RandomTableDocument doc = races();
        Template fullName = TestDocs.template("fullName", "{{@race.firstName}} {{@race.surname}}");
        fullName.shared.put("_init", "{{race}}");
        doc.templates.add(fullName);
        engine.loadCollection(doc, "races");

        RollResult r = engine.rollTemplate("fullName", "races");
        assertEquals("Aelar Moonwhisper", r.text);
        assertEquals(2, r.text.split(" ").length);
    }

    @Test
    void rollExposesEvaluatedSetsAsPlaceholders() {
        engine.loadCollection(races(), "races");
        RollResult r = engine.roll("race", "races");
        assertEquals("Elf", r.text);
        assertEquals("elf", r.metadata.entryId);
        assertEquals("Aelar", String.valueOf(r.placeholders.get("firstName")));
    }

    @Test
    void sharedVariableKeepsSetsOfSingleTableRoll() {
        RandomTableDocument doc = races();
        doc.shared.put("$hero", "{{race}}");
        RollResult r = template(doc, "{{$hero}} named {{$hero.@firstName}}");
        assertEquals("Elf named Aelar", r.text);
    }

    @Test
    void setCycleKeepsRawValue() {
        RandomTableDocument doc = TestDocs.doc("test.cycle");
        doc.tables.add(TestDocs.simple("loop", TestDocs.sets(TestDocs.entry("v"), "echo", "again {{loop}}")));
        engine.loadCollection(doc, "cycle");

        RollResult r = engine.roll("loop", "cycle");
        assertEquals("v", r.text);
        assertTrue(sink.anyContains("Cycle while evaluating set loop.echo"));
    }

    @Test
    void selfReferenceHitsRecursionLimit() {
        RandomTableDocument doc = TestDocs.doc("test.self");
        doc.tables.add(TestDocs.simple("forever", TestDocs.entry("and {{forever}}")));
        engine.loadCollection(doc, "self");
        engine.setMaxRecursionDepth(10);

        TableEngineException e = assertThrows(TableEngineException.class, () -> engine.roll("forever", "self"));
        assertEquals(TableEngineException.ErrorType.RECURSION_LIMIT, e.getType());
        assertTrue(e.getMessage().startsWith("Recursion limit exceeded (10)"));
    }

    @Test
    void selfPlaceholderSeesEntryAfterNestedRoll() {
        RandomTableDocument doc = races();
        Entry e = TestDocs.entry("Tower of {{elfFirst}}");
        e.description = "Home of {{elfSurname}}";
        doc.tables.add(TestDocs.simple("place",
                TestDocs.sets(e, "raw", "{{@self.value}}", "about", "{{elfFirst}}: {{@self.description}}")));
        engine.loadCollection(doc, "races");

        RollResult r = engine.roll("place", "races");
        assertEquals("Tower of Aelar", r.text);
        assertEquals("Tower of {{elfFirst}}", String.valueOf(r.placeholders.get("raw")));
        assertEquals("Aelar: Home of Moonwhisper", String.valueOf(r.placeholders.get("about")));
        assertNotNull(r.descriptions);
        assertEquals("Home of Moonwhisper", r.descriptions.get(0).description);
    }

    // -------------------------
    // Captures
    // -------------------------

    private static RandomTableDocument crew() {
        RandomTableDocument doc = TestDocs.doc("test.crew");
        doc.tables.add(TestDocs.simple("npc",
                TestDocs.sets(TestDocs.entry("a", "Ann"), "role", "guard"),
                TestDocs.sets(TestDocs.entry("b", "Bob"), "role", "guard"),
                TestDocs.sets(TestDocs.entry("c", "Cid"), "role", "thief")));
        return doc;
    }

    @Test
    void captureIndexCountAndCollect() {
        RollResult r = template(crew(),
                "{{3*unique*npc >> $crew|silent}}{{$crew.count}}|{{$crew[0]}}|{{$crew[-1]}}|{{collect:$crew.@role|unique}}");

        String[] parts = r.text.split("\\|");
        assertEquals(4, parts.length, r.text);
        assertEquals("3", parts[0]);

        Set<String> names = Set.of("Ann", "Bob", "Cid");
        assertTrue(names.contains(parts[1]));
        assertTrue(names.contains(parts[2]));
        assertNotEquals(parts[1], parts[2]);

        assertEquals(Set.of("guard", "thief"), new HashSet<>(Arrays.asList(parts[3].split(", "))));
        assertEquals(2, parts[3].split(", ").length);

        CaptureVariable captured = r.captures.get("crew");
        assertEquals(3, captured.count);
        assertEquals(parts[1], captured.items.get(0).value);
    }

    @Test
    void captureNotSilentPrintsWithSeparator() {
        RollResult r = template(crew(), "{{2*unique*npc >> $pair|\" & \"}}");
        assertEquals(2, r.text.split(" & ").length);
    }

    @Test
    void captureOutOfBoundsAndForwardReferenceAreEmpty() {
        RollResult r = template(crew(), "[{{$later[0]}}]{{1*npc >> $later|silent}}[{{$later[5]}}]");
        assertEquals("[][]", r.text);
        assertTrue(sink.anyContains("Capture variable not found: $later"));
        assertTrue(sink.anyContains("out of bounds"));
    }

    // -------------------------
    // Scoping
    // -------------------------

    @Test
    void referencedTemplateDoesNotSeeCallerPlaceholders() {
        RandomTableDocument doc = races();
        doc.templates.add(TestDocs.template("inner", "[{{@race}}]"));
        RollResult r = template(doc, "{{race}}-{{inner}}");
        assertEquals("Elf-[]", r.text);
    }

    @Test
    void referencedTemplateLeavesCallerPlaceholdersAlone() {
        boolean innerRolledDifferently = false;
        for (int seed = 0; seed < 20; seed++) {
            engine = new RandomTableEngine(new EngineConfig(), new Random(seed));
            RandomTableDocument doc = TestDocs.doc("test.scope");
            doc.tables.add(TestDocs.simple("race", TestDocs.entry("Elf"), TestDocs.entry("Dwarf")));
            doc.templates.add(TestDocs.template("inner", "{{race}}"));

            String[] fields = template(doc, "{{race}}|{{inner}}|{{@race}}").text.split("\\|", -1);
            assertEquals(fields[0], fields[2]);
            if (!fields[0].equals(fields[1])) innerRolledDifferently = true;
        }
        assertTrue(innerRolledDifferently);
    }

    @Test
    void crossCollectionTemplateLeavesCallerPlaceholdersAlone() {
        boolean innerRolledDifferently = false;
        for (int seed = 0; seed < 20; seed++) {
            engine = new RandomTableEngine(new EngineConfig(), new Random(seed));
            RandomTableDocument main = TestDocs.doc("test.main");
            main.tables.add(TestDocs.simple("race", TestDocs.entry("Elf"), TestDocs.entry("Dwarf")));
            RandomTableDocument other = TestDocs.doc("ns");
            other.templates.add(TestDocs.template("inner", "{{race}}"));
            engine.loadCollection(other, "other");

            String[] fields = template(main, "{{race}}|{{ns.inner}}|{{@race}}").text.split("\\|", -1);
            assertEquals(3, fields.length);
            assertFalse(fields[1].isEmpty());
            assertEquals(fields[0], fields[2]);
            if (!fields[0].equals(fields[1])) innerRolledDifferently = true;
        }
        assertTrue(innerRolledDifferently);
    }

    @Test
    void instanceIsRolledOnce() {
        for (int seed = 0; seed < 10; seed++) {
            engine = new RandomTableEngine(new EngineConfig(), new Random(seed));
            RandomTableDocument doc = TestDocs.doc("test.inst");
            doc.tables.add(TestDocs.simple("npc", TestDocs.entry("Ann"), TestDocs.entry("Bob"), TestDocs.entry("Cid")));

            String[] names = template(doc, "{{npc#boss}} {{npc#boss}}").text.split(" ");
            assertEquals(names[0], names[1]);
        }
    }

    // -------------------------
    // Conditionals, dice, math, variables
    // -------------------------

    @Test
    void attachedAndStandaloneSwitches() {
        RandomTableDocument doc = races();
        doc.variables.put("level", "7");
        RollResult r = template(doc,
                "{{race.switch[$==\"Elf\":\"pointy\"].else[\"round\"]}}"
                        + " {{race.switch[$==\"Orc\":\"tusks\"]}}"
                        + " {{switch[$level>5:\"veteran\"].else[\"novice\"]}}"
                        + " {{switch[$level>10:\"boss\"].else[elfFirst]}}");
        assertEquals("pointy Elf veteran Aelar", r.text);
    }

    @Test
    void diceMathAndVariables() {
        RandomTableDocument doc = TestDocs.doc("test.calc");
        doc.variables.put("gold", "12");
        RollResult r = template(doc, "{{dice:1d1+2}} {{2 + 3 * 4}} {{math:$gold / 5}} {{math:1 / 0}} {{math:(1}} {{$gold}}");
        assertEquals("3 14 2 0 [math error] 12", r.text);
    }

    @Test
    void oversizedMathIsAnErrorNotAWrappedValue() {
        RollResult r = template(TestDocs.doc("test.big"), "{{math:3000000000}}|{{math:2000000000 + 2000000000}}|{{math:2000000000 + 1}}");
        assertEquals("[math error]|[math error]|2000000001", r.text);
        assertTrue(sink.anyContains("Math evaluation error"));
    }

    @Test
    void oversizedIndexesAndCountsDegradeGracefully() {
        engine.loadCollection(gems(), "gems");
        RollResult r = engine.evaluateRawPattern(
                "{{2*gems >> $x|silent}}[{{$x[99999999999]}}][{{$x[-99999999999]}}]", "gems");
        assertEquals("[][]", r.text);
        assertTrue(sink.anyContains("out of bounds"));

        String one = engine.evaluateRawPattern("{{99999999999*gems}}", "gems").text;
        assertTrue(Set.of("Ruby", "Opal").contains(one), one);
        assertTrue(sink.anyContains("Roll count out of range"));

        RandomTableDocument doc = TestDocs.doc("test.again");
        doc.tables.add(TestDocs.simple("chain", TestDocs.entry("x", "x{{99999999999*again}}"), TestDocs.entry("y", "y")));
        engine.loadCollection(doc, "again");
        for (int i = 0; i < 10; i++) {
            String text = engine.roll("chain", "again").text;
            assertTrue(text.equals("xy") || text.equals("y"), text);
        }
    }

    @Test
    void unknownReferenceIsEmptyWithWarning() {
        RollResult r = template(TestDocs.doc("test.none"), "a{{ghost}}b");
        assertEquals("ab", r.text);
        assertTrue(sink.anyContains("Table or template not found: ghost"));
    }

    @Test
    void escapedBracesStayLiteral() {
        RollResult r = template(TestDocs.doc("test.esc"), "\\{{not}} {{1+1}}");
        assertEquals("{{not}} 2", r.text);
    }

    // -------------------------
    // Table kinds
    // -------------------------

    @Test
    void inheritanceMergesEntriesById() {
        RandomTableDocument doc = TestDocs.doc("test.inherit");
        doc.tables.add(TestDocs.simple("weapons", TestDocs.entry("sword", "Sword"), TestDocs.entry("axe", "Axe")));
        Entry noSword = TestDocs.entry("sword", null);
        noSword.weight = 0.0;
        SimpleTable elven = TestDocs.simple("elvenWeapons", noSword, TestDocs.entry("axe", "Elven Axe"),
                TestDocs.entry("bow", "Bow"));
        elven.extendsId = "weapons";
        doc.tables.add(elven);
        engine.loadCollection(doc, "inherit");

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 50; i++) seen.add(engine.roll("elvenWeapons", "inherit").text);
        assertEquals(Set.of("Elven Axe", "Bow"), seen);
    }

    @Test
    void circularInheritanceFails() {
        RandomTableDocument doc = TestDocs.doc("test.circle");
        SimpleTable a = TestDocs.simple("a", TestDocs.entry("A"));
        a.extendsId = "b";
        SimpleTable b = TestDocs.simple("b", TestDocs.entry("B"));
        b.extendsId = "a";
        doc.tables.add(a);
        doc.tables.add(b);
        engine.loadCollection(doc, "circle");

        TableEngineException e = assertThrows(TableEngineException.class, () -> engine.roll("a", "circle"));
        assertEquals(TableEngineException.ErrorType.INHERITANCE_ERROR, e.getType());
    }

    @Test
    void compositeAndCollectionTables() {
        RandomTableDocument doc = TestDocs.doc("test.kinds");
        doc.tables.add(TestDocs.simple("melee", TestDocs.sets(TestDocs.entry("Sword"), "hands", "one")));
        doc.tables.add(TestDocs.simple("ranged", TestDocs.sets(TestDocs.entry("Bow"), "hands", "two")));
        doc.tables.add(TestDocs.composite("weapon", "melee", "ranged"));
        doc.tables.add(TestDocs.collection("anyWeapon", "melee", "ranged"));
        engine.loadCollection(doc, "kinds");

        Set<String> composite = new HashSet<>();
        Set<String> merged = new HashSet<>();
        for (int i = 0; i < 40; i++) {
            composite.add(engine.roll("weapon", "kinds").text);
            RollResult r = engine.roll("anyWeapon", "kinds");
            merged.add(r.text);
            assertEquals(r.text.equals("Sword") ? "one" : "two", String.valueOf(r.placeholders.get("hands")));
        }
        assertEquals(Set.of("Sword", "Bow"), composite);
        assertEquals(Set.of("Sword", "Bow"), merged);
    }

    @Test
    void compositeWithMissingSourceFails() {
        RandomTableDocument doc = TestDocs.doc("test.broken");
        doc.tables.add(TestDocs.composite("weapon", "nowhere"));
        engine.loadCollection(doc, "broken");
        TableEngineException e = assertThrows(TableEngineException.class, () -> engine.roll("weapon", "broken"));
        assertEquals(TableEngineException.ErrorType.TABLE_NOT_FOUND, e.getType());
    }

    // -------------------------
    // Uniqueness
    // -------------------------

    private static RandomTableDocument gems() {
        RandomTableDocument doc = TestDocs.doc("test.gems");
        doc.tables.add(TestDocs.simple("gems", TestDocs.entry("Ruby"), TestDocs.entry("Opal")));
        return doc;
    }

    @Test
    void uniqueOverflowStopReturnsWhatItHas() {
        RollResult r = template(gems(), "{{3*unique*gems}}");
        assertEquals(Set.of("Ruby", "Opal"), new HashSet<>(Arrays.asList(r.text.split(", "))));
    }

    @Test
    void uniqueOverflowErrorThrows() {
        engine.setUniqueOverflowBehavior(UniqueOverflowBehavior.ERROR);
        TableEngineException e = assertThrows(TableEngineException.class, () -> template(gems(), "{{3*unique*gems}}"));
        assertEquals(TableEngineException.ErrorType.UNIQUE_OVERFLOW, e.getType());
    }

    @Test
    void uniqueOverflowCycleStartsOver() {
        engine.setUniqueOverflowBehavior(UniqueOverflowBehavior.CYCLE);
        List<String> picks = Arrays.asList(template(gems(), "{{3*unique*gems}}").text.split(", "));
        assertEquals(3, picks.size());
        assertEquals(Set.of("Ruby", "Opal"), new HashSet<>(picks.subList(0, 2)));
    }

    @Test
    void againRerollsWithoutCurrentEntry() {
        RandomTableDocument doc = TestDocs.doc("test.again");
        doc.tables.add(TestDocs.simple("loot", TestDocs.entry("Gold"), TestDocs.entry("Silver"),
                TestDocs.entry("twice", "{{2*unique*again|\" & \"}}")));
        engine.loadCollection(doc, "again");

        Set<String> allowed = Set.of("Gold", "Silver", "Gold & Silver", "Silver & Gold");
        for (int i = 0; i < 30; i++) {
            String text = engine.roll("loot", "again").text;
            assertTrue(allowed.contains(text), text);
        }
    }

    // -------------------------
    // Shadowing
    // -------------------------

    @Test
    void tableSharedCannotShadowDocumentShared() {
        RandomTableDocument doc = TestDocs.doc("test.shadow");
        doc.shared.put("$hero", "Aria");
        SimpleTable t = TestDocs.simple("scene", TestDocs.entry("{{$hero}}"));
        t.shared.put("hero", "Bob");
        doc.tables.add(t);
        engine.loadCollection(doc, "shadow");

        TableEngineException e = assertThrows(TableEngineException.class, () -> engine.roll("scene", "shadow"));
        assertEquals(TableEngineException.ErrorType.SHARED_SHADOW, e.getType());
    }

    @Test
    void templateSharedCannotShadowStatic() {
        RandomTableDocument doc = TestDocs.doc("test.shadow");
        doc.variables.put("mood", "calm");
        Template t = TestDocs.template("scene", "{{$mood}}");
        t.shared.put("mood", "angry");
        doc.templates.add(t);
        engine.loadCollection(doc, "shadow");

        TableEngineException e = assertThrows(TableEngineException.class, () -> engine.rollTemplate("scene", "shadow"));
        assertEquals(TableEngineException.ErrorType.SHARED_SHADOW, e.getType());
    }

    // -------------------------
    // Facade
    // -------------------------

    @Test
    void unknownIdsThrowTypedErrors() {
        engine.loadCollection(gems(), "gems");
        assertEquals(TableEngineException.ErrorType.TABLE_NOT_FOUND,
                assertThrows(TableEngineException.class, () -> engine.roll("nope", "gems")).getType());
        assertEquals(TableEngineException.ErrorType.TEMPLATE_NOT_FOUND,
                assertThrows(TableEngineException.class, () -> engine.rollTemplate("nope", "gems")).getType());
        assertEquals(TableEngineException.ErrorType.COLLECTION_NOT_FOUND,
                assertThrows(TableEngineException.class, () -> engine.roll("gems", "missing")).getType());
    }

    @Test
    void traceOnlyWhenRequested() throws Exception {
        engine.loadCollection(races(), "races");
        assertNull(engine.roll("race", "races").trace);

        RollResult traced = engine.roll("race", "races", RollOptions.traced());
        assertNotNull(traced.trace);
        assertTrue(traced.trace.stats.nodeCount > 1);
        assertTrue(traced.trace.stats.tablesAccessed.contains("race"));
        assertTrue(traced.trace.toJson().contains("\"root\""));
    }

    @Test
    void rawPatternKeepsExpressionOutputs() {
        engine.loadCollection(races(), "races");
        RollResult r = engine.evaluateRawPattern("{{race}} is {{2+2}}", "races");
        assertEquals("Elf is 4", r.text);
        assertEquals(List.of("Elf", "4"), r.expressionOutputs);
        assertEquals("__preview__", r.metadata.sourceId);
    }

    @Test
    void rawPatternSharedActsLikeTemplateShared() {
        engine.loadCollection(races(), "races");
        RollResult r = engine.evaluateRawPattern("{{$who.@surname}}", "races", Map.of("who", "{{race}}"),
                RollOptions.DEFAULT);
        assertEquals("Moonwhisper", r.text);
    }

    @Test
    void loadFromJsonValidatesFirst() throws Exception {
        String bad = "{\"metadata\":{\"name\":\"x\",\"namespace\":\"bad.ns\",\"version\":\"1.0.0\",\"specVersion\":\"1.0\"},"
                + "\"tables\":[{\"id\":\"empty\",\"name\":\"Empty\",\"type\":\"simple\",\"entries\":[]}]}";
        assertFalse(engine.loadFromJson(bad, "bad").valid);
        assertFalse(engine.hasCollection("bad"));

        String good = "{\"metadata\":{\"name\":\"x\",\"namespace\":\"good.ns\",\"version\":\"1.0.0\",\"specVersion\":\"1.0\"},"
                + "\"tables\":[{\"id\":\"coin\",\"name\":\"Coin\",\"type\":\"simple\",\"entries\":[{\"value\":\"Heads\"}]}]}";
        assertTrue(engine.loadFromJson(good, "good").valid);
        assertEquals("Heads", engine.roll("coin", "good").text);
        assertEquals(1, engine.listCollections().size());
        assertTrue(engine.unloadCollection("good"));
        assertFalse(engine.hasCollection("good"));
    }

    @Test
    void documentConfigOverridesEngineConfig() {
        RandomTableDocument doc = TestDocs.doc("test.limits");
        doc.metadata.maxRecursionDepth = 3;
        doc.tables.add(TestDocs.simple("a", TestDocs.entry("{{b}}")));
        doc.tables.add(TestDocs.simple("b", TestDocs.entry("{{c}}")));
        doc.tables.add(TestDocs.simple("c", TestDocs.entry("{{d}}")));
        doc.tables.add(TestDocs.simple("d", TestDocs.entry("deep")));
        engine.loadCollection(doc, "limits");

        TableEngineException e = assertThrows(TableEngineException.class, () -> engine.roll("a", "limits"));
        assertEquals(TableEngineException.ErrorType.RECURSION_LIMIT, e.getType());
        assertEquals("deep", engine.roll("c", "limits").text);
    }
}
