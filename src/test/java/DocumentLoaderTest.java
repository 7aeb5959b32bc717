import org.junit.jupiter.api.Test;

import com.randomtable.engine.UniqueOverflowBehavior;
import com.randomtable.engine.model.CollectionTable;
import com.randomtable.engine.model.CompositeTable;
import com.randomtable.engine.model.DocumentLoader;
import com.randomtable.engine.model.Entry;
import com.randomtable.engine.model.RandomTableDocument;
import com.randomtable.engine.model.SimpleTable;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentLoaderTest {

    private static final String DOC = "{\n" +
            "  \"metadata\": {\"name\": \"Loot\", \"namespace\": \"loot.core\", \"version\": \"1.2.0\",\n" +
            "               \"specVersion\": \"1.0\", \"uniqueOverflowBehavior\": \"cycle\", \"maxRecursionDepth\": 12,\n" +
            "               \"somethingNew\": true},\n" +
            "  \"imports\": [{\"path\": \"names.json\", \"alias\": \"n\"}],\n" +
            "  \"variables\": {\"currency\": \"gp\"},\n" +
            "  \"shared\": {\"hoard\": \"{{dice:2d6}}\"},\n" +
            "  \"tables\": [\n" +
            "    {\"id\": \"coins\", \"name\": \"Coins\", \"entries\": [\n" +
            "        {\"value\": \"copper\", \"range\": [1, 4], \"sets\": {\"metal\": \"cu\"}},\n" +
            "        {\"id\": \"gold\", \"value\": \"gold\", \"weight\": 0.5, \"tags\": [\"rare\"]}\n" +
            "    ]},\n" +
            "    {\"id\": \"fancyCoins\", \"type\": \"simple\", \"extends\": \"coins\", \"entries\": null},\n" +
            "    {\"id\": \"anyLoot\", \"type\": \"composite\",\n" +
            "     \"sources\": [{\"tableId\": \"coins\", \"weight\": 3}, {\"tableId\": \"gems\"}]},\n" +
            "    {\"id\": \"allLoot\", \"type\": \"collection\", \"collections\": [\"coins\", \"gems\"], \"hidden\": true}\n" +
            "  ],\n" +
            "  \"templates\": [{\"id\": \"pile\", \"pattern\": \"{{coins}} {{$currency}}\"}]\n" +
            "}";

    @Test
    void readsMetadataAndTopLevelMaps() throws Exception {
        RandomTableDocument doc = DocumentLoader.fromJson(DOC);

        assertEquals("loot.core", doc.metadata.namespace);
        assertEquals(UniqueOverflowBehavior.CYCLE, doc.metadata.uniqueOverflowBehavior);
        assertEquals(Integer.valueOf(12), doc.metadata.maxRecursionDepth);
        assertNull(doc.metadata.maxExplodingDice);
        assertEquals("gp", doc.variables.get("currency"));
        assertEquals("{{dice:2d6}}", doc.shared.get("hoard"));
        assertEquals("names.json", doc.findImport("n").path);
        assertNull(doc.findImport("names.json"));
    }

    @Test
    void typeDiscriminatorPicksTableKind() throws Exception {
        RandomTableDocument doc = DocumentLoader.fromJson(DOC);

        assertEquals(4, doc.tables.size());
        assertTrue(doc.tables.get(0) instanceof SimpleTable);
        assertTrue(doc.tables.get(1) instanceof SimpleTable);
        assertTrue(doc.tables.get(2) instanceof CompositeTable);
        assertTrue(doc.tables.get(3) instanceof CollectionTable);

        assertEquals("coins", doc.tables.get(1).extendsId);
        assertTrue(doc.tables.get(3).hidden);
        assertEquals("collection", doc.tables.get(3).type());
    }

    @Test
    void entriesKeepRangeWeightAndSets() throws Exception {
        RandomTableDocument doc = DocumentLoader.fromJson(DOC);
        SimpleTable coins = (SimpleTable) doc.tables.get(0);

        Entry copper = coins.entries.get(0);
        assertArrayEquals(new int[]{1, 4}, copper.range);
        assertEquals(4.0, copper.effectiveWeight());
        assertEquals("cu", copper.sets.get("metal"));

        Entry gold = coins.entries.get(1);
        assertEquals("gold", gold.id);
        assertEquals(0.5, gold.effectiveWeight());
        assertEquals("rare", gold.tags.get(0));
        assertTrue(gold.sets.isEmpty());
    }

    @Test
    void compositeSourcesWithOptionalWeight() throws Exception {
        CompositeTable any = (CompositeTable) DocumentLoader.fromJson(DOC).tables.get(2);

        assertEquals(2, any.sources.size());
        assertEquals("coins", any.sources.get(0).tableId);
        assertEquals(Double.valueOf(3.0), any.sources.get(0).weight);
        assertNull(any.sources.get(1).weight);
    }

    @Test
    void explicitNullsBecomeEmpty() throws Exception {
        RandomTableDocument doc = DocumentLoader.fromJson(
                "{\"metadata\": null, \"tables\": [{\"id\": \"x\", \"entries\": null, \"shared\": null}], \"templates\": null}");

        assertNotNull(doc.metadata);
        assertNotNull(doc.templates);
        SimpleTable x = (SimpleTable) doc.tables.get(0);
        assertTrue(x.entries.isEmpty());
        assertTrue(x.shared.isEmpty());
    }

    @Test
    void writtenJsonReadsBackWithSameShape() throws Exception {
        RandomTableDocument doc = DocumentLoader.fromJson(DOC);
        String json = DocumentLoader.toJson(doc);

        assertTrue(json.contains("\"extends\" : \"coins\""));
        assertTrue(json.contains("\"type\" : \"composite\""));
        assertTrue(json.contains("\"uniqueOverflowBehavior\" : \"cycle\""));

        RandomTableDocument again = DocumentLoader.fromJson(json);
        assertTrue(again.tables.get(3) instanceof CollectionTable);
        assertEquals("{{coins}} {{$currency}}", again.templates.get(0).pattern);
    }

    @Test
    void malformedJsonThrows() {
        assertThrows(Exception.class, () -> DocumentLoader.fromJson("{\"tables\": [ }"));
    }
}
