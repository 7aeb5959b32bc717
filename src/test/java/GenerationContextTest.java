import org.junit.jupiter.api.Test;

import com.randomtable.engine.EngineConfig;
import com.randomtable.engine.TableEngineException;
import com.randomtable.engine.runtime.CaptureItem;
import com.randomtable.engine.runtime.GenerationContext;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GenerationContextTest {

    @Test
    void sharedVariablesWinOverStatic() {
        GenerationContext c = GenerationContext.create(new EngineConfig(), Map.of("mood", "calm"));
        assertEquals("calm", c.resolveVariable("mood"));
        c.setSharedVariable("mood", CaptureItem.text("angry"));
        assertEquals("angry", c.resolveVariable("mood"));
        assertNull(c.resolveVariable("other"));
        assertEquals("shared", c.hasVariableConflict("mood"));
    }

    @Test
    void placeholderPropertyDefaultsToValue() {
        GenerationContext c = GenerationContext.create(new EngineConfig(), Map.of());
        c.setPlaceholders("race", Map.of("value", "Elf", "home", "Forest"));
        assertEquals("Elf", c.getPlaceholder("race", null));
        assertEquals("Forest", c.getPlaceholder("race", "home"));
        assertNull(c.getPlaceholder("race", "missing"));
        assertNull(c.getPlaceholder("nobody", null));

        c.mergePlaceholderSets("race", Map.of("home", "Glade"));
        assertEquals("Glade", c.getPlaceholder("race", "home"));
        assertEquals("Elf", c.getPlaceholder("race", null));
    }

    @Test
    void recursionScopeEnforcesLimitAndReleases() {
        EngineConfig config = new EngineConfig();
        config.maxRecursionDepth = 2;
        GenerationContext c = GenerationContext.create(config, Map.of());

        try (GenerationContext.RecursionScope a = c.enterRecursion("outer");
             GenerationContext.RecursionScope b = c.enterRecursion("inner")) {
            assertEquals(2, c.recursionDepth());
            TableEngineException e = assertThrows(TableEngineException.class, () -> c.enterRecursion("deep"));
            assertEquals(TableEngineException.ErrorType.RECURSION_LIMIT, e.getType());
            assertEquals("Recursion limit exceeded (2) in deep", e.getMessage());
            assertEquals(2, c.recursionDepth());
        }
        assertEquals(0, c.recursionDepth());
    }

    @Test
    void isolatedCopySharesStateButNotPlaceholders() {
        GenerationContext c = GenerationContext.create(new EngineConfig(), Map.of());
        c.setPlaceholders("race", Map.of("value", "Elf"));
        c.setSharedVariable("hero", CaptureItem.text("Aria"));
        c.markEntryUsed("gems", "ruby");

        GenerationContext copy = c.isolatedCopy();
        assertNull(copy.getPlaceholder("race", null));
        assertEquals("Aria", copy.resolveVariable("hero"));
        assertTrue(copy.getUsedEntries("gems").contains("ruby"));

        copy.setSharedVariable("villain", CaptureItem.text("Mort"));
        copy.markEntryUsed("gems", "opal");
        assertFalse(c.hasSharedVariable("villain"));
        assertTrue(c.getUsedEntries("gems").contains("opal"));
    }

    @Test
    void setEvaluationGuardDetectsReentry() {
        GenerationContext c = GenerationContext.create(new EngineConfig(), Map.of());
        assertTrue(c.beginSetEvaluation("race.name"));
        assertFalse(c.beginSetEvaluation("race.name"));
        c.endSetEvaluation("race.name");
        assertTrue(c.beginSetEvaluation("race.name"));
    }
}
