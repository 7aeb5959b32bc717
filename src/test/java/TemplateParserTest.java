import org.junit.jupiter.api.Test;

import com.randomtable.engine.TableEngineException;
import com.randomtable.engine.parser.Expr;
import com.randomtable.engine.parser.ExpressionMatch;
import com.randomtable.engine.parser.ExpressionToken;
import com.randomtable.engine.parser.TemplateParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateParserTest {

    private static Expr.ExprInterface parse(String expr) {
        return TemplateParser.parseExpression(expr).expr;
    }

    @Test
    void extract_findsSpansAndKeepsNestedBraces() {
        List<ExpressionMatch> m = TemplateParser.extractExpressions("A {{race}} and {{x.switch[$==\"a\":\"{{b}}\"]}}!");
        assertEquals(2, m.size());
        assertEquals("race", m.get(0).expression);
        assertEquals(2, m.get(0).start);
        assertEquals(10, m.get(0).end);
        assertEquals("x.switch[$==\"a\":\"{{b}}\"]", m.get(1).expression);
    }

    @Test
    void extract_skipsEscapedBraces() {
        assertTrue(TemplateParser.extractExpressions("\\{{not}} an expression").isEmpty());
        assertFalse(TemplateParser.hasExpressions("plain text"));
    }

    @Test
    void parseTemplate_literalsAndExpressionsConcatenateBack() {
        List<ExpressionToken> tokens = TemplateParser.parseTemplate("You meet {{2*npc}} at \\{{camp}}.");
        assertEquals(3, tokens.size());
        assertTrue(tokens.get(0).isLiteral());
        assertEquals("You meet ", ((Expr.Literal) tokens.get(0).expr).text);
        assertTrue(tokens.get(1).expr instanceof Expr.MultiRoll);
        assertFalse(tokens.get(1).isLiteral());
        assertTrue(tokens.get(2).isLiteral());
        assertEquals(" at {{camp}}.", ((Expr.Literal) tokens.get(2).expr).text);
    }

    @Test
    void classify_diceMathAndVariables() {
        assertTrue(parse("dice:2d6+1") instanceof Expr.Dice);
        assertEquals("2d6+1", ((Expr.Dice) parse("dice:2d6+1")).expression);
        assertTrue(parse("math:$a + 2") instanceof Expr.MathExpr);
        assertTrue(parse("2 + 3 * 4") instanceof Expr.MathExpr);

        Expr.Variable v = (Expr.Variable) parse("$hero");
        assertEquals("hero", v.name);
        assertNull(v.alias);
    }

    @Test
    void classify_placeholderWithChain() {
        Expr.Placeholder p = (Expr.Placeholder) parse("@race.@culture.@name");
        assertEquals("race", p.name);
        assertEquals(List.of("culture", "name"), p.properties);
    }

    @Test
    void classify_tableReferences() {
        Expr.TableRef plain = (Expr.TableRef) parse("weapons");
        assertEquals("weapons", plain.ref());

        Expr.TableRef aliased = (Expr.TableRef) parse("names.elfNames");
        assertEquals("names", aliased.alias);
        assertEquals("elfNames", aliased.tableId);

        Expr.TableRef namespaced = (Expr.TableRef) parse("fantasy.core.weapons.@damage");
        assertEquals("fantasy.core", namespaced.namespace);
        assertEquals("weapons", namespaced.tableId);
        assertEquals(List.of("damage"), namespaced.properties);
    }

    @Test
    void classify_multiRollAgainAndInstance() {
        Expr.MultiRoll m = (Expr.MultiRoll) parse("3*unique*gems|\" and \"");
        assertEquals(3, m.count.literal);
        assertTrue(m.unique);
        assertEquals("gems", m.tableId);
        assertEquals(" and ", m.separator);

        Expr.MultiRoll varCount = (Expr.MultiRoll) parse("$n*gems");
        assertEquals("n", varCount.count.variable);

        Expr.MultiRoll diceCount = (Expr.MultiRoll) parse("dice:1d4*gems");
        assertEquals("1d4", diceCount.count.diceCount);

        Expr.Again again = (Expr.Again) parse("2*unique*again");
        assertEquals(Integer.valueOf(2), again.count);
        assertTrue(again.unique);

        Expr.Instance inst = (Expr.Instance) parse("npc#boss");
        assertEquals("npc", inst.tableId);
        assertEquals("boss", inst.instanceName);
    }

    @Test
    void oversizedNumbersDoNotBreakParsing() {
        Expr.CaptureAccess far = (Expr.CaptureAccess) parse("$x[99999999999]");
        assertEquals(Integer.valueOf(Integer.MAX_VALUE), far.index);
        Expr.CaptureAccess back = (Expr.CaptureAccess) parse("$x[-99999999999]");
        assertEquals(Integer.valueOf(Integer.MIN_VALUE), back.index);
        assertEquals(Integer.valueOf(-2), ((Expr.CaptureAccess) parse("$x[-0002]")).index);

        Expr.MultiRoll many = (Expr.MultiRoll) parse("99999999999*gems");
        assertEquals(1, many.count.literal);
        assertEquals(Integer.valueOf(1), ((Expr.Again) parse("99999999999*again")).count);
        assertEquals(12, ((Expr.MultiRoll) parse("12*gems")).count.literal);
    }

    @Test
    void classify_captureForms() {
        Expr.CaptureMultiRoll c = (Expr.CaptureMultiRoll) parse("3*unique*npc >> $crew|silent");
        assertEquals("crew", c.captureVar);
        assertTrue(c.unique);
        assertTrue(c.silent);
        assertEquals(3, c.count.literal);

        Expr.CaptureAccess idx = (Expr.CaptureAccess) parse("$crew[-1].@role");
        assertEquals(Integer.valueOf(-1), idx.index);
        assertEquals(List.of("role"), idx.properties);

        Expr.CaptureAccess count = (Expr.CaptureAccess) parse("$crew.count");
        assertNull(count.index);
        assertEquals(List.of("count"), count.properties);

        Expr.Collect collect = (Expr.Collect) parse("collect:$crew.@role|unique|\"; \"");
        assertEquals("role", collect.property);
        assertTrue(collect.unique);
        assertEquals("; ", collect.separator);
    }

    @Test
    void classify_switchForms() {
        ExpressionToken standalone = TemplateParser.parseExpression("switch[$x==1:\"one\"].switch[$x==2:\"two\"].else[\"many\"]");
        assertTrue(standalone.expr instanceof Expr.Switch);
        Expr.Switch sw = (Expr.Switch) standalone.expr;
        assertEquals(2, sw.modifiers.clauses.size());
        assertEquals("$x==1", sw.modifiers.clauses.get(0).condition);
        assertEquals("\"many\"", sw.modifiers.elseExpr);

        ExpressionToken attached = TemplateParser.parseExpression("race.switch[$==\"Elf\":\"pointy\"]");
        assertTrue(attached.expr instanceof Expr.TableRef);
        assertTrue(attached.hasSwitchModifiers());
        assertEquals("race", ((Expr.TableRef) attached.expr).tableId);
    }

    @Test
    void malformedSwitch_isParseError() {
        TableEngineException e = assertThrows(TableEngineException.class,
                () -> TemplateParser.parseExpression("switch[$x==1 \"one\"]"));
        assertEquals(TableEngineException.ErrorType.PARSE_ERROR, e.getType());
        assertTrue(e.getMessage().contains("missing colon"));
    }

    @Test
    void referencedTablesAndVariables() {
        String pattern = "{{race}} {{2*npc}} {{$n*gems >> $loot}} {{$hero}} {{race}}";
        assertEquals(List.of("race", "npc", "gems"), TemplateParser.getReferencedTables(pattern));
        assertEquals(List.of("n", "loot", "hero"), TemplateParser.getReferencedVariables(pattern));
    }
}
