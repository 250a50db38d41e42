package com.formatengine.printing;

import com.formatengine.ir.Condition;
import com.formatengine.ir.ConditionResolvers;
import com.formatengine.ir.Conditions;
import com.formatengine.ir.Info;
import com.formatengine.ir.PrintItems;
import com.formatengine.ir.Signal;
import com.formatengine.ir.Text;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GraphPreparerTests {

    @Test
    void assignsSequentialIdsToConditionsAndInfos() {
        Info info = new Info("start");
        Condition condition = Conditions.ifTrue("cond", ConditionResolvers.trueResolver(),
                PrintItems.of(Text.of("x")));

        PreparedGraph graph = GraphPreparer.prepare(PrintItems.of(Text.of("a"), info, Signal.NEW_LINE, condition));

        assertEquals(2, graph.size());
        assertEquals(0, graph.findId(info));
        assertEquals(1, graph.findId(condition));
        assertSame(condition, graph.getItem(1));
        assertEquals(4, graph.getRootItems().size());
    }

    @Test
    void sameInstanceKeepsItsId() {
        Info info = new Info("same");

        PreparedGraph graph = GraphPreparer.prepare(PrintItems.of(info, info));

        assertEquals(1, graph.size());
        assertEquals(graph.tag(info), graph.findId(info));
    }

    @Test
    void infosWithSameNameAreDistinct() {
        PreparedGraph graph = GraphPreparer.prepare(PrintItems.of(new Info("dup"), new Info("dup")));

        assertEquals(2, graph.size());
    }

    @Test
    void branchesAreMaterializedLazilyAndCached() {
        Info inner = new Info("inner");
        Condition condition = Conditions.ifTrueOr("cond", ConditionResolvers.trueResolver(),
                PrintItems.of(inner), PrintItems.of(Text.of("f")));

        PreparedGraph graph = GraphPreparer.prepare(PrintItems.of(condition));
        assertEquals(-1, graph.findId(inner));

        assertSame(graph.getTruePath(condition), graph.getTruePath(condition));
        assertTrue(graph.findId(inner) >= 0);
        assertTrue(graph.getFalsePath(Conditions.ifTrue("noFalse", ConditionResolvers.trueResolver(),
                PrintItems.of(Text.of("t")))).isEmpty());
    }

    @Test
    void resolverLookupsTagItemsOutsideTheWalk() {
        Info outside = new Info("outside");
        Condition condition = Conditions.ifTrue("lookup",
                context -> context.getResolvedInfo(outside) != null, PrintItems.of(Text.of("x")));
        PreparedGraph graph = GraphPreparer.prepare(PrintItems.of(condition));

        new Printer(new PrintOptions(80, 4, false)).print(graph);

        assertTrue(graph.findId(outside) >= 0);
    }

    @Test
    void onlyConditionsAndInfosCanBeTagged() {
        PreparedGraph graph = GraphPreparer.prepare(new PrintItems());

        assertThrows(IllegalArgumentException.class, () -> graph.tag(Text.of("a")));
        assertThrows(IllegalArgumentException.class, () -> graph.tag(Signal.NEW_LINE));
    }
}
