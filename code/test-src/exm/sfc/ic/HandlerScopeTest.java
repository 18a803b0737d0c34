package exm.sfc.ic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.sfc.ast.SourceLocation;
import exm.sfc.ic.HandlerScope.Clause;
import exm.sfc.ic.tree.Block;
import exm.sfc.ic.tree.HandlerTable;

public class HandlerScopeTest {

  private static final SourceLocation LOC = SourceLocation.UNKNOWN;

  private static Clause clause(Block entry, String... kinds) {
    return new Clause(Arrays.asList(kinds), null, entry, LOC);
  }

  @Test
  public void testEmpty() {
    assertTrue(HandlerScope.empty().resolve().isEmpty());
    assertEquals(0, HandlerScope.empty().depth());
  }

  @Test
  public void testInnerFirstWithShadowing() {
    Block outerA = new Block(1, LOC);
    Block outerAll = new Block(2, LOC);
    Block innerA = new Block(3, LOC);

    HandlerScope outer = HandlerScope.empty().push(Arrays.asList(
        clause(outerA, "A", "B"), clause(outerAll)));
    HandlerScope inner = outer.push(Arrays.asList(clause(innerA, "A")));

    List<HandlerTable.Entry> entries = inner.resolve().entries();
    assertEquals(3, entries.size());
    assertEquals(Arrays.asList("A"), entries.get(0).kinds);
    assertSame(innerA, entries.get(0).target);
    assertEquals(Arrays.asList("B"), entries.get(1).kinds);
    assertSame(outerA, entries.get(1).target);
    assertEquals(Arrays.asList(HandlerScope.CATCH_ALL), entries.get(2).kinds);
    assertSame(outerAll, entries.get(2).target);

    // Pushing doesn't change the captured scope
    assertEquals(2, outer.resolve().entries().size());
    assertEquals(1, outer.depth());
    assertEquals(2, inner.depth());
  }

  @Test
  public void testFullyShadowedClauseDropped() {
    Block first = new Block(1, LOC);
    Block second = new Block(2, LOC);
    HandlerScope scope = HandlerScope.empty().push(Arrays.asList(
        clause(first, "A"), clause(second, "A")));
    List<HandlerTable.Entry> entries = scope.resolve().entries();
    assertEquals(1, entries.size());
    assertSame(first, entries.get(0).target);
  }

  @Test
  public void testNothingAfterCatchAll() {
    Block all = new Block(1, LOC);
    Block outer = new Block(2, LOC);
    HandlerScope scope = HandlerScope.empty()
        .push(Arrays.asList(clause(outer, "B")))
        .push(Arrays.asList(clause(all, "States.ALL"), clause(all, "C")));
    List<HandlerTable.Entry> entries = scope.resolve().entries();
    assertEquals(1, entries.size());
    assertEquals(Collections.singletonList("States.ALL"),
                 entries.get(0).kinds);
  }

  @Test
  public void testErrorVariableKept() {
    Block entry = new Block(1, LOC);
    HandlerScope scope = HandlerScope.empty().push(Arrays.asList(
        new Clause(Arrays.asList("E"), "err", entry, LOC)));
    assertEquals("err", scope.resolve().entries().get(0).errorVar);
  }
}
