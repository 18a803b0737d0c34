package exm.sfc.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.NoSuchElementException;

import org.junit.Test;

public class PersistentStackTest {

  @Test
  public void testPushSharesTail() {
    PersistentStack<String> empty = PersistentStack.empty();
    PersistentStack<String> a = empty.push("a");
    PersistentStack<String> ab = a.push("b");
    PersistentStack<String> ac = a.push("c");

    assertTrue(empty.isEmpty());
    assertEquals(Arrays.asList("a"), a.toList());
    assertEquals(Arrays.asList("b", "a"), ab.toList());
    assertEquals(Arrays.asList("c", "a"), ac.toList());
    assertEquals(2, ab.size());
    assertEquals("b", ab.peek());
    assertEquals(a.toList(), ab.pop().toList());
  }

  @Test(expected=NoSuchElementException.class)
  public void testPeekEmpty() {
    PersistentStack.<Integer>empty().peek();
  }
}
