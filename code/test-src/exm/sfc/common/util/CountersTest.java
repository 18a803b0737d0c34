package exm.sfc.common.util;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class CountersTest {

  @Test
  public void testIncrement() {
    Counters<String> c = new Counters<String>();
    assertEquals(0, c.getCount("x"));
    assertEquals(1, c.increment("x"));
    assertEquals(5, c.add("x", 4));
    assertEquals(1, c.increment("y"));
    assertEquals(5, c.getCount("x"));
  }
}
