package io.intellixity.strata.dialect;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ParamAllocatorTest {
  @Test
  void renumbersInTextualOrder() {
    ParamAllocator p = new ParamAllocator();
    String first = p.allocate("a");
    String second = p.allocate(42);
    // fragments assembled out of allocation order
    SqlStatement st = p.finish("x = " + second + " AND y = " + first, i -> "$" + i);
    assertEquals("x = $1 AND y = $2", st.sql());
    assertEquals(List.of(42, "a"), st.params());
  }

  @Test
  void repeatedMarkerBindsTwice() {
    ParamAllocator p = new ParamAllocator();
    String from = p.allocate("2024-01-01T00:00:00.000Z");
    SqlStatement st = p.finish("(" + from + ") UNION (" + from + ")", i -> "?");
    assertEquals("(?) UNION (?)", st.sql());
    assertEquals(2, st.params().size());
  }

  @Test
  void unusedValuesAreDropped() {
    ParamAllocator p = new ParamAllocator();
    p.allocate("unused");
    String used = p.allocate("used");
    SqlStatement st = p.finish("v = " + used, i -> "?");
    assertEquals(List.of("used"), st.params());
    assertEquals(2, p.size());
  }

  @Test
  void nullValuesAreKept() {
    ParamAllocator p = new ParamAllocator();
    String m = p.allocate(null);
    SqlStatement st = p.finish("v = " + m, i -> "?");
    assertEquals(Arrays.asList((Object) null), st.params());
  }

  @Test
  void unknownMarkerFails() {
    ParamAllocator p = new ParamAllocator();
    assertThrows(IllegalStateException.class, () -> p.finish("v = $3$", i -> "?"));
  }
}
