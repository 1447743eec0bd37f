package io.intellixity.strata.interval;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class IntervalParserTest {
  @Test
  void parsesSingleAndPluralUnits() {
    assertEquals(Interval.of(1, IntervalUnit.YEAR), IntervalParser.parse("1 year"));
    assertEquals(Interval.of(7, IntervalUnit.DAY), IntervalParser.parse("7 days"));
    assertEquals(Interval.of(30, IntervalUnit.MINUTE), IntervalParser.parse("  30   Minutes "));
  }

  @Test
  void foldsCalendarUnitsIntoMonths() {
    Interval i = IntervalParser.parse("2 years 1 quarter 2 months 4 days");
    assertEquals(29, i.calendarMonths());
    assertEquals(1, i.durationTerms().size());
    assertEquals(4, i.durationTerms().get(IntervalUnit.DAY));
  }

  @Test
  void durationTermsAreOrderedFromDayToSecond() {
    Interval i = IntervalParser.parse("45 seconds 1 hour 30 minutes 2 days");
    assertEquals(
        java.util.List.of(IntervalUnit.DAY, IntervalUnit.HOUR, IntervalUnit.MINUTE, IntervalUnit.SECOND),
        java.util.List.copyOf(i.durationTerms().keySet()));
  }

  @Test
  void repeatedUnitsAddUp() {
    Interval i = IntervalParser.parse("1 day 2 day");
    assertEquals(3, i.get(IntervalUnit.DAY));
    assertEquals("3 day", i.toString());
  }

  @Test
  void blankIsEmptyAndZero() {
    assertTrue(IntervalParser.parse("").isZero());
    assertTrue(IntervalParser.parse("0 day").isZero());
    assertEquals(Interval.empty(), IntervalParser.parse("   "));
  }

  @Test
  void negativeMagnitudesAreAllowed() {
    Interval i = IntervalParser.parse("-1 year");
    assertEquals(-12, i.calendarMonths());
    assertEquals(Interval.of(1, IntervalUnit.YEAR), i.negate());
  }

  @Test
  void rejectsMalformedText() {
    assertThrows(IntervalFormatException.class, () -> IntervalParser.parse("1"));
    assertThrows(IntervalFormatException.class, () -> IntervalParser.parse("one day"));
    IntervalFormatException ex = assertThrows(IntervalFormatException.class, () -> IntervalParser.parse("2 fortnights"));
    assertTrue(ex.getMessage().contains("unknown unit 'fortnights'"));
    assertThrows(IntervalFormatException.class, () -> IntervalParser.parse(null));
  }

  @Test
  void unboundedIsNotAFiniteInterval() {
    assertTrue(IntervalParser.isUnbounded("unbounded"));
    assertTrue(IntervalParser.isUnbounded(" UNBOUNDED "));
    assertFalse(IntervalParser.isUnbounded(null));
    assertFalse(IntervalParser.isUnbounded("1 day"));
    assertThrows(IntervalFormatException.class, () -> IntervalParser.parse("unbounded"));
  }
}
