/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.history;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.refkey.EventAttributes;
import io.refkey.TokenDeriver;

/**
 * Contract tests every {@linkplain HistoryLedger} must pass.
 */
public abstract class AbstractHistoryLedgerTest {
  
  final static LocalDate MATCH_DAY = LocalDate.of(2025, 6, 20);
  final static LocalDateTime MORNING = MATCH_DAY.atTime(9, 15, 2, 123_456_000);
  
  @TempDir
  File tempDir;
  
  
  /**
   * Returns a new, empty ledger. Each invocation in a test gets its own
   * {@code label}.
   */
  protected abstract HistoryLedger newLedger(Object label) throws Exception;
  
  
  
  static HistoryEntry entry(LocalDateTime issuedAt, String a, String b, int day, int hour) {
    var attr = new EventAttributes(a, b, LocalDate.of(2025, 6, day), LocalTime.of(hour, 30));
    return HistoryEntry.of(issuedAt, attr, TokenDeriver.defaultInstance().derive(attr));
  }
  
  
  static List<HistoryEntry> sampleEntries(int count, LocalDateTime start) {
    var entries = new ArrayList<HistoryEntry>(count);
    for (int index = 0; index < count; ++index)
      entries.add(entry(
          start.plusMinutes(7 * index),
          "Team " + index, "Rivals " + (count - index),
          1 + index % 28, 8 + index % 12));
    return entries;
  }
  
  
  @Test
  public void testEmpty() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    assertTrue(ledger.load().isEmpty());
    assertEquals(0, ledger.size());
    assertEquals(HistoryStats.EMPTY, ledger.stats(MATCH_DAY));
  }
  
  
  @Test
  public void testOne() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    var e = entry(MORNING, "Les Aigles Rouges", "Les Lions Bleus", 20, 18);
    ledger.append(e);
    assertEquals(List.of(e), ledger.load());
    assertEquals(1, ledger.size());
  }
  
  
  @Test
  public void testAppendOrder() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    var entries = sampleEntries(17, MORNING);
    for (var e : entries)
      ledger.append(e);
    assertEquals(entries, ledger.load());
  }
  
  
  @Test
  public void testDuplicatesKept() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    var first = entry(MORNING, "Les Aigles Rouges", "Les Lions Bleus", 20, 18);
    var second = entry(MORNING.plusHours(1), "les aigles rouges", "Les Lions Bleus", 20, 18);
    ledger.append(first);
    ledger.append(second);
    ledger.append(first);
    
    var loaded = ledger.load();
    assertEquals(List.of(first, second, first), loaded);
    assertEquals(first.token(), second.token());
  }
  
  
  @Test
  public void testClear() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    for (var e : sampleEntries(5, MORNING))
      ledger.append(e);
    ledger.clear();
    assertTrue(ledger.load().isEmpty());
    assertEquals(0, ledger.stats(MATCH_DAY).total());
    
    var e = entry(MORNING, "A", "B", 3, 10);
    ledger.append(e);
    assertEquals(List.of(e), ledger.load());
  }
  
  
  @Test
  public void testStats() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    for (var e : sampleEntries(3, MORNING))
      ledger.append(e);
    
    assertEquals(new HistoryStats(3, 3), ledger.stats(MATCH_DAY));
    assertEquals(new HistoryStats(3, 0), ledger.stats(MATCH_DAY.plusDays(1)));
    
    ledger.append(entry(MORNING.plusDays(1), "A", "B", 21, 14));
    assertEquals(new HistoryStats(4, 1), ledger.stats(MATCH_DAY.plusDays(1)));
    assertEquals(new HistoryStats(4, 3), ledger.stats(MATCH_DAY));
  }
  
  
  @Test
  public void testAuditable() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    for (var e : sampleEntries(6, MORNING))
      ledger.append(e);
    var audit = HistoryAudit.run(ledger, TokenDeriver.defaultInstance());
    assertEquals(6, audit.checked());
    assertTrue(audit.passed());
  }

}
