/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.history;


import java.time.LocalDate;
import java.util.List;

/**
 * Aggregate counts over a ledger.
 * 
 * @param total         number of entries since the last clear
 * @param issuedToday   number of entries issued on the {@code asOf} day
 */
public record HistoryStats(int total, int issuedToday) {
  
  /** Stats for an empty ledger. */
  public final static HistoryStats EMPTY = new HistoryStats(0, 0);
  
  
  /**
   * Computes the stats for the given entries.
   * 
   * @param asOf  the day counted as "today"
   */
  public static HistoryStats compute(List<HistoryEntry> entries, LocalDate asOf) {
    int today = 0;
    for (var e : entries)
      if (e.issuedOn(asOf))
        ++today;
    return new HistoryStats(entries.size(), today);
  }
  
  
  public HistoryStats {
    if (total < 0 || issuedToday < 0 || issuedToday > total)
      throw new IllegalArgumentException(
          "total %d, issuedToday %d".formatted(total, issuedToday));
  }

}
