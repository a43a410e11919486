/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.history;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-memory, non-persistent ledger.
 */
public class VolatileHistoryLedger implements HistoryLedger {
  
  private final ArrayList<HistoryEntry> entries = new ArrayList<>();
  
  
  public VolatileHistoryLedger() {  }
  
  
  /**
   * Creates an instance with the given initial entries.
   */
  public VolatileHistoryLedger(List<HistoryEntry> entries) {
    for (var e : entries)
      this.entries.add(Objects.requireNonNull(e, "null entry"));
  }
  

  @Override
  public void append(HistoryEntry entry) {
    entries.add(Objects.requireNonNull(entry, "null entry"));
  }

  @Override
  public List<HistoryEntry> load() {
    return List.copyOf(entries);
  }

  @Override
  public void clear() {
    entries.clear();
  }

  @Override
  public int size() {
    return entries.size();
  }

}
