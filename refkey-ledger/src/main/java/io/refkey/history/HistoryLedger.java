/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.history;


import java.time.LocalDate;
import java.util.List;

/**
 * Append-only record of issued tokens.
 * 
 * <h2>Contract</h2>
 * <ul>
 * <li>Entries are never reordered, edited or deduplicated. Re-issuing a token
 * for the same event is legitimate and records a second entry.</li>
 * <li>Mutations ({@linkplain #append(HistoryEntry) append} and
 * {@linkplain #clear() clear}) are persisted before they return; on failure they
 * throw {@linkplain StorageException} and leave the persisted state as it was.</li>
 * <li>{@linkplain #load()} never fails: an unreadable or corrupt store reads as
 * empty.</li>
 * </ul>
 * <h2>Concurrency</h2>
 * <p>
 * Instances are not safe under concurrent mutation. Callers serialize access.
 * </p>
 */
public interface HistoryLedger {
  
  
  /**
   * Appends the given entry.
   * 
   * @throws StorageException if the entry could not be persisted
   */
  void append(HistoryEntry entry) throws StorageException;
  
  
  /**
   * Returns all entries, oldest first.
   * 
   * @return not {@code null}; empty if there is no (readable) history
   */
  List<HistoryEntry> load();
  
  
  /**
   * Removes all entries. Irreversible.
   * 
   * @throws StorageException if the change could not be persisted
   */
  void clear() throws StorageException;
  
  
  /**
   * Returns the number of entries.
   * 
   * @see #load()
   */
  default int size() {
    return load().size();
  }
  
  
  /**
   * Returns the entry count, and how many of those were issued on the
   * given day.
   * 
   * @param asOf  the day counted as "today"
   */
  default HistoryStats stats(LocalDate asOf) {
    return HistoryStats.compute(load(), asOf);
  }

}
