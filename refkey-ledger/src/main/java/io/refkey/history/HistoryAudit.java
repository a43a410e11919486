/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.history;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.refkey.TokenDeriver;

/**
 * Checks that every recorded token is re-derivable from its entry. A
 * mismatch means the entry was edited, or was issued under another secret
 * (or token length).
 * 
 * @param checked     number of entries checked
 * @param mismatches  zero-based indices (in load order) of entries whose
 *                    token does not reproduce
 */
public record HistoryAudit(int checked, List<Integer> mismatches) {
  
  
  /**
   * Audits the given entries.
   * 
   * @param entries     in load order
   * @param deriver     configured as the issuer's
   */
  public static HistoryAudit run(List<HistoryEntry> entries, TokenDeriver deriver) {
    Objects.requireNonNull(deriver, "null deriver");
    var mismatches = new ArrayList<Integer>();
    for (int index = 0; index < entries.size(); ++index) {
      var e = entries.get(index);
      if (!deriver.reproduces(e.attributes(), e.token()))
        mismatches.add(index);
    }
    return new HistoryAudit(entries.size(), mismatches);
  }
  
  
  /** Audits the given ledger's entries. */
  public static HistoryAudit run(HistoryLedger ledger, TokenDeriver deriver) {
    return run(ledger.load(), deriver);
  }
  
  
  public HistoryAudit {
    mismatches = List.copyOf(mismatches);
  }
  
  
  /** Tells whether every checked entry reproduced. */
  public boolean passed() {
    return mismatches.isEmpty();
  }

}
