/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.history;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.refkey.TokenDeriver;

/**
 * 
 */
public class FileHistoryLedgerTest extends AbstractHistoryLedgerTest {
  
  
  private File historyFile(Object label) {
    File dir = new File(tempDir, label.getClass().getEnclosingMethod().getName());
    return new File(dir, FileHistoryLedger.DEFAULT_FILENAME);
  }

  @Override
  protected FileHistoryLedger newLedger(Object label) {
    return new FileHistoryLedger(historyFile(label));
  }
  
  
  @Test
  public void testPersistsAcrossInstances() throws Exception {
    final Object label = new Object() {  };
    var entries = sampleEntries(9, MORNING);
    var ledger = newLedger(label);
    for (var e : entries)
      ledger.append(e);
    
    var reopened = new FileHistoryLedger(ledger.getFile());
    assertEquals(entries, reopened.load());
  }
  
  
  @Test
  public void testNoTempFilesLeft() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    for (var e : sampleEntries(3, MORNING))
      ledger.append(e);
    ledger.clear();
    ledger.append(sampleEntries(1, MORNING).get(0));
    
    String[] files = ledger.getFile().getParentFile().list();
    assertArrayEquals(new String[] { FileHistoryLedger.DEFAULT_FILENAME }, files);
  }
  
  
  @Test
  public void testFieldNames() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    ledger.append(entry(MORNING, "Les Aigles Rouges", "Les Lions Bleus", 20, 18));
    
    String json = Files.readString(ledger.getFile().toPath(), StandardCharsets.UTF_8);
    assertTrue(json.contains("\"issued_at\":\"2025-06-20T09:15:02.123456\""));
    assertTrue(json.contains("\"participant_a\":\"Les Aigles Rouges\""));
    assertTrue(json.contains("\"participant_b\":\"Les Lions Bleus\""));
    assertTrue(json.contains("\"date\":\"2025-06-20\""));
    assertTrue(json.contains("\"time\":\"18:30\""));
    assertTrue(json.contains("\"token\":\"5F6898FCDC\""));
  }
  
  
  @Test
  public void testNonAsciiNames() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    var e = entry(MORNING, "HC Saint-Étienne", "Nîmes \"USAM\"", 2, 20);
    ledger.append(e);
    assertEquals(List.of(e), new FileHistoryLedger(ledger.getFile()).load());
  }
  
  
  @Test
  public void testCorruptReadsEmpty() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    File file = ledger.getFile();
    file.getParentFile().mkdirs();
    Files.writeString(file.toPath(), "[{\"issued_at\": \"yesterday\"", StandardCharsets.UTF_8);
    
    assertTrue(ledger.load().isEmpty());
    assertEquals(HistoryStats.EMPTY, ledger.stats(MATCH_DAY));
  }
  
  
  @Test
  public void testWrongShapeReadsEmpty() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    File file = ledger.getFile();
    file.getParentFile().mkdirs();
    Files.writeString(file.toPath(), "{\"entries\": []}", StandardCharsets.UTF_8);
    assertTrue(ledger.load().isEmpty());
    
    Files.writeString(file.toPath(), "", StandardCharsets.UTF_8);
    assertTrue(ledger.load().isEmpty());
    
    Files.writeString(
        file.toPath(),
        "[{\"issued_at\":\"2025-06-20T09:15:02\",\"participant_a\":\"A\"," +
        "\"participant_b\":\"B\",\"date\":\"2025-06-20\",\"time\":\"18:30\",\"token\":\"not hex\"}]",
        StandardCharsets.UTF_8);
    assertTrue(ledger.load().isEmpty());
    
    // json-simple overflows this into a NumberFormatException
    Files.writeString(file.toPath(), "[99999999999999999999]", StandardCharsets.UTF_8);
    assertTrue(ledger.load().isEmpty());
    
    Files.writeString(file.toPath(), "[\"\\q\"]", StandardCharsets.UTF_8);
    assertTrue(ledger.load().isEmpty());
  }
  
  
  @Test
  public void testCorruptMovedAsideOnAppend() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    File file = ledger.getFile();
    File dir = file.getParentFile();
    dir.mkdirs();
    final String garbage = "this is not json";
    Files.writeString(file.toPath(), garbage, StandardCharsets.UTF_8);
    
    var e = entry(MORNING, "A", "B", 20, 18);
    ledger.append(e);
    assertEquals(List.of(e), ledger.load());
    
    File[] aside = dir.listFiles(
        (d, name) -> name.startsWith(file.getName() + FileHistoryLedger.CORRUPT_EXT + "-"));
    assertEquals(1, aside.length);
    assertEquals(garbage, Files.readString(aside[0].toPath(), StandardCharsets.UTF_8));
  }
  
  
  @Test
  public void testOverflowMovedAsideOnAppend() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    File file = ledger.getFile();
    file.getParentFile().mkdirs();
    final String garbage = "[99999999999999999999]";
    Files.writeString(file.toPath(), garbage, StandardCharsets.UTF_8);
    
    var e = entry(MORNING, "A", "B", 20, 18);
    ledger.append(e);
    assertEquals(List.of(e), ledger.load());
    assertEquals(List.of(garbage), asideContents(file));
  }
  
  
  @Test
  public void testCorruptMovedAsideOnClear() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    File file = ledger.getFile();
    file.getParentFile().mkdirs();
    final String garbage = "this is not json";
    Files.writeString(file.toPath(), garbage, StandardCharsets.UTF_8);
    
    ledger.clear();
    assertTrue(ledger.load().isEmpty());
    assertEquals(List.of(garbage), asideContents(file));
  }
  
  
  @Test
  public void testClearLeavesNoAside() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    ledger.append(entry(MORNING, "A", "B", 20, 18));
    ledger.clear();
    assertTrue(ledger.load().isEmpty());
    assertTrue(asideContents(ledger.getFile()).isEmpty());
  }
  
  
  private List<String> asideContents(File file) throws Exception {
    File[] aside = file.getParentFile().listFiles(
        (d, name) -> name.startsWith(file.getName() + FileHistoryLedger.CORRUPT_EXT + "-"));
    var contents = new ArrayList<String>();
    for (var f : aside)
      contents.add(Files.readString(f.toPath(), StandardCharsets.UTF_8));
    return contents;
  }
  
  
  @Test
  public void testWriteFailure() throws Exception {
    final Object label = new Object() {  };
    File blocker = new File(historyFile(label).getParentFile(), "blocker");
    blocker.getParentFile().mkdirs();
    Files.writeString(blocker.toPath(), "a file, not a directory", StandardCharsets.UTF_8);
    
    var ledger = new FileHistoryLedger(new File(blocker, FileHistoryLedger.DEFAULT_FILENAME));
    var e = entry(MORNING, "A", "B", 20, 18);
    assertThrows(StorageException.class, () -> ledger.append(e));
    assertThrows(StorageException.class, () -> ledger.clear());
    assertTrue(ledger.load().isEmpty());
  }
  
  
  @Test
  public void testDirectoryRejected() {
    assertThrows(IllegalArgumentException.class, () -> new FileHistoryLedger(tempDir));
  }
  
  
  @Test
  public void testLegacyFormat() throws Exception {
    final Object label = new Object() {  };
    var ledger = newLedger(label);
    File file = ledger.getFile();
    file.getParentFile().mkdirs();
    String legacy = """
        [
          {
            "timestamp": "2025-06-20T17:02:11.482913",
            "equipe1": "Les Aigles Rouges",
            "equipe2": "Les Lions Bleus",
            "date": "2025-06-20",
            "heure": "18:30",
            "security_key": "5F6898FCDC"
          }
        ]
        """;
    Files.writeString(file.toPath(), legacy, StandardCharsets.UTF_8);
    
    var entries = ledger.load();
    assertEquals(1, entries.size());
    var e = entries.get(0);
    assertEquals(LocalDateTime.of(2025, 6, 20, 17, 2, 11, 482_913_000), e.issuedAt());
    assertEquals("Les Aigles Rouges", e.participantA());
    assertEquals(LocalDate.of(2025, 6, 20), e.date());
    assertEquals(LocalTime.of(18, 30), e.time());
    assertEquals("5F6898FCDC", e.token().value());
    assertTrue(HistoryAudit.run(entries, TokenDeriver.defaultInstance()).passed());
    
    // appending rewrites in the current format
    ledger.append(entry(MORNING.plusDays(1), "A", "B", 21, 18));
    String json = Files.readString(file.toPath(), StandardCharsets.UTF_8);
    assertFalse(json.contains("equipe1"));
    assertEquals(2, ledger.load().size());
    assertEquals(e, ledger.load().get(0));
  }

}
