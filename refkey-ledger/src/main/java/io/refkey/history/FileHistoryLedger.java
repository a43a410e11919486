/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.history;


import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.refkey.RefkeyConstants;
import io.refkey.RefkeyException;
import io.refkey.json.HistoryEntryParser;

/**
 * History ledger backed by a single JSON file.
 * 
 * <h2>Writes</h2>
 * <p>
 * Every mutation is a full read-modify-write: the existing entries are loaded,
 * changed in memory, and the complete set is written to a temp file in the
 * same directory which is then moved over the target. A write interrupted
 * midway leaves the previous file in place.
 * </p>
 * <h2>Corrupt files</h2>
 * <p>
 * {@linkplain #load()} reads a corrupt or unreadable file as empty (and logs
 * a warning). A mutation that finds the file corrupt first moves it aside
 * (renamed with a {@value #CORRUPT_EXT}-<em>millis</em> suffix), so that the
 * next write doesn't destroy it.
 * </p>
 */
public class FileHistoryLedger implements HistoryLedger {
  
  /** Default history filename. */
  public final static String DEFAULT_FILENAME = "qr_history.json";
  
  /** Suffix (followed by a dash and a UTC millis) of a quarantined corrupt file. */
  public final static String CORRUPT_EXT = ".corrupt";
  
  private final static String TEMP_EXT = ".tmp";
  
  
  private final File file;
  
  
  /**
   * @param file  path to the JSON file; need not exist
   */
  public FileHistoryLedger(File file) {
    this.file = Objects.requireNonNull(file, "null file");
    if (file.isDirectory())
      throw new IllegalArgumentException("history path is a directory: " + file);
  }
  
  
  /** Returns the backing file. */
  public File getFile() {
    return file;
  }
  
  
  

  @Override
  public void append(HistoryEntry entry) throws StorageException {
    Objects.requireNonNull(entry, "null entry");
    var entries = loadForUpdate();
    entries.add(entry);
    persist(entries);
  }
  
  

  @Override
  public List<HistoryEntry> load() {
    if (!file.exists())
      return List.of();
    try {
      return read();
    } catch (IOException | RefkeyException x) {
      log(Level.WARNING, "history unreadable, treating as empty: " + file + " -- " + x.getMessage());
      return List.of();
    }
  }
  
  

  @Override
  public void clear() throws StorageException {
    loadForUpdate();    // moves a corrupt file aside
    persist(List.of());
  }
  
  
  
  private List<HistoryEntry> read() throws IOException {
    try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return HistoryEntryParser.INSTANCE.toEntityList(reader);
    }
  }
  
  
  private ArrayList<HistoryEntry> loadForUpdate() throws StorageException {
    if (!file.exists())
      return new ArrayList<>();
    try {
      return new ArrayList<>(read());
    } catch (IOException | RefkeyException x) {
      quarantine(x);
      return new ArrayList<>();
    }
  }
  
  
  private void quarantine(Exception cause) throws StorageException {
    File aside = new File(
        file.getPath() + CORRUPT_EXT + "-" + System.currentTimeMillis());
    try {
      Files.move(file.toPath(), aside.toPath());
    } catch (IOException iox) {
      var sx = new StorageException(
          "failed to move unreadable history " + file + " aside to " + aside, iox);
      sx.addSuppressed(cause);
      throw sx;
    }
    log(Level.WARNING,
        "unreadable history moved to " + aside + " -- " + cause.getMessage());
  }
  
  
  /**
   * Writes the given entries to a temp file and moves it over the target.
   */
  private void persist(List<HistoryEntry> entries) throws StorageException {
    Path target = file.toPath().toAbsolutePath();
    Path dir = target.getParent();
    Path temp = null;
    try {
      Files.createDirectories(dir);
      temp = Files.createTempFile(dir, file.getName() + ".", TEMP_EXT);
      Files.writeString(temp, HistoryEntryParser.INSTANCE.toJsonText(entries), StandardCharsets.UTF_8);
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException amnsx) {
        log(Level.DEBUG, "atomic move not supported; replacing " + target);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      temp = null;
    
    } catch (IOException iox) {
      throw new StorageException("failed to write history " + file + ": " + iox.getMessage(), iox);
    
    } finally {
      if (temp != null)
        deleteTemp(temp);
    }
  }
  
  
  private void deleteTemp(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException iox) {
      log(Level.WARNING, "failed to delete temp file " + temp + " -- " + iox.getMessage());
    }
  }
  
  
  private static void log(Level level, String message) {
    System.getLogger(RefkeyConstants.LOG_NAME).log(level, message);
  }

}
