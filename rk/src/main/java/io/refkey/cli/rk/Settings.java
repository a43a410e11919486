/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.cli.rk;


import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;
import java.util.Properties;

import io.refkey.EventAttributes;
import io.refkey.InputValidationException;
import io.refkey.RefkeyConstants;
import io.refkey.template.Template;

/**
 * User settings: the message template, and the form values last entered.
 * Backed by a properties file; every value is optional.
 */
public class Settings {
  
  public final static String PARTICIPANT_A = "participant_a";
  public final static String PARTICIPANT_B = "participant_b";
  public final static String EVENT_DATE = "event_date";
  public final static String EVENT_TIME = "event_time";
  public final static String TEMPLATE = "template";
  
  /** Event time used when none is saved. */
  public final static LocalTime DEFAULT_TIME = LocalTime.of(18, 30);
  
  private final static String COMMENT = "rk settings";
  
  
  private final File file;
  private final Properties props = new Properties();
  
  
  /**
   * Loads the settings from the given file, if it exists. An unreadable file
   * is treated as empty.
   */
  public Settings(File file) {
    this.file = Objects.requireNonNull(file, "null file");
    if (file.isFile()) {
      try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
        props.load(reader);
      } catch (IOException | IllegalArgumentException x) {
        props.clear();
        System.getLogger(RefkeyConstants.LOG_NAME).log(
            Level.WARNING, "settings unreadable, using defaults: " + file + " -- " + x.getMessage());
      }
    }
  }
  
  
  public File getFile() {
    return file;
  }
  
  
  /** Returns the saved first participant, or the empty string. */
  public String participantA() {
    return props.getProperty(PARTICIPANT_A, "");
  }
  
  
  /** Returns the saved second participant, or the empty string. */
  public String participantB() {
    return props.getProperty(PARTICIPANT_B, "");
  }
  
  
  /**
   * Returns the saved event date, if valid; {@code today}, otherwise.
   */
  public LocalDate eventDate(LocalDate today) {
    String date = props.getProperty(EVENT_DATE);
    if (date != null) {
      try {
        return EventAttributes.parseDate(date);
      } catch (InputValidationException ignore) {
        warnIgnored(EVENT_DATE, date);
      }
    }
    return today;
  }
  
  
  /**
   * Returns the saved event time, if valid; {@linkplain #DEFAULT_TIME},
   * otherwise.
   */
  public LocalTime eventTime() {
    String time = props.getProperty(EVENT_TIME);
    if (time != null) {
      try {
        return EventAttributes.parseTime(time);
      } catch (InputValidationException ignore) {
        warnIgnored(EVENT_TIME, time);
      }
    }
    return DEFAULT_TIME;
  }
  
  
  private void warnIgnored(String name, String value) {
    System.getLogger(RefkeyConstants.LOG_NAME).log(
        Level.WARNING, "ignoring malformed setting " + name + "=" + value);
  }
  
  
  /** Returns the saved template, or the built-in one. */
  public Template template() {
    String text = props.getProperty(TEMPLATE);
    return text == null ? Template.defaultTemplate() : new Template(text);
  }
  
  
  /** Tells whether a template is saved. */
  public boolean hasSavedTemplate() {
    return props.containsKey(TEMPLATE);
  }
  
  
  /** Sets the form values (not saved until {@linkplain #save()}). */
  public void setForm(EventAttributes attributes) {
    props.setProperty(PARTICIPANT_A, attributes.participantA());
    props.setProperty(PARTICIPANT_B, attributes.participantB());
    props.setProperty(EVENT_DATE, attributes.dateString());
    props.setProperty(EVENT_TIME, attributes.timeString());
  }
  
  
  /**
   * Sets the template (not saved until {@linkplain #save()}). Setting the
   * built-in template removes the saved one.
   */
  public void setTemplate(Template template) {
    if (template.isDefault())
      resetTemplate();
    else
      props.setProperty(TEMPLATE, template.text());
  }
  
  
  /** Removes the saved template (not saved until {@linkplain #save()}). */
  public void resetTemplate() {
    props.remove(TEMPLATE);
  }
  
  
  /**
   * Writes the settings to the backing file.
   * 
   * @throws UncheckedIOException on I/O error
   */
  public void save() {
    try {
      File dir = file.getAbsoluteFile().getParentFile();
      Files.createDirectories(dir.toPath());
      try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
        props.store(writer, COMMENT);
      }
    } catch (IOException iox) {
      throw new UncheckedIOException("failed to save settings " + file + ": " + iox.getMessage(), iox);
    }
  }

}
