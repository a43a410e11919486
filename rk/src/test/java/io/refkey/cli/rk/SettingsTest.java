/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.cli.rk;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDate;
import java.time.LocalTime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.refkey.EventAttributes;
import io.refkey.template.Template;

/**
 * 
 */
public class SettingsTest {
  
  private final static LocalDate TODAY = LocalDate.of(2025, 6, 20);
  
  @TempDir
  File tempDir;
  
  
  private File settingsFile() {
    return new File(tempDir, "refkey-settings.properties");
  }
  
  
  @Test
  public void testDefaults() {
    var settings = new Settings(settingsFile());
    assertEquals("", settings.participantA());
    assertEquals("", settings.participantB());
    assertEquals(TODAY, settings.eventDate(TODAY));
    assertEquals(Settings.DEFAULT_TIME, settings.eventTime());
    assertEquals(Template.defaultTemplate(), settings.template());
    assertFalse(settings.hasSavedTemplate());
  }
  
  
  @Test
  public void testSaveAndLoad() {
    var settings = new Settings(settingsFile());
    var attributes = new EventAttributes(
        "HC Saint-Étienne", "AS  Béziers!", LocalDate.of(2024, 11, 2), LocalTime.of(20, 45));
    var template = new Template("Bonjour,\n{participant_a} / {participant_b}\nClé : {token}\n");
    settings.setForm(attributes);
    settings.setTemplate(template);
    settings.save();
    
    var reloaded = new Settings(settingsFile());
    assertEquals("HC Saint-Étienne", reloaded.participantA());
    assertEquals("AS  Béziers!", reloaded.participantB());
    assertEquals(LocalDate.of(2024, 11, 2), reloaded.eventDate(TODAY));
    assertEquals(LocalTime.of(20, 45), reloaded.eventTime());
    assertTrue(reloaded.hasSavedTemplate());
    assertEquals(template, reloaded.template());
  }
  
  
  @Test
  public void testResetTemplate() {
    var settings = new Settings(settingsFile());
    settings.setTemplate(new Template("{token}"));
    settings.save();
    
    var reloaded = new Settings(settingsFile());
    assertTrue(reloaded.hasSavedTemplate());
    reloaded.resetTemplate();
    reloaded.save();
    assertFalse(new Settings(settingsFile()).hasSavedTemplate());
  }
  
  
  @Test
  public void testSetDefaultTemplate() {
    var settings = new Settings(settingsFile());
    settings.setTemplate(new Template("{token}"));
    settings.setTemplate(Template.defaultTemplate());
    assertFalse(settings.hasSavedTemplate());
  }
  
  
  @Test
  public void testMalformedValues() throws Exception {
    Files.writeString(
        settingsFile().toPath(),
        "event_date = 2025-02-30\nevent_time = 25:00\nparticipant_a = A\n",
        StandardCharsets.UTF_8);
    var settings = new Settings(settingsFile());
    assertEquals("A", settings.participantA());
    assertEquals(TODAY, settings.eventDate(TODAY));
    assertEquals(Settings.DEFAULT_TIME, settings.eventTime());
  }
  
  
  @Test
  public void testSaveCreatesDirectory() {
    File file = new File(tempDir, "a/b/settings.properties");
    var settings = new Settings(file);
    settings.setTemplate(new Template("{token}"));
    settings.save();
    assertTrue(file.isFile());
  }

}
