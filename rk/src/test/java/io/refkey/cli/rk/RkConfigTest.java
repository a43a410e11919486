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
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.refkey.EventAttributes;
import io.refkey.history.FileHistoryLedger;
import io.refkey.template.MailtoLink;
import io.refkey.template.MessagePayload;

/**
 * 
 */
public class RkConfigTest {
  
  private final static EventAttributes EVENT = new EventAttributes(
      "Les Aigles Rouges", "Les Lions Bleus",
      LocalDate.of(2025, 6, 20), LocalTime.of(18, 30));
  
  @TempDir
  File tempDir;
  
  
  private Properties baseProps() {
    var props = new Properties();
    props.put(RkConfig.BASE_DIR, tempDir.getPath());
    return props;
  }
  
  
  private File writeConfig(String text) throws Exception {
    File file = new File(tempDir, "rk.properties");
    Files.writeString(file.toPath(), text, StandardCharsets.UTF_8);
    return file;
  }
  
  
  @Test
  public void testDefaults() {
    var config = new RkConfig(baseProps());
    assertEquals(tempDir.getAbsoluteFile(), config.getBaseDir());
    assertEquals(new File(tempDir.getAbsoluteFile(), FileHistoryLedger.DEFAULT_FILENAME), config.getHistoryFile());
    assertEquals(
        new File(tempDir.getAbsoluteFile(), RkConfig.DEFAULT_SETTINGS_FILENAME),
        config.getSettingsFile());
    assertEquals(10, config.getTokenLength());
    assertEquals(MailtoLink.DEFAULT_RECIPIENT, config.getRecipient());
    assertEquals(MessagePayload.DEFAULT_SUBJECT, config.getSubject());
    assertEquals("5F6898FCDC", config.newTokenDeriver().derive(EVENT).value());
    assertEquals(config.getHistoryFile(), config.newLedger().getFile());
  }
  
  
  @Test
  public void testFromFile() throws Exception {
    File absolute = new File(tempDir, "elsewhere/settings.properties").getAbsoluteFile();
    File file = writeConfig(
        """
        refkey.secret = OTHER_SECRET
        refkey.history.file = data/history.json
        refkey.settings.file = %s
        refkey.mail.recipient = tresorier@club.fr
        refkey.mail.subject = Arbitrage
        """.formatted(absolute.getPath().replace("\\", "\\\\")));
    
    var config = new RkConfig(file);
    assertEquals(new File(tempDir.getAbsoluteFile(), "data/history.json"), config.getHistoryFile());
    assertEquals(absolute, config.getSettingsFile());
    assertEquals("tresorier@club.fr", config.getRecipient());
    assertEquals("Arbitrage", config.getSubject());
    assertEquals("CCF4E7923B", config.newTokenDeriver().derive(EVENT).value());
  }
  
  
  @Test
  public void testTokenLength() {
    var props = baseProps();
    props.put(RkConfig.TOKEN_LENGTH, " 16 ");
    var config = new RkConfig(props);
    assertEquals(16, config.getTokenLength());
    assertEquals("5F6898FCDC1E411C", config.newTokenDeriver().derive(EVENT).value());
  }
  
  
  @Test
  public void testBadTokenLength() {
    for (var value : new String[] { "abc", "7", "65", "-10" }) {
      var props = baseProps();
      props.put(RkConfig.TOKEN_LENGTH, value);
      var x = assertThrows(IllegalArgumentException.class, () -> new RkConfig(props));
      assertTrue(x.getMessage().contains(RkConfig.TOKEN_LENGTH), x.getMessage());
    }
  }
  
  
  @Test
  public void testEmptySecret() {
    var props = baseProps();
    props.put(RkConfig.SECRET, "");
    assertThrows(IllegalArgumentException.class, () -> new RkConfig(props));
  }
  
  
  @Test
  public void testMissingBaseDir() {
    assertThrows(IllegalArgumentException.class, () -> new RkConfig(new Properties()));
    var props = new Properties();
    props.put(RkConfig.BASE_DIR, new File(tempDir, "nope").getPath());
    assertThrows(IllegalArgumentException.class, () -> new RkConfig(props));
  }
  
  
  @Test
  public void testMissingFile() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new RkConfig(new File(tempDir, "missing.properties")));
  }
  
  
  @Test
  public void testUnknownIgnored() throws Exception {
    File file = writeConfig("refkey.colour = blue\nsomething.else = 1\n");
    var config = new RkConfig(file);
    assertEquals("5F6898FCDC", config.newTokenDeriver().derive(EVENT).value());
  }

}
