/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.cli.rk;


import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.util.List;
import java.util.Properties;

import io.refkey.RefkeyConstants;
import io.refkey.TokenDeriver;
import io.refkey.history.FileHistoryLedger;
import io.refkey.issue.Issuer;
import io.refkey.template.MailtoLink;
import io.refkey.template.MessagePayload;

/**
 * Tool configuration.
 * 
 * <h2>Quirks and Features</h2>
 * <p>
 * A simple properties file is used to store configuration. Every property is
 * optional. Unknown properties are ignored (with a warning).
 * </p>
 * <h3>Relative Paths</h3>
 * <p>
 * Filepaths may be specified in either absolute or relative form. For relative
 * paths, <em>paths are resolved relative to the location of the configuration
 * file</em> (or the working directory, if there is no configuration file).
 * </p>
 */
public class RkConfig {
  
  /**
   * Every property known to this configuration is prefixed with this value.
   */
  public final static String ROOT = "refkey.";
  
  /**
   * The name of the base directory path. <em>This value should not be set in the properties file.</em>
   * It is set dynamically to the parent directory of the configuration file.
   */
  public final static String BASE_DIR = ROOT + "base.dir";
  /**
   * The name of the secret mixed into every token. If not set, the built-in
   * secret is used. Tokens issued under one secret do not verify under another.
   */
  public final static String SECRET = ROOT + "secret";
  /**
   * The name of the token length (number of hex digits). Defaults to
   * {@value RefkeyConstants#TOKEN_LENGTH}.
   */
  public final static String TOKEN_LENGTH = ROOT + "token.length";
  /** The name of the history file path. */
  public final static String HISTORY_FILE = ROOT + "history.file";
  /** The name of the settings file path. */
  public final static String SETTINGS_FILE = ROOT + "settings.file";
  /** The name of the mail recipient of the issued message. */
  public final static String MAIL_RECIPIENT = ROOT + "mail.recipient";
  /** The name of the mail subject of the issued message. */
  public final static String MAIL_SUBJECT = ROOT + "mail.subject";
  
  
  public final static String DEFAULT_SETTINGS_FILENAME = "refkey-settings.properties";
  
  
  public final static List<String> PROP_NAMES = List.of(
      BASE_DIR,
      SECRET,
      TOKEN_LENGTH,
      HISTORY_FILE,
      SETTINGS_FILE,
      MAIL_RECIPIENT,
      MAIL_SUBJECT);
  
  
  
  /**
   * Loads the given properties file, and sets its {@linkplain #BASE_DIR}.
   * 
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Properties loadProperties(File propertiesFile) {
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(propertiesFile.toPath(), StandardCharsets.UTF_8)) {
      props.load(reader);
    } catch (NoSuchFileException nsfx) {
      throw new IllegalArgumentException("properties file does not exist: " + propertiesFile);
    } catch (IOException iox) {
      throw new IllegalArgumentException("failed to read properties file: " + propertiesFile, iox);
    }
    File baseDir = propertiesFile.getAbsoluteFile().getParentFile();
    props.put(BASE_DIR, baseDir.getPath());
    return props;
  }
  
  
  /**
   * Returns the configuration used when no file is given: all defaults, with
   * paths relative to the working directory.
   */
  public static RkConfig defaultConfig() {
    var props = new Properties();
    props.put(BASE_DIR, new File("").getAbsolutePath());
    return new RkConfig(props);
  }
  
  
  
  private final File baseDir;
  private final String secret;
  private final int tokenLength;
  private final File historyFile;
  private final File settingsFile;
  private final String recipient;
  private final String subject;
  
  
  
  public RkConfig(File propertiesFile) {
    this(loadProperties(propertiesFile));
  }
  
  
  /**
   * @param props the {@linkplain #BASE_DIR} property is required
   * 
   * @throws IllegalArgumentException on a bad property value
   */
  public RkConfig(Properties props) {
    this.baseDir = getBaseDir(props);
    
    this.secret = props.getProperty(SECRET, RefkeyConstants.DEFAULT_SECRET);
    if (secret.isEmpty())
      throw new IllegalArgumentException(SECRET + " is set but empty");
    
    this.tokenLength = getTokenLength(props);
    
    this.historyFile = resolve(props, HISTORY_FILE, FileHistoryLedger.DEFAULT_FILENAME);
    this.settingsFile = resolve(props, SETTINGS_FILE, DEFAULT_SETTINGS_FILENAME);
    
    this.recipient = props.getProperty(MAIL_RECIPIENT, MailtoLink.DEFAULT_RECIPIENT).strip();
    if (recipient.isEmpty())
      throw new IllegalArgumentException(MAIL_RECIPIENT + " is set but empty");
    this.subject = props.getProperty(MAIL_SUBJECT, MessagePayload.DEFAULT_SUBJECT);
    
    warnUnknown(props);
  }
  
  
  private File getBaseDir(Properties props) {
    String baseDir = props.getProperty(BASE_DIR);
    if (baseDir == null || baseDir.isBlank())
      throw new IllegalArgumentException("missing required property " + BASE_DIR);
    File base = new File(baseDir);
    if (!base.isDirectory())
      throw new IllegalArgumentException(BASE_DIR + ": " + baseDir + " not a directory");
    return base.getAbsoluteFile();
  }
  
  
  private int getTokenLength(Properties props) {
    String value = props.getProperty(TOKEN_LENGTH);
    if (value == null || value.isBlank())
      return RefkeyConstants.TOKEN_LENGTH;
    int len;
    try {
      len = Integer.parseInt(value.strip());
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException(TOKEN_LENGTH + " is not a number: " + value);
    }
    if (len < RefkeyConstants.MIN_TOKEN_LENGTH || len > RefkeyConstants.MAX_TOKEN_LENGTH)
      throw new IllegalArgumentException(
          "%s out of bounds [%d, %d]: %d".formatted(
              TOKEN_LENGTH,
              RefkeyConstants.MIN_TOKEN_LENGTH,
              RefkeyConstants.MAX_TOKEN_LENGTH,
              len));
    return len;
  }
  
  
  private File resolve(Properties props, String name, String defaultPath) {
    String path = props.getProperty(name);
    if (path == null || path.isBlank())
      path = defaultPath;
    File file = new File(path.strip());
    return file.isAbsolute() ? file : new File(baseDir, file.getPath());
  }
  
  
  private void warnUnknown(Properties props) {
    for (var key : props.stringPropertyNames()) {
      if (!PROP_NAMES.contains(key))
        System.getLogger(RefkeyConstants.LOG_NAME).log(
            Level.WARNING, "ignoring unknown property: " + key);
    }
  }
  
  
  
  /** Returns the directory relative paths are resolved against. */
  public File getBaseDir() {
    return baseDir;
  }
  
  
  public int getTokenLength() {
    return tokenLength;
  }
  
  
  public File getHistoryFile() {
    return historyFile;
  }
  
  
  public File getSettingsFile() {
    return settingsFile;
  }
  
  
  public String getRecipient() {
    return recipient;
  }
  
  
  public String getSubject() {
    return subject;
  }
  
  
  /** Returns a token deriver with the configured secret and length. */
  public TokenDeriver newTokenDeriver() {
    return new TokenDeriver(secret, tokenLength);
  }
  
  
  public FileHistoryLedger newLedger() {
    return new FileHistoryLedger(historyFile);
  }
  
  
  /**
   * Returns an issuer recording to the {@linkplain #newLedger() history file}.
   * 
   * @param clock stamps issued entries
   */
  public Issuer newIssuer(Clock clock) {
    return new Issuer(newTokenDeriver(), newLedger(), clock, recipient, subject);
  }

}
