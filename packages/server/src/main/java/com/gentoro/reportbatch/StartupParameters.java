package com.gentoro.reportbatch;

import com.gentoro.reportbatch.exception.ConfigException;
import java.nio.file.Path;

/** Command line: {@code [--config <file>]}. */
public final class StartupParameters {
  private final Path configFile;

  public StartupParameters(String[] args) {
    Path config = null;
    for (int i = 0; args != null && i < args.length; i++) {
      String arg = args[i];
      if (arg.equals("--config")) {
        if (i + 1 >= args.length) {
          throw new ConfigException("--config requires a file path");
        }
        config = Path.of(args[++i]);
      } else if (arg.startsWith("--config=")) {
        config = Path.of(arg.substring("--config=".length()));
      } else {
        throw new ConfigException("Unknown argument: " + arg);
      }
    }
    this.configFile = config;
  }

  /** Explicit configuration file, or {@code null} for the classpath default. */
  public Path configFile() {
    return configFile;
  }
}
