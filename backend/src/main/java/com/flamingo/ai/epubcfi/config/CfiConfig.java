package com.flamingo.ai.epubcfi.config;

import com.flamingo.ai.epubcfi.service.cfi.parsing.ParseOptions;
import com.flamingo.ai.epubcfi.service.cfi.resolve.ResolveOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for CFI parsing and resolution defaults. */
@Configuration
@ConfigurationProperties(prefix = "cfi")
@Getter
@Setter
public class CfiConfig {

  private Parsing parsing = new Parsing();
  private Resolution resolution = new Resolution();

  @Getter
  @Setter
  public static class Parsing {
    /** Parse simple ranges as their start location. */
    private boolean flattenRange = false;

    /** Drop qualifiers that only make sense on the last step of a part. */
    private boolean stricter = true;
  }

  @Getter
  @Setter
  public static class Resolution {
    private boolean ignoreIds = false;

    /** Resolve ranges into native tree ranges. */
    private boolean range = false;
  }

  public ParseOptions parseOptions() {
    return new ParseOptions(parsing.isFlattenRange(), parsing.isStricter());
  }

  public ResolveOptions resolveOptions() {
    return new ResolveOptions(resolution.isIgnoreIds(), resolution.isRange());
  }
}
