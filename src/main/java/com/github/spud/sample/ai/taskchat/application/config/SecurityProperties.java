package com.github.spud.sample.ai.taskchat.application.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "taskchat.security")
public class SecurityProperties {

  /**
   * HMAC secret shared with the token issuer. At least 32 bytes.
   */
  private String jwtSecret;

  /**
   * Leeway applied to exp / iat checks
   */
  private Duration allowedClockSkew = Duration.ZERO;
}
