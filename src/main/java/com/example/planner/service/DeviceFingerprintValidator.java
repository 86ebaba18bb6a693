package com.example.planner.service;

import com.example.planner.domain.entity.DeviceFingerprint;
import com.example.planner.domain.model.DeviceDescriptor;
import com.example.planner.domain.model.FingerprintMatch;
import com.example.planner.util.TokenUtils;
import java.util.Locale;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Normalizes client device descriptors and compares them across logins.
 * A mismatch never blocks a login; callers turn it into an anomaly signal.
 */
@Slf4j
@Service
public class DeviceFingerprintValidator {

  static final String UNKNOWN = "UNKNOWN";
  private static final int SMALL_SCREEN_MAX_WIDTH = 768;
  private static final int MEDIUM_SCREEN_MAX_WIDTH = 1440;

  public DeviceFingerprint fingerprint(DeviceDescriptor descriptor) {
    DeviceDescriptor device = descriptor != null
        ? descriptor
        : new DeviceDescriptor(null, null, null, null, null, null);

    String userAgent = lower(device.userAgent());
    String agentClass = agentClass(userAgent);
    String platform = platform(lower(device.platform()), userAgent);
    boolean mobile = device.isMobile() != null
        ? device.isMobile()
        : "IOS".equals(platform) || "ANDROID".equals(platform);
    String screenClass = screenClass(device.screenResolution());
    String locale = device.language() != null && !device.language().isBlank()
        ? device.language().trim().replace('_', '-').toLowerCase(Locale.ROOT)
        : UNKNOWN;
    String timezone = device.timezone() != null && !device.timezone().isBlank()
        ? device.timezone().trim()
        : UNKNOWN;

    String hash = TokenUtils.sha256Base64(String.join("|",
        agentClass, platform, String.valueOf(mobile), screenClass, locale, timezone));
    log.debug("Generated device fingerprint: {}", hash);
    return new DeviceFingerprint(agentClass, platform, mobile, screenClass, locale, timezone, hash);
  }

  /**
   * MATCH when every normalized field agrees, PARTIAL_MATCH when only screen, locale or
   * timezone differ, MISMATCH otherwise. A missing stored fingerprint is a mismatch.
   */
  public FingerprintMatch compare(DeviceFingerprint stored, DeviceFingerprint incoming) {
    if (stored == null || incoming == null) {
      return FingerprintMatch.MISMATCH;
    }
    boolean sameDevice = Objects.equals(stored.getAgentClass(), incoming.getAgentClass())
        && Objects.equals(stored.getPlatform(), incoming.getPlatform())
        && stored.isMobile() == incoming.isMobile();
    if (!sameDevice) {
      return FingerprintMatch.MISMATCH;
    }
    boolean sameEnvironment = Objects.equals(stored.getScreenClass(), incoming.getScreenClass())
        && Objects.equals(stored.getLocale(), incoming.getLocale())
        && Objects.equals(stored.getTimezone(), incoming.getTimezone());
    return sameEnvironment ? FingerprintMatch.MATCH : FingerprintMatch.PARTIAL_MATCH;
  }

  /**
   * Short human-readable description for guardian notifications.
   */
  public String describe(DeviceFingerprint fingerprint) {
    if (fingerprint == null) {
      return "Unknown device";
    }
    return switch (fingerprint.getPlatform()) {
      case "IOS" -> fingerprint.isMobile() ? "iPhone" : "iPad";
      case "ANDROID" -> fingerprint.isMobile() ? "Android phone" : "Android tablet";
      case "MAC" -> "Mac computer";
      case "WINDOWS" -> "Windows computer";
      case "LINUX" -> "Linux computer";
      default -> fingerprint.isMobile() ? "Mobile device" : "Computer";
    };
  }

  private String agentClass(String userAgent) {
    if (userAgent == null) return UNKNOWN;
    if (userAgent.contains("edg/") || userAgent.contains("edge")) return "EDGE";
    if (userAgent.contains("firefox") || userAgent.contains("fxios")) return "FIREFOX";
    if (userAgent.contains("chrome") || userAgent.contains("crios")) return "CHROME";
    if (userAgent.contains("safari")) return "SAFARI";
    return "OTHER";
  }

  private String platform(String platform, String userAgent) {
    String source = platform != null ? platform : userAgent;
    if (source == null) return UNKNOWN;
    if (source.contains("iphone") || source.contains("ipad") || source.contains("ios")) return "IOS";
    if (source.contains("android")) return "ANDROID";
    if (source.contains("mac")) return "MAC";
    if (source.contains("win")) return "WINDOWS";
    if (source.contains("linux") || source.contains("x11")) return "LINUX";
    return "OTHER";
  }

  private String screenClass(String resolution) {
    if (resolution == null || !resolution.toLowerCase(Locale.ROOT).contains("x")) {
      return UNKNOWN;
    }
    try {
      int width = Integer.parseInt(resolution.toLowerCase(Locale.ROOT).split("x")[0].trim());
      if (width < SMALL_SCREEN_MAX_WIDTH) return "SMALL";
      if (width < MEDIUM_SCREEN_MAX_WIDTH) return "MEDIUM";
      return "LARGE";
    } catch (NumberFormatException e) {
      return UNKNOWN;
    }
  }

  private String lower(String value) {
    return value == null || value.isBlank() ? null : value.toLowerCase(Locale.ROOT);
  }
}
