package com.partnerbridge.bothub.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Public addresses of this service and its local time zone.
 *
 * @param publicBaseUrl base URL Telegram calls webhooks on; blank disables webhook binding
 * @param webAppUrl tenant mini-app URL published as the bot menu button; blank disables it
 * @param zone zone for schedule times and dates shown to users
 */
@ConfigurationProperties(prefix = "bothub")
public record BotHubProperties(String publicBaseUrl, String webAppUrl, String zone) {

  public BotHubProperties {
    publicBaseUrl = stripTrailingSlash(publicBaseUrl);
    webAppUrl = webAppUrl == null ? "" : webAppUrl.trim();
    zone = zone == null || zone.isBlank() ? ZoneId.systemDefault().getId() : zone.trim();
  }

  public boolean hasPublicBaseUrl() {
    return !publicBaseUrl.isBlank();
  }

  public boolean hasWebAppUrl() {
    return !webAppUrl.isBlank();
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }

  private static String stripTrailingSlash(String url) {
    if (url == null) return "";
    String t = url.trim();
    while (t.endsWith("/")) {
      t = t.substring(0, t.length() - 1);
    }
    return t;
  }
}
