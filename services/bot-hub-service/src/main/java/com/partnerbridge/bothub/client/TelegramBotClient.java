package com.partnerbridge.bothub.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.partnerbridge.bothub.model.ReplyMarkup;
import com.partnerbridge.bothub.registry.Credentials;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Thin Telegram Bot API client. Every call carries the bot credential explicitly because one
 * process serves many bots.
 *
 * <p>Failures surface as {@link UpstreamException}; callers decide whether to log or propagate.
 */
@Service
@Slf4j
public class TelegramBotClient {

  private static final List<String> ALLOWED_UPDATES = List.of("message", "callback_query");

  private final RestClient rest;
  private final RestClient uploadRest;

  public TelegramBotClient(
      @Qualifier("telegramRestClient") RestClient rest,
      @Qualifier("telegramUploadRestClient") RestClient uploadRest) {
    this.rest = rest;
    this.uploadRest = uploadRest;
  }

  /**
   * @return the bot identity, or empty when Telegram rejects the credential
   */
  public Optional<BotIdentity> getMe(String credential) {
    JsonNode resp;
    try {
      resp = rest.get().uri(methodUri(credential, "getMe")).retrieve().body(JsonNode.class);
    } catch (HttpClientErrorException e) {
      log.warn(
          "getMe rejected credential {}: HTTP {}",
          Credentials.mask(credential),
          e.getStatusCode().value());
      return Optional.empty();
    } catch (RestClientException e) {
      throw Upstreams.translate("getMe", e);
    }
    if (resp == null || !resp.path("ok").asBoolean(false)) {
      return Optional.empty();
    }
    JsonNode result = resp.path("result");
    return Optional.of(
        new BotIdentity(
            result.path("id").asLong(),
            result.path("username").asText(null),
            result.path("first_name").asText(null)));
  }

  public void setWebhook(String credential, String url, String secretToken) {
    Map<String, Object> body = new HashMap<>();
    body.put("url", url);
    body.put("allowed_updates", ALLOWED_UPDATES);
    body.put("drop_pending_updates", false);
    if (secretToken != null && !secretToken.isBlank()) {
      body.put("secret_token", secretToken);
    }
    post(credential, "setWebhook", body);
  }

  public void deleteWebhook(String credential) {
    post(credential, "deleteWebhook", Map.of());
  }

  public void setChatMenuButton(String credential, String text, String webAppUrl) {
    Map<String, Object> button =
        Map.of("type", "web_app", "text", text, "web_app", Map.of("url", webAppUrl));
    post(credential, "setChatMenuButton", Map.of("menu_button", button));
  }

  public JsonNode sendMessage(
      String credential, long chatId, String text, String parseMode, ReplyMarkup markup) {
    Map<String, Object> body = new HashMap<>();
    body.put("chat_id", chatId);
    body.put("text", text);
    if (parseMode != null && !parseMode.isBlank()) {
      body.put("parse_mode", parseMode);
    }
    if (markup != null) {
      body.put("reply_markup", markup.toTelegram());
    }
    return post(credential, "sendMessage", body);
  }

  public JsonNode sendDocument(String credential, long chatId, Path file, String caption) {
    if (file == null || !Files.isRegularFile(file)) {
      throw new UpstreamException(
          UpstreamException.Kind.ERROR, "sendDocument", "file not found: " + file);
    }
    MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
    parts.add("chat_id", String.valueOf(chatId));
    if (caption != null && !caption.isBlank()) {
      parts.add("caption", caption);
    }
    parts.add("document", new FileSystemResource(file));
    JsonNode resp;
    try {
      resp =
          uploadRest
              .post()
              .uri(methodUri(credential, "sendDocument"))
              .contentType(MediaType.MULTIPART_FORM_DATA)
              .body(parts)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientException e) {
      throw Upstreams.translate("sendDocument", e);
    }
    return requireOk("sendDocument", resp);
  }

  public void answerCallbackQuery(String credential, String callbackQueryId, String text) {
    if (callbackQueryId == null || callbackQueryId.isBlank()) {
      return;
    }
    Map<String, Object> body = new HashMap<>();
    body.put("callback_query_id", callbackQueryId);
    if (text != null && !text.isBlank()) {
      body.put("text", text);
    }
    post(credential, "answerCallbackQuery", body);
  }

  private JsonNode post(String credential, String method, Map<String, Object> body) {
    JsonNode resp;
    try {
      resp =
          rest.post()
              .uri(methodUri(credential, method))
              .contentType(MediaType.APPLICATION_JSON)
              .body(body)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientException e) {
      throw Upstreams.translate(method, e);
    }
    return requireOk(method, resp);
  }

  // Credentials look like 123456:AbC-_x; they are appended literally so ':' is not escaped.
  private static String methodUri(String credential, String method) {
    return "/bot" + credential + "/" + method;
  }

  private static JsonNode requireOk(String method, JsonNode resp) {
    if (resp == null || !resp.path("ok").asBoolean(false)) {
      String description =
          resp == null ? "empty response" : resp.path("description").asText("ok=false");
      throw new UpstreamException(UpstreamException.Kind.ERROR, method, description);
    }
    return resp.path("result");
  }
}
