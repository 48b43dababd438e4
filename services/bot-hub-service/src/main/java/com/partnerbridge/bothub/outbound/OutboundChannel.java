package com.partnerbridge.bothub.outbound;

import com.partnerbridge.bothub.client.TelegramBotClient;
import com.partnerbridge.bothub.client.UpstreamException;
import com.partnerbridge.bothub.config.TelegramProperties;
import com.partnerbridge.bothub.model.ReplyMarkup;
import com.partnerbridge.bothub.registry.BotHandle;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sends texts and files to a chat through a registered bot. Best effort: failures are logged and
 * reported, never thrown.
 */
@Service
@Slf4j
public class OutboundChannel {

  public static final String MARKDOWN = "Markdown";

  private final TelegramBotClient telegram;
  private final int messageLimit;
  private final Duration chunkDelay;

  public OutboundChannel(TelegramBotClient telegram, TelegramProperties properties) {
    this.telegram = telegram;
    this.messageLimit = properties.messageLimit();
    this.chunkDelay = properties.chunkDelay();
  }

  public DeliveryReport sendText(BotHandle bot, long chatId, String text) {
    return sendText(bot, chatId, text, null, null);
  }

  public DeliveryReport sendText(BotHandle bot, long chatId, String text, ReplyMarkup markup) {
    return sendText(bot, chatId, text, null, markup);
  }

  /**
   * Splits {@code text} over the message limit and sends the chunks in order. Markup goes on the
   * first chunk only; a failed chunk does not stop the rest.
   */
  public DeliveryReport sendText(
      BotHandle bot, long chatId, String text, String parseMode, ReplyMarkup markup) {
    List<String> chunks = MessageSplitter.split(text, messageLimit);
    int delivered = 0;
    for (int i = 0; i < chunks.size(); i++) {
      if (i > 0 && !pause()) {
        log.warn("Interrupted after {}/{} chunks to chat {}", i, chunks.size(), chatId);
        return new DeliveryReport(i, delivered);
      }
      try {
        telegram.sendMessage(
            bot.credential(), chatId, chunks.get(i), parseMode, i == 0 ? markup : null);
        delivered++;
      } catch (UpstreamException e) {
        log.warn(
            "Chunk {}/{} to chat {} via {} failed: {}",
            i + 1,
            chunks.size(),
            chatId,
            bot.webhookKey(),
            e.getMessage());
      }
    }
    return new DeliveryReport(chunks.size(), delivered);
  }

  public boolean sendFile(BotHandle bot, long chatId, Path file, String caption) {
    try {
      telegram.sendDocument(bot.credential(), chatId, file, caption);
      return true;
    } catch (UpstreamException e) {
      log.warn("File to chat {} via {} failed: {}", chatId, bot.webhookKey(), e.getMessage());
      return false;
    }
  }

  /** Acknowledges a button press; failures only matter to the spinner on the user's side. */
  public void answerCallback(BotHandle bot, String callbackQueryId, String text) {
    try {
      telegram.answerCallbackQuery(bot.credential(), callbackQueryId, text);
    } catch (UpstreamException e) {
      log.debug("answerCallbackQuery failed: {}", e.getMessage());
    }
  }

  private boolean pause() {
    if (chunkDelay.isZero() || chunkDelay.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(chunkDelay.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
