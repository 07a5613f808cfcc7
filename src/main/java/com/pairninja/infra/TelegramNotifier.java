package com.pairninja.infra;

import com.pairninja.config.Config;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Telegram notification service for operator alerts.
 *
 * Best-effort: delivery failures are logged and never propagated. INFO and
 * WARNING messages are throttled to one per second; CRITICAL messages are
 * always sent. Every alert is also logged so nothing is lost when Telegram is
 * disabled.
 */
public class TelegramNotifier implements AlertSink {
    private static final Logger logger = LoggerFactory.getLogger(TelegramNotifier.class);
    private static final long MIN_MESSAGE_INTERVAL_MS = 1000;

    private final String botToken;
    private final String chatId;
    private final boolean enabled;
    private final OkHttpClient client;
    private final LoggingAlertSink logSink = new LoggingAlertSink();

    private long lastMessageTime = 0;

    public TelegramNotifier(Config config) {
        this(config.getBoolean("telegram.enabled", false),
                config.get("telegram.bot.token", ""),
                config.get("telegram.chat.id", ""),
                new OkHttpClient());
    }

    public TelegramNotifier(boolean enabled, String botToken, String chatId, OkHttpClient client) {
        this.enabled = enabled;
        this.botToken = botToken;
        this.chatId = chatId;
        this.client = client;

        if (isEnabled()) {
            logger.info("✅ Telegram notifications enabled (Chat ID: {})", chatId);
        } else if (enabled) {
            logger.warn("⚠️ Telegram enabled but token/chatId missing. Notifications disabled.");
        }
    }

    @Override
    public void send(AlertLevel level, String message) {
        logSink.send(level, message);
        if (!isEnabled()) {
            return;
        }
        if (level != AlertLevel.CRITICAL && throttled()) {
            logger.debug("⏸️ Rate limit: Telegram message skipped (too soon after last message)");
            return;
        }

        String emoji = switch (level) {
            case CRITICAL -> "🚨";
            case WARNING -> "⚠️";
            case INFO -> "ℹ️";
        };
        sendMessage(emoji + " " + message);
    }

    private synchronized boolean throttled() {
        long now = System.currentTimeMillis();
        if (now - lastMessageTime < MIN_MESSAGE_INTERVAL_MS) {
            return true;
        }
        lastMessageTime = now;
        return false;
    }

    protected void sendMessage(String text) {
        String url = String.format("https://api.telegram.org/bot%s/sendMessage", botToken);

        JSONObject json = new JSONObject();
        json.put("chat_id", chatId);
        json.put("text", text);

        RequestBody body = RequestBody.create(json.toString(), MediaType.parse("application/json"));
        Request request = new Request.Builder()
                .url(url)
                .post(body)
                .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                logger.error("Failed to send Telegram message: {}", response.code());
            }
        } catch (IOException e) {
            logger.error("Error sending Telegram notification: {}", e.getMessage());
        }
    }

    public boolean isEnabled() {
        return enabled && !botToken.isEmpty() && !chatId.isEmpty();
    }
}
