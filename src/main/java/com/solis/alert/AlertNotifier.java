package com.solis.alert;

import com.solis.config.Config;
import com.solis.data.http.HttpJsonClient;
import com.solis.heartbeat.CycleFailureListener;
import com.solis.model.OnchainSignal;
import com.solis.model.RepoSignal;
import com.solis.model.ReportAnomaly;
import com.solis.model.SignalFamily;
import com.solis.model.SignalReport;
import com.solis.model.TokenSignal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pushes anomaly spikes after each report and a notice for each failed cycle.
 * <p>
 * Delivery problems are logged and swallowed here: an alert never fails the cycle it reports on.
 */
public final class AlertNotifier implements CycleFailureListener {
    private static final Logger LOG = LogManager.getLogger(AlertNotifier.class);
    private static final DateTimeFormatter TITLE_DATE = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);
    static final int MAX_LISTED = 10;

    public static final class Settings {
        public boolean enabled;
        public String channel;
        public double anomalyThreshold;
        public String telegramBotToken;
        public String telegramChatId;
        public String discordWebhookUrl;
        public int timeoutSec;
    }

    private final boolean enabled;
    private final AlertChannel channel;
    private final double anomalyThreshold;

    public AlertNotifier(boolean enabled, AlertChannel channel, double anomalyThreshold) {
        if (enabled && channel == null) {
            throw new IllegalArgumentException("an alert channel is required when alerts are enabled");
        }
        this.enabled = enabled;
        this.channel = channel;
        this.anomalyThreshold = anomalyThreshold;
    }

    public static AlertNotifier disabled() {
        return new AlertNotifier(false, null, 3.0);
    }

    public static Settings loadSettings(Config config) {
        Settings settings = new Settings();
        settings.enabled = config.getBoolean("alerts.enabled", false);
        settings.channel = config.getString("alerts.channel", "telegram").toLowerCase(Locale.ROOT);
        settings.anomalyThreshold = config.getDouble("alerts.anomaly_threshold", 3.0);
        settings.telegramBotToken = config.getString("alerts.telegram.bot_token", "");
        settings.telegramChatId = config.getString("alerts.telegram.chat_id", "");
        settings.discordWebhookUrl = config.getString("alerts.discord.webhook_url", "");
        settings.timeoutSec = config.getInt("http.timeout_sec", 20);
        return settings;
    }

    /**
     * @throws IllegalArgumentException when alerts are enabled with an unknown channel or missing credentials
     */
    public static AlertNotifier fromSettings(Settings settings, HttpJsonClient http) {
        if (!settings.enabled) {
            return disabled();
        }
        AlertChannel channel;
        switch (settings.channel) {
            case "telegram":
                channel = new TelegramChannel(http, settings.telegramBotToken, settings.telegramChatId, settings.timeoutSec);
                break;
            case "discord":
                channel = new DiscordChannel(http, settings.discordWebhookUrl, settings.timeoutSec);
                break;
            default:
                throw new IllegalArgumentException("unknown alerts.channel: " + settings.channel);
        }
        return new AlertNotifier(true, channel, settings.anomalyThreshold);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Spikes at or above {@code threshold}: flagged repos on stars and commits, every onchain
     * program on tx count, every token on volume.
     */
    public static List<Alert> detectAlerts(SignalReport report, double threshold) {
        List<Alert> alerts = new ArrayList<>();
        Set<String> flaggedRepos = new HashSet<>();
        for (ReportAnomaly anomaly : report.anomalies()) {
            if (anomaly.family() == SignalFamily.REPOS) {
                flaggedRepos.add(anomaly.key());
            }
        }
        for (RepoSignal repo : report.signals().repos()) {
            if (!flaggedRepos.contains(repo.getRepo())) {
                continue;
            }
            if (Math.abs(repo.getStarsZScore()) >= threshold) {
                alerts.add(new Alert(repo.getRepo(), "stars", repo.getStarsZScore()));
            }
            if (Math.abs(repo.getCommitsZScore()) >= threshold) {
                alerts.add(new Alert(repo.getRepo(), "commits", repo.getCommitsZScore()));
            }
        }
        for (OnchainSignal signal : report.signals().onchain()) {
            if (Math.abs(signal.getTxZScore()) >= threshold) {
                alerts.add(new Alert(firstNonBlank(signal.getProgramName(), signal.getProgramId()), "tx", signal.getTxZScore()));
            }
        }
        for (TokenSignal token : report.signals().tokens()) {
            if (Math.abs(token.getVolumeZScore()) >= threshold) {
                String symbol = token.getSymbol() == null || token.getSymbol().isBlank() ? token.getId() : "$" + token.getSymbol();
                alerts.add(new Alert(symbol, "volume", token.getVolumeZScore()));
            }
        }
        return alerts;
    }

    public static String formatReportMessage(SignalReport report, List<Alert> alerts, double threshold) {
        List<String> lines = new ArrayList<>();
        lines.add("SOLIS Report - " + TITLE_DATE.format(report.date()));
        lines.add("");
        lines.add(String.format(Locale.ROOT, "Anomaly spikes (z >= %.1f):", threshold));
        for (int i = 0; i < Math.min(MAX_LISTED, alerts.size()); i++) {
            lines.add("  - " + alerts.get(i).message());
        }
        if (alerts.size() > MAX_LISTED) {
            lines.add("  ... and " + (alerts.size() - MAX_LISTED) + " more");
        }
        lines.add("");
        lines.add(report.signals().size() + " signals | " + report.anomalies().size() + " anomalies");
        return String.join("\n", lines);
    }

    public static String formatFailureMessage(String error) {
        return String.join("\n",
                "SOLIS cycle failed",
                "",
                "Error: " + (error == null || error.isBlank() ? "unknown" : error),
                "",
                "Check the agent logs for details.");
    }

    /**
     * @return true when a message was delivered
     */
    public boolean sendReportAlerts(SignalReport report) {
        if (!enabled || report == null) {
            return false;
        }
        List<Alert> alerts = detectAlerts(report, anomalyThreshold);
        if (alerts.isEmpty()) {
            LOG.info("[ALERT] no alert-worthy events date={}", report.date());
            return false;
        }
        LOG.info("[ALERT] sending alerts count={} channel={}", alerts.size(), channel.name());
        return deliver(formatReportMessage(report, alerts, anomalyThreshold), "report");
    }

    public boolean sendFailureAlert(String error) {
        if (!enabled) {
            return false;
        }
        return deliver(formatFailureMessage(error), "failure");
    }

    @Override
    public void cycleFailed(LocalDate date, Exception error) {
        String message = error == null ? null : error.getMessage();
        sendFailureAlert(message == null && error != null ? error.getClass().getSimpleName() : message);
    }

    private boolean deliver(String text, String kind) {
        try {
            channel.send(text);
            LOG.info("[ALERT] sent kind={} channel={}", kind, channel.name());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("[ALERT] interrupted while sending kind={} channel={}", kind, channel.name());
            return false;
        } catch (IOException | RuntimeException e) {
            LOG.error("[ALERT] send failed kind={} channel={} error={}, cycle continues", kind, channel.name(), e.getMessage());
            return false;
        }
    }

    private static String firstNonBlank(String first, String second) {
        return first == null || first.isBlank() ? second : first;
    }
}
