package io.github.drompincen.clawwatch.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under {@code clawwatch.*}.
 */
@ConfigurationProperties(prefix = "clawwatch")
public class ListenerProperties {

    public static final int MIN_POLL_INTERVAL_SECONDS = 10;

    private boolean enabled = true;
    /** Seconds between the end of one poll cycle and the start of the next. */
    private int pollInterval = 30;
    private String statePath = "storage/listener-state.json";
    /** Zone for due dates and prompt timestamps; blank means the host's zone. */
    private String timezone = "";
    private List<String> watchers = new ArrayList<>(List.of("mail", "calendar", "messages", "notifications"));

    private final Calendar calendar = new Calendar();
    private final Mail mail = new Mail();
    private final Messages messages = new Messages();
    private final CodeReview codeReview = new CodeReview();
    private final Reminders reminders = new Reminders();
    private final Classifier classifier = new Classifier();
    private final Scheduler scheduler = new Scheduler();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getPollInterval() { return pollInterval; }
    public void setPollInterval(int pollInterval) {
        if (pollInterval < MIN_POLL_INTERVAL_SECONDS) {
            throw new IllegalArgumentException("clawwatch.poll-interval must be at least "
                    + MIN_POLL_INTERVAL_SECONDS + " seconds, got " + pollInterval);
        }
        this.pollInterval = pollInterval;
    }

    public String getStatePath() { return statePath; }
    public void setStatePath(String statePath) { this.statePath = statePath; }

    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }

    public ZoneId resolveZone() {
        return timezone == null || timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone.trim());
    }

    public List<String> getWatchers() { return watchers; }
    public void setWatchers(List<String> watchers) { this.watchers = watchers; }

    public Calendar getCalendar() { return calendar; }
    public Mail getMail() { return mail; }
    public Messages getMessages() { return messages; }
    public CodeReview getCodeReview() { return codeReview; }
    public Reminders getReminders() { return reminders; }
    public Classifier getClassifier() { return classifier; }
    public Scheduler getScheduler() { return scheduler; }

    public static class Calendar {
        private int upcomingMinutes = 15;

        public int getUpcomingMinutes() { return upcomingMinutes; }
        public void setUpcomingMinutes(int upcomingMinutes) { this.upcomingMinutes = upcomingMinutes; }
    }

    public static class Mail {
        private String mailbox = "INBOX";
        private int limit = 50;

        public String getMailbox() { return mailbox; }
        public void setMailbox(String mailbox) { this.mailbox = mailbox; }

        public int getLimit() { return limit; }
        public void setLimit(int limit) { this.limit = limit; }
    }

    public static class Messages {
        private String dbPath = Path.of(System.getProperty("user.home"), "Library", "Messages", "chat.db").toString();

        public String getDbPath() { return dbPath; }
        public void setDbPath(String dbPath) { this.dbPath = dbPath; }
    }

    public static class CodeReview {
        private String repo = "";
        private String label = "clawwatch-review";

        public String getRepo() { return repo; }
        public void setRepo(String repo) { this.repo = repo; }

        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }
    }

    public static class Reminders {
        private String listName = "ClawWatch Actions";

        public String getListName() { return listName; }
        public void setListName(String listName) { this.listName = listName; }
    }

    public static class Classifier {
        private String apiKey;
        private String model = "claude-3-5-haiku-latest";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class Scheduler {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
