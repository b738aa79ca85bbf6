package botupdates.spring.boot;

import botupdates.jdbc.TableNames;
import botupdates.telegram.TelegramBotApiClient;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the bot update hub.
 *
 * @see BotUpdatesAutoConfiguration
 */
@ConfigurationProperties(prefix = "botupdates")
public class BotUpdatesProperties {

    /**
     * Whether to create the hub at all.
     */
    private boolean enabled = true;

    /**
     * Long-poll timeout of each getUpdates call.
     */
    private Duration pollTimeout = Duration.ofSeconds(25);

    /**
     * Maximum number of updates per getUpdates call (1-100).
     */
    private int pollLimit = 100;

    /**
     * Capacity of each subscription queue; the oldest update is dropped on overflow.
     */
    private int subscriptionCapacity = 512;

    /**
     * Number of my_chat_member updates kept for the next subscriber.
     */
    private int highValueBufferCapacity = 2000;

    /**
     * Delay between the end of bootstrap and the first long poll.
     */
    private Duration initialDelay = Duration.ofSeconds(2);

    /**
     * Minimum interval between credential checks of a running poller.
     */
    private Duration credentialCheckInterval = Duration.ofSeconds(5);

    /**
     * Upper bound on batches read by each bootstrap phase of a poller without a cursor.
     */
    private int fastForwardMaxBatches = 20;

    /**
     * How long closing the hub waits for each poller thread.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    private final Telegram telegram = new Telegram();
    private final Jdbc jdbc = new Jdbc();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getPollTimeout() {
        return pollTimeout;
    }

    public void setPollTimeout(Duration pollTimeout) {
        this.pollTimeout = pollTimeout;
    }

    public int getPollLimit() {
        return pollLimit;
    }

    public void setPollLimit(int pollLimit) {
        this.pollLimit = pollLimit;
    }

    public int getSubscriptionCapacity() {
        return subscriptionCapacity;
    }

    public void setSubscriptionCapacity(int subscriptionCapacity) {
        this.subscriptionCapacity = subscriptionCapacity;
    }

    public int getHighValueBufferCapacity() {
        return highValueBufferCapacity;
    }

    public void setHighValueBufferCapacity(int highValueBufferCapacity) {
        this.highValueBufferCapacity = highValueBufferCapacity;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public Duration getCredentialCheckInterval() {
        return credentialCheckInterval;
    }

    public void setCredentialCheckInterval(Duration credentialCheckInterval) {
        this.credentialCheckInterval = credentialCheckInterval;
    }

    public int getFastForwardMaxBatches() {
        return fastForwardMaxBatches;
    }

    public void setFastForwardMaxBatches(int fastForwardMaxBatches) {
        this.fastForwardMaxBatches = fastForwardMaxBatches;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Telegram getTelegram() {
        return telegram;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Telegram {
        /**
         * Bot API root URL.
         */
        private String baseUrl = TelegramBotApiClient.DEFAULT_BASE_URL;

        /**
         * Added to the long-poll timeout to form the hard HTTP request timeout.
         */
        private Duration requestTimeoutMargin = Duration.ofSeconds(10);

        private Duration connectTimeout = Duration.ofSeconds(10);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getRequestTimeoutMargin() {
            return requestTimeoutMargin;
        }

        public void setRequestTimeoutMargin(Duration requestTimeoutMargin) {
            this.requestTimeoutMargin = requestTimeoutMargin;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }
    }

    public static class Jdbc {
        private String botTable = TableNames.BOT;
        private String cursorTable = TableNames.CURSOR;
        private String chatTable = TableNames.CHAT;
        private String chatMemberTable = TableNames.CHAT_MEMBER;

        public String getBotTable() {
            return botTable;
        }

        public void setBotTable(String botTable) {
            this.botTable = botTable;
        }

        public String getCursorTable() {
            return cursorTable;
        }

        public void setCursorTable(String cursorTable) {
            this.cursorTable = cursorTable;
        }

        public String getChatTable() {
            return chatTable;
        }

        public void setChatTable(String chatTable) {
            this.chatTable = chatTable;
        }

        public String getChatMemberTable() {
            return chatMemberTable;
        }

        public void setChatMemberTable(String chatMemberTable) {
            this.chatMemberTable = chatMemberTable;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "botupdates";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
