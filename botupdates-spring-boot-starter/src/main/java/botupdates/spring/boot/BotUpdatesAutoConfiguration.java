package botupdates.spring.boot;

import botupdates.BotUpdateHub;
import botupdates.jdbc.DataSourceConnectionProvider;
import botupdates.jdbc.JdbcChatMembershipStore;
import botupdates.jdbc.JdbcCredentialSource;
import botupdates.jdbc.TableNames;
import botupdates.jdbc.cursor.AbstractJdbcCursorStore;
import botupdates.jdbc.cursor.JdbcCursorStore;
import botupdates.jdbc.cursor.JdbcCursorStores;
import botupdates.poller.PollerConfig;
import botupdates.spi.BotApiClient;
import botupdates.spi.ChatMembershipStore;
import botupdates.spi.ConnectionProvider;
import botupdates.spi.CredentialSource;
import botupdates.spi.CursorStore;
import botupdates.spi.MetricsExporter;
import botupdates.telegram.ChatMembershipReconciler;
import botupdates.telegram.TelegramBotApiClient;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the bot update hub.
 *
 * <p>Wires a {@link BotUpdateHub} from a {@link DataSource} and {@link BotUpdatesProperties}:
 * credentials and cursors live in JDBC tables, the cursor dialect is detected from the JDBC
 * URL, and updates come from the Telegram Bot API. Every collaborator backs off when the
 * application defines its own bean of the same type.
 *
 * @see BotUpdatesProperties
 * @see BotUpdatesMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(BotUpdateHub.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "botupdates", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(BotUpdatesProperties.class)
public class BotUpdatesAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider botUpdatesConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcCursorStore cursorDialect(DataSource dataSource, BotUpdatesProperties props) {
    AbstractJdbcCursorStore detected = JdbcCursorStores.detect(dataSource);
    String tableName = props.getJdbc().getCursorTable();
    if (!TableNames.CURSOR.equals(tableName)) {
      return detected.withTableName(tableName);
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(CursorStore.class)
  public JdbcCursorStore cursorStore(ConnectionProvider connectionProvider,
      AbstractJdbcCursorStore cursorDialect) {
    return new JdbcCursorStore(connectionProvider, cursorDialect);
  }

  @Bean
  @ConditionalOnMissingBean(CredentialSource.class)
  public JdbcCredentialSource credentialSource(ConnectionProvider connectionProvider,
      BotUpdatesProperties props) {
    return new JdbcCredentialSource(connectionProvider, props.getJdbc().getBotTable());
  }

  @Bean
  @ConditionalOnMissingBean(ChatMembershipStore.class)
  public JdbcChatMembershipStore chatMembershipStore(ConnectionProvider connectionProvider,
      BotUpdatesProperties props) {
    return new JdbcChatMembershipStore(connectionProvider,
        props.getJdbc().getChatTable(), props.getJdbc().getChatMemberTable());
  }

  @Bean
  @ConditionalOnMissingBean(BotApiClient.class)
  public TelegramBotApiClient botApiClient(BotUpdatesProperties props) {
    BotUpdatesProperties.Telegram telegram = props.getTelegram();
    return TelegramBotApiClient.builder()
        .baseUrl(telegram.getBaseUrl())
        .requestTimeoutMargin(telegram.getRequestTimeoutMargin())
        .connectTimeout(telegram.getConnectTimeout())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public BotUpdateHub botUpdateHub(BotUpdatesProperties props,
      CredentialSource credentialSource,
      CursorStore cursorStore,
      BotApiClient botApiClient,
      ObjectProvider<MetricsExporter> metricsProvider) {
    PollerConfig config = new PollerConfig()
        .setPollTimeout(props.getPollTimeout())
        .setPollLimit(props.getPollLimit())
        .setSubscriptionCapacity(props.getSubscriptionCapacity())
        .setHighValueBufferCapacity(props.getHighValueBufferCapacity())
        .setInitialDelay(props.getInitialDelay())
        .setCredentialCheckInterval(props.getCredentialCheckInterval())
        .setFastForwardMaxBatches(props.getFastForwardMaxBatches())
        .setShutdownTimeout(props.getShutdownTimeout());

    BotUpdateHub.Builder builder = BotUpdateHub.builder()
        .credentialSource(credentialSource)
        .cursorStore(cursorStore)
        .apiClient(botApiClient)
        .pollerConfig(config);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ChatMembershipReconciler chatMembershipReconciler(ChatMembershipStore chatMembershipStore) {
    return new ChatMembershipReconciler(chatMembershipStore);
  }
}
