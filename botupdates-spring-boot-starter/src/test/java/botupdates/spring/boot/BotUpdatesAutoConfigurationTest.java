package botupdates.spring.boot;

import botupdates.BotUpdate;
import botupdates.BotUpdateHub;
import botupdates.jdbc.DataSourceConnectionProvider;
import botupdates.jdbc.JdbcChatMembershipStore;
import botupdates.jdbc.JdbcCredentialSource;
import botupdates.jdbc.cursor.AbstractJdbcCursorStore;
import botupdates.jdbc.cursor.H2CursorStore;
import botupdates.jdbc.cursor.JdbcCursorStore;
import botupdates.spi.BotApiClient;
import botupdates.spi.ConnectionProvider;
import botupdates.spi.CursorStore;
import botupdates.subscription.BotUpdateSubscription;
import botupdates.subscription.ReadResult;
import botupdates.telegram.ChatMembershipReconciler;
import botupdates.telegram.TelegramBotApiClient;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BotUpdatesAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          BotUpdatesAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:botupdates_" + UUID.randomUUID().toString().replace("-", "")
              + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("botUpdatesConnectionProvider"));
      assertTrue(ctx.containsBean("cursorDialect"));
      assertTrue(ctx.containsBean("cursorStore"));
      assertTrue(ctx.containsBean("credentialSource"));
      assertTrue(ctx.containsBean("chatMembershipStore"));
      assertTrue(ctx.containsBean("botApiClient"));
      assertTrue(ctx.containsBean("botUpdateHub"));
      assertTrue(ctx.containsBean("chatMembershipReconciler"));

      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(H2CursorStore.class, ctx.getBean(AbstractJdbcCursorStore.class));
      assertInstanceOf(JdbcCursorStore.class, ctx.getBean(CursorStore.class));
      assertInstanceOf(JdbcCredentialSource.class, ctx.getBean(JdbcCredentialSource.class));
      assertInstanceOf(JdbcChatMembershipStore.class, ctx.getBean(JdbcChatMembershipStore.class));
      assertInstanceOf(TelegramBotApiClient.class, ctx.getBean(BotApiClient.class));
      assertNotNull(ctx.getBean(ChatMembershipReconciler.class));
      assertEquals(0, ctx.getBean(BotUpdateHub.class).pollerCount());
    });
  }

  @Test
  void customCursorTable() {
    runner.withPropertyValues("botupdates.jdbc.cursor-table=custom_cursor").run(ctx -> {
      AbstractJdbcCursorStore dialect = ctx.getBean(AbstractJdbcCursorStore.class);
      assertInstanceOf(H2CursorStore.class, dialect);
      assertEquals("custom_cursor", dialect.tableName());
    });
  }

  @Test
  void invalidTableNameFailsStartup() {
    runner.withPropertyValues("botupdates.jdbc.bot-table=bot; DROP TABLE bot").run(ctx ->
        assertNotNull(ctx.getStartupFailure()));
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(BotUpdatesAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("botUpdateHub")));
  }

  @Test
  void disabledByProperty() {
    runner.withPropertyValues("botupdates.enabled=false").run(ctx ->
        assertFalse(ctx.containsBean("botUpdateHub")));
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(StubApiConfig.class).run(ctx -> {
      assertInstanceOf(StubApiClient.class, ctx.getBean(BotApiClient.class));
      assertFalse(ctx.containsBean("botApiClient"));
    });
  }

  @Test
  void hubDeliversUpdatesAndPersistsCursor() {
    runner
        .withUserConfiguration(StubApiConfig.class)
        .withPropertyValues("botupdates.initial-delay=300ms")
        .run(ctx -> {
          insertBot(ctx.getBean(DataSource.class), 7L, "7:stub");
          BotUpdateHub hub = ctx.getBean(BotUpdateHub.class);

          try (BotUpdateSubscription sub = hub.attach(7L)) {
            ReadResult result = sub.read(Duration.ofSeconds(5));
            assertInstanceOf(ReadResult.Update.class, result);
            assertEquals(1L, result.updateOrNull().updateId());
          }

          CursorStore cursors = ctx.getBean(CursorStore.class);
          long deadline = System.currentTimeMillis() + 5_000;
          OptionalLong cursor = cursors.loadCursor("7:stub");
          while (cursor.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            cursor = cursors.loadCursor("7:stub");
          }
          assertEquals(OptionalLong.of(2L), cursor);
        });
  }

  private static void insertBot(DataSource dataSource, long id, String token) throws Exception {
    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement()) {
      st.executeUpdate("INSERT INTO bot (id, token, is_active) VALUES (" + id + ", '" + token + "', TRUE)");
    }
  }

  // ── Test configurations ──────────────────────────────────────

  static class StubApiClient implements BotApiClient {
    @Override
    public List<BotUpdate> getUpdates(String token, long offset, Duration timeout, int limit,
        Set<String> allowedUpdates) throws InterruptedException {
      if (timeout.isZero()) {
        return List.of();
      }
      if (offset <= 1) {
        return List.of(new BotUpdate(1, "message", "{\"update_id\":1,\"message\":{\"text\":\"hi\"}}"));
      }
      Thread.sleep(20);
      return List.of();
    }
  }

  @Configuration
  static class StubApiConfig {
    @Bean
    BotApiClient stubApiClient() {
      return new StubApiClient();
    }
  }
}
