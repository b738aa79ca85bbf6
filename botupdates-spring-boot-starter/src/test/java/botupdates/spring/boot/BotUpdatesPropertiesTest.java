package botupdates.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BotUpdatesPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(BotUpdatesProperties.class);
            assertTrue(props.isEnabled());
            assertEquals(Duration.ofSeconds(25), props.getPollTimeout());
            assertEquals(100, props.getPollLimit());
            assertEquals(512, props.getSubscriptionCapacity());
            assertEquals(2000, props.getHighValueBufferCapacity());
            assertEquals(Duration.ofSeconds(2), props.getInitialDelay());
            assertEquals(Duration.ofSeconds(5), props.getCredentialCheckInterval());
            assertEquals(20, props.getFastForwardMaxBatches());
            assertEquals(Duration.ofSeconds(5), props.getShutdownTimeout());
            assertEquals("https://api.telegram.org", props.getTelegram().getBaseUrl());
            assertEquals(Duration.ofSeconds(10), props.getTelegram().getRequestTimeoutMargin());
            assertEquals("bot", props.getJdbc().getBotTable());
            assertEquals("bot_update_cursor", props.getJdbc().getCursorTable());
            assertEquals("bot_chat", props.getJdbc().getChatTable());
            assertEquals("bot_chat_member", props.getJdbc().getChatMemberTable());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("botupdates", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "botupdates.enabled=false",
                "botupdates.poll-timeout=10s",
                "botupdates.poll-limit=50",
                "botupdates.subscription-capacity=64",
                "botupdates.high-value-buffer-capacity=100",
                "botupdates.initial-delay=0s",
                "botupdates.credential-check-interval=1m",
                "botupdates.fast-forward-max-batches=5",
                "botupdates.shutdown-timeout=PT1S",
                "botupdates.telegram.base-url=http://localhost:8081",
                "botupdates.telegram.request-timeout-margin=3s",
                "botupdates.jdbc.bot-table=tg_bot",
                "botupdates.jdbc.cursor-table=tg_cursor",
                "botupdates.jdbc.chat-table=tg_chat",
                "botupdates.jdbc.chat-member-table=tg_chat_member",
                "botupdates.metrics.enabled=false",
                "botupdates.metrics.name-prefix=tg"
        ).run(ctx -> {
            var props = ctx.getBean(BotUpdatesProperties.class);
            assertFalse(props.isEnabled());
            assertEquals(Duration.ofSeconds(10), props.getPollTimeout());
            assertEquals(50, props.getPollLimit());
            assertEquals(64, props.getSubscriptionCapacity());
            assertEquals(100, props.getHighValueBufferCapacity());
            assertEquals(Duration.ZERO, props.getInitialDelay());
            assertEquals(Duration.ofMinutes(1), props.getCredentialCheckInterval());
            assertEquals(5, props.getFastForwardMaxBatches());
            assertEquals(Duration.ofSeconds(1), props.getShutdownTimeout());
            assertEquals("http://localhost:8081", props.getTelegram().getBaseUrl());
            assertEquals(Duration.ofSeconds(3), props.getTelegram().getRequestTimeoutMargin());
            assertEquals("tg_bot", props.getJdbc().getBotTable());
            assertEquals("tg_cursor", props.getJdbc().getCursorTable());
            assertEquals("tg_chat", props.getJdbc().getChatTable());
            assertEquals("tg_chat_member", props.getJdbc().getChatMemberTable());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("tg", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(BotUpdatesProperties.class)
    static class PropsConfig {
    }
}
