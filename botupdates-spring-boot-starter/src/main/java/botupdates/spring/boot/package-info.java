/**
 * Spring Boot auto-configuration: properties under {@code botupdates.*}, a JDBC-backed
 * {@link botupdates.BotUpdateHub} and optional Micrometer metrics.
 */
package botupdates.spring.boot;
