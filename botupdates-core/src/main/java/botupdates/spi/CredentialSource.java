package botupdates.spi;

import botupdates.model.BotCredential;

import java.util.Optional;

/**
 * Read access to the bot records. Consulted on attach and periodically by every poller
 * to detect deactivation or token rotation.
 */
public interface CredentialSource {

    /**
     * Looks up the bot's current credential.
     *
     * @param botId the bot record id
     * @return the credential, or empty if no such record exists
     */
    Optional<BotCredential> findCredential(long botId);
}
