/**
 * Records exchanged with the hub's collaborators.
 *
 * @see botupdates.model.BotCredential
 * @see botupdates.model.ChatMembership
 */
package botupdates.model;
