package botupdates;

import java.util.Objects;

/**
 * One update received from the Bot API.
 *
 * <p>Instances are immutable, so the poller hands the same instance to every subscription
 * without one consumer being able to affect another's view.
 *
 * @param updateId    strictly increasing sequence number assigned by the Bot API
 * @param type        discriminant, the name of the field carrying the update body
 *                    (e.g. {@code "message"}, {@code "my_chat_member"})
 * @param payloadJson the complete update object as raw JSON
 */
public record BotUpdate(long updateId, String type, String payloadJson) {

    public BotUpdate {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payloadJson, "payloadJson");
        if (type.isEmpty()) {
            throw new IllegalArgumentException("type must not be empty");
        }
    }

    /**
     * Returns {@code true} if this update is of the given kind.
     */
    public boolean is(UpdateType updateType) {
        return updateType.wireName().equals(type);
    }

    /**
     * Returns the known type constant, or {@code null} for update kinds without one.
     */
    public UpdateType knownType() {
        return UpdateType.fromWireName(type);
    }

    @Override
    public String toString() {
        return "BotUpdate{updateId=" + updateId + ", type=" + type + "}";
    }
}
