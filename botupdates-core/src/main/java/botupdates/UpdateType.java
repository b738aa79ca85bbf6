package botupdates;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Bot API update discriminants the hub knows about.
 *
 * <p>The wire name is the JSON field that carries the update body and the value sent in
 * {@code allowed_updates}. Updates of other kinds still flow through the hub; they simply
 * have no constant here.
 */
public enum UpdateType {
    MESSAGE("message"),
    EDITED_MESSAGE("edited_message"),
    CHANNEL_POST("channel_post"),
    EDITED_CHANNEL_POST("edited_channel_post"),
    CALLBACK_QUERY("callback_query"),
    CHAT_MEMBER("chat_member"),
    CHAT_JOIN_REQUEST("chat_join_request"),
    /**
     * The bot's own membership changed in a chat. Buffered even when nobody is attached.
     */
    MY_CHAT_MEMBER("my_chat_member");

    /**
     * Allow-list used by the running poll loop.
     */
    public static final Set<UpdateType> DEFAULT_ALLOWED = Collections.unmodifiableSet(EnumSet.of(
            MESSAGE, EDITED_MESSAGE, CHANNEL_POST, EDITED_CHANNEL_POST, MY_CHAT_MEMBER));

    private final String wireName;

    UpdateType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name to a constant.
     *
     * @param wireName the JSON field name
     * @return the matching type, or {@code null} if unknown
     */
    public static UpdateType fromWireName(String wireName) {
        for (UpdateType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        return null;
    }

    /**
     * Maps a set of types to their wire names, preserving declaration order.
     */
    public static Set<String> wireNames(Set<UpdateType> types) {
        Objects.requireNonNull(types, "types");
        Set<String> names = new LinkedHashSet<>();
        for (UpdateType type : values()) {
            if (types.contains(type)) {
                names.add(type.wireName);
            }
        }
        return Collections.unmodifiableSet(names);
    }
}
