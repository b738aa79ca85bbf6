package botupdates.subscription;

import botupdates.BotUpdate;

import java.util.Objects;

/**
 * Outcome of {@link BotUpdateSubscription#read}.
 *
 * <ul>
 *   <li>{@link Update} carries the next update.</li>
 *   <li>{@link EndOfStream} the subscription was closed and everything queued before that
 *       has been read.</li>
 *   <li>{@link TimedOut} the read deadline passed with nothing to return.</li>
 * </ul>
 */
public sealed interface ReadResult
        permits ReadResult.Update, ReadResult.EndOfStream, ReadResult.TimedOut {

    EndOfStream END_OF_STREAM = new EndOfStream();

    TimedOut TIMED_OUT = new TimedOut();

    /**
     * Returns the update, or {@code null} if this result carries none.
     */
    default BotUpdate updateOrNull() {
        return this instanceof Update u ? u.update() : null;
    }

    default boolean isEndOfStream() {
        return this instanceof EndOfStream;
    }

    record Update(BotUpdate update) implements ReadResult {
        public Update {
            Objects.requireNonNull(update, "update");
        }
    }

    record EndOfStream() implements ReadResult {
    }

    record TimedOut() implements ReadResult {
    }
}
