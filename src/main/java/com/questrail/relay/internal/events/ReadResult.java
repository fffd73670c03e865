package com.questrail.relay.internal.events;

import java.util.Objects;

/**
 * ReadResult
 * -----------------------------------------------------------------------------
 * Classification of one bounded read.
 *
 * <ul>
 *   <li>{@link Data}: bytes were read. The array length is the payload
 *       boundary; the bytes are not assumed to be text or terminated.</li>
 *   <li>{@link EndOfStream}: orderly shutdown by the peer (zero-length read).</li>
 *   <li>{@link Failure}: the read failed.</li>
 * </ul>
 */
public sealed interface ReadResult permits ReadResult.Data, ReadResult.EndOfStream, ReadResult.Failure
{
    static ReadResult data(byte[] payload) {
        return new Data(payload);
    }

    static ReadResult endOfStream() {
        return EndOfStream.INSTANCE;
    }

    static ReadResult failure(Throwable cause) {
        return new Failure(cause);
    }

    /**
     * Bytes received in one read. May be empty for datagrams.
     */
    record Data(byte[] payload) implements ReadResult {
        public Data {
            Objects.requireNonNull(payload, "payload");
        }

        public int length() {
            return payload.length;
        }

        public boolean isEmpty() {
            return payload.length == 0;
        }
    }

    /** Zero-length read on a stream. */
    final class EndOfStream implements ReadResult {
        static final EndOfStream INSTANCE = new EndOfStream();

        private EndOfStream() {}

        @Override
        public String toString() {
            return "EndOfStream";
        }
    }

    record Failure(Throwable cause) implements ReadResult {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
