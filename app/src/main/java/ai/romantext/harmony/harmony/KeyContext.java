package ai.romantext.harmony.harmony;

import java.util.Objects;
import java.util.Optional;

/**
 * The prevailing key of an analysis run, which is unestablished until the first key label is read.
 */
public sealed interface KeyContext permits KeyContext.Unestablished, KeyContext.Established {

    static KeyContext unestablished() {
        return Unestablished.INSTANCE;
    }

    static KeyContext of(Key key) {
        return new Established(key);
    }

    Optional<Key> key();

    final class Unestablished implements KeyContext {

        private static final Unestablished INSTANCE = new Unestablished();

        private Unestablished() {
        }

        @Override
        public Optional<Key> key() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "Unestablished";
        }
    }

    record Established(Key value) implements KeyContext {

        public Established {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Optional<Key> key() {
            return Optional.of(value);
        }
    }
}
