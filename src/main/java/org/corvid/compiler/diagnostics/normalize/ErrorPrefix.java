package org.corvid.compiler.diagnostics.normalize;

import java.util.Objects;

/**
 * The message part of a raw parser error: either text the offending token is appended to,
 * or a prefix and suffix the token is inserted between.
 */
public sealed interface ErrorPrefix {

    /**
     * @return The prefix with the token left out.
     */
    String render();

    static ErrorPrefix of(String text) {
        return new Plain(text);
    }

    static ErrorPrefix surrounding(String prefix, String suffix) {
        return new Surrounding(prefix, suffix);
    }

    record Plain(String text) implements ErrorPrefix {
        public Plain {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String render() {
            return text;
        }
    }

    record Surrounding(String prefix, String suffix) implements ErrorPrefix {
        public Surrounding {
            Objects.requireNonNull(prefix, "prefix");
            Objects.requireNonNull(suffix, "suffix");
        }

        @Override
        public String render() {
            return prefix + suffix;
        }
    }
}
