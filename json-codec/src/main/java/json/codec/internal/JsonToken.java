package json.codec.internal;

import java.util.Objects;

/// A lexical unit produced by {@link JsonTokenizer}.
///
/// Every token records the offset of its first character so the parser can
/// locate grammar errors. Tokens do not outlive a single parser step.
public sealed interface JsonToken
        permits JsonToken.Punctuation, JsonToken.StringToken, JsonToken.NumberToken,
        JsonToken.BooleanToken, JsonToken.NullToken {

    /// The kinds of token.
    enum Kind {
        /// `,`
        COMMA(","),
        /// `:`
        COLON(":"),
        /// `[`
        BRACKET_ON("["),
        /// `]`
        BRACKET_OFF("]"),
        /// `{`
        BRACE_ON("{"),
        /// `}`
        BRACE_OFF("}"),
        STRING("string"),
        NUMBER("number"),
        BOOLEAN("boolean"),
        NULL("null");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        /// {@return the text used to describe this kind in error messages}
        public String label() {
            return label;
        }
    }

    /// {@return the kind of this token}
    Kind kind();

    /// {@return the offset of the first character of this token}
    int offset();

    /// {@return a short description of this token for error messages}
    String describe();

    /// One of the six structural characters.
    record Punctuation(Kind kind, int offset) implements JsonToken {
        public Punctuation {
            Objects.requireNonNull(kind);
            if (kind.ordinal() > Kind.BRACE_OFF.ordinal()) {
                throw new IllegalArgumentException("Not a punctuation kind: " + kind);
            }
        }

        @Override
        public String describe() {
            return "'" + kind.label() + "'";
        }
    }

    /// A string literal, already unescaped.
    record StringToken(String value, int offset) implements JsonToken {
        public StringToken {
            Objects.requireNonNull(value);
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public String describe() {
            return "string \"" + value + "\"";
        }
    }

    /// A number literal.
    record NumberToken(double value, int offset) implements JsonToken {
        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public String describe() {
            return "number " + value;
        }
    }

    /// The `true` or `false` literal.
    record BooleanToken(boolean value, int offset) implements JsonToken {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public String describe() {
            return String.valueOf(value);
        }
    }

    /// The `null` literal.
    record NullToken(int offset) implements JsonToken {
        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public String describe() {
            return "null";
        }
    }
}
