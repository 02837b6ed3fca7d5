package net.sculp.util;

import net.sculp.api.parser.TextLocation;

public final class Locations {

    public static class FixedLocation implements TextLocation {

        private final long line;
        private final long column;
        private final long characterIndex;

        public FixedLocation(long line, long column, long characterIndex) {
            this.line = line;
            this.column = column;
            this.characterIndex = characterIndex;
        }
        public FixedLocation(TextLocation other) {
            this(other.getLine(), other.getColumn(),
                 other.getCharacterIndex());
        }

        public String toString() {
            return String.format("line %d column %d (char %d)", getLine(),
                                 getColumn(), getCharacterIndex());
        }

        public boolean equals(Object other) {
            if (! (other instanceof TextLocation)) return false;
            TextLocation co = (TextLocation) other;
            return (line == co.getLine() &&
                    column == co.getColumn() &&
                    characterIndex == co.getCharacterIndex());
        }

        public int hashCode() {
            return (int) (line ^ line >>> 31 ^ column ^ column >>> 31 ^
                characterIndex ^ characterIndex >>> 31);
        }

        public long getLine() {
            return line;
        }

        public long getColumn() {
            return column;
        }

        public long getCharacterIndex() {
            return characterIndex;
        }

    }

    /**
     * A mutable location that follows a scan over some text.
     * CR, LF, and CR-LF each count as one line break.
     */
    public static class LocationTracker implements TextLocation {

        private long line;
        private long column;
        private long characterIndex;
        private boolean afterCR;

        public LocationTracker() {
            line = 1;
            column = 1;
            characterIndex = 0;
            afterCR = false;
        }

        public String toString() {
            return String.format("%s@%h[line=%s,column=%s,char=%s]",
                getClass().getName(), this, getLine(), getColumn(),
                getCharacterIndex());
        }

        public long getLine() {
            return line;
        }

        public long getColumn() {
            return column;
        }

        public long getCharacterIndex() {
            return characterIndex;
        }

        public FixedLocation snapshot() {
            return new FixedLocation(this);
        }

        @SuppressWarnings("fallthrough")
        public void advance(char ch) {
            characterIndex++;
            switch (ch) {
                case '\n':
                    if (afterCR) break;
                    // Intentionally falling through.
                case '\r':
                    line++;
                    column = 1;
                    break;
                default:
                    column++;
                    break;
            }
            afterCR = (ch == '\r');
        }
        public void advance(CharSequence data, int start, int end) {
            for (int i = start; i < end; i++) {
                advance(data.charAt(i));
            }
        }

    }

    // Prevent construction.
    private Locations() {}

}
