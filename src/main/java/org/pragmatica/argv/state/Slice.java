package org.pragmatica.argv.state;

import com.google.common.base.Preconditions;

/**
 * A character range within one argument, from start (inclusive) to end (exclusive).
 */
public record Slice(int start, int end) {

    public Slice {
        Preconditions.checkArgument(start >= 0 && start <= end, "Invalid slice (%s, %s)", start, end);
    }

    public static Slice of(int start, int end) {
        return new Slice(start, end);
    }

    public int length() {
        return end - start;
    }

    public String extract(String argument) {
        return argument.substring(start, end);
    }

    /**
     * True when this slice ends exactly where the other one starts.
     */
    public boolean abuts(Slice next) {
        return end == next.start;
    }

    @Override
    public String toString() {
        return "(" + start + "," + end + ")";
    }
}
