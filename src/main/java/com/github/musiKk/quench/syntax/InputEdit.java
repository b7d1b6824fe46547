package com.github.musiKk.quench.syntax;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Describes a single text replacement: the bytes {@code [startByte, oldEndByte)}
 * of the old text were replaced by the bytes {@code [startByte, newEndByte)} of
 * the new text. Old positions refer to the old text, the new end position to
 * the new text.
 */
public record InputEdit(
        int startByte,
        int oldEndByte,
        int newEndByte,
        Point startPoint,
        Point oldEndPoint,
        Point newEndPoint) {

    public InputEdit {
        Objects.requireNonNull(startPoint, "startPoint");
        Objects.requireNonNull(oldEndPoint, "oldEndPoint");
        Objects.requireNonNull(newEndPoint, "newEndPoint");
        if (startByte < 0) {
            throw new IllegalArgumentException("negative start byte " + startByte);
        }
        if (startByte > oldEndByte || startByte > newEndByte) {
            throw new IllegalArgumentException("edit ends before it starts: " + startByte + ".." + oldEndByte + " -> " + newEndByte);
        }
    }

    /**
     * Builds the edit for replacing the characters {@code [from, to)} of
     * {@code text} with {@code replacement}. Character indices are Java string
     * (UTF-16) indices, as editors report them.
     */
    public static Change forReplacement(String text, int from, int to, String replacement) {
        if (from < 0 || from > to || to > text.length()) {
            throw new IndexOutOfBoundsException("range " + from + ".." + to + " outside text of length " + text.length());
        }
        byte[] prefix = text.substring(0, from).getBytes(StandardCharsets.UTF_8);
        byte[] removed = text.substring(from, to).getBytes(StandardCharsets.UTF_8);
        byte[] inserted = replacement.getBytes(StandardCharsets.UTF_8);

        var startPoint = Point.ZERO.advance(prefix, 0, prefix.length);
        var edit = new InputEdit(
                prefix.length,
                prefix.length + removed.length,
                prefix.length + inserted.length,
                startPoint,
                startPoint.advance(removed, 0, removed.length),
                startPoint.advance(inserted, 0, inserted.length));
        var newText = text.substring(0, from) + replacement + text.substring(to);
        return new Change(edit, newText);
    }

    public int delta() {
        return newEndByte - oldEndByte;
    }

    /**
     * Maps an old byte offset at or after {@link #oldEndByte()} into the new text.
     */
    public int shift(int oldByte) {
        return oldByte - oldEndByte + newEndByte;
    }

    /**
     * Maps an old position at or after {@link #oldEndPoint()} into the new text.
     */
    public Point shift(Point oldPoint) {
        if (oldPoint.row() == oldEndPoint.row()) {
            return new Point(newEndPoint.row(), oldPoint.column() - oldEndPoint.column() + newEndPoint.column());
        }
        return new Point(oldPoint.row() - oldEndPoint.row() + newEndPoint.row(), oldPoint.column());
    }

    public record Change(InputEdit edit, String newText) {}
}
