package org.hdlscore.compiler.diagnostics;

import org.hdlscore.compiler.model.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Represents a single diagnostic message (error, warning, note) produced while
 * resolving a design.
 *
 * @param type    The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param spans   The source locations the message refers to, in reporting order.
 * @param notes   Additional notes, each with its own locations.
 */
public record Diagnostic(
        Type type,
        String message,
        List<Span> spans,
        List<Note> notes
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that makes the requesting query fail. */
        ERROR,
        /** A warning that does not fail any query. */
        WARNING
    }

    /**
     * A secondary message attached to a diagnostic, e.g. "previous declaration was here:".
     *
     * @param message The note text.
     * @param spans   The locations the note points at.
     */
    public record Note(String message, List<Span> spans) {
        public Note {
            spans = List.copyOf(spans);
        }
    }

    public Diagnostic {
        spans = List.copyOf(spans);
        notes = List.copyOf(notes);
    }

    /**
     * Starts building an error diagnostic.
     */
    public static Builder error(String message) {
        return new Builder(Type.ERROR, message);
    }

    /**
     * Starts building a warning diagnostic.
     */
    public static Builder warning(String message) {
        return new Builder(Type.WARNING, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[%s] %s", type, message));
        if (!spans.isEmpty()) {
            sb.append(" at ").append(spans.stream().map(Span::toString).collect(Collectors.joining(", ")));
        }
        for (Note note : notes) {
            sb.append("\n  note: ").append(note.message());
            if (!note.spans().isEmpty()) {
                sb.append(' ').append(note.spans().stream().map(Span::toString).collect(Collectors.joining(", ")));
            }
        }
        return sb.toString();
    }

    /**
     * Fluent builder for diagnostics. Spans added after a note belong to that note.
     */
    public static final class Builder {
        private final Type type;
        private final String message;
        private final List<Span> spans = new ArrayList<>();
        private final List<Note> notes = new ArrayList<>();
        private String pendingNote;
        private final List<Span> pendingNoteSpans = new ArrayList<>();

        private Builder(Type type, String message) {
            this.type = type;
            this.message = message;
        }

        /**
         * Adds a location to the diagnostic, or to the most recently added note.
         */
        public Builder span(Span span) {
            if (pendingNote != null) {
                pendingNoteSpans.add(span);
            } else {
                spans.add(span);
            }
            return this;
        }

        /**
         * Starts a note. Subsequent {@link #span(Span)} calls attach to it.
         */
        public Builder note(String noteMessage) {
            flushNote();
            pendingNote = noteMessage;
            return this;
        }

        private void flushNote() {
            if (pendingNote != null) {
                notes.add(new Note(pendingNote, pendingNoteSpans));
                pendingNote = null;
                pendingNoteSpans.clear();
            }
        }

        public Diagnostic build() {
            flushNote();
            return new Diagnostic(type, message, spans, notes);
        }
    }
}
