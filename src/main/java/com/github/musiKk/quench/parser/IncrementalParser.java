package com.github.musiKk.quench.parser;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.quench.syntax.InputEdit;
import com.github.musiKk.quench.syntax.SyntaxTree;

/**
 * Keeps the syntax tree of a single document in step with its text.
 *
 * <p>Not thread-safe: edits of one document must arrive one after another.
 */
public class IncrementalParser {

    private static final Logger LOG = LoggerFactory.getLogger(IncrementalParser.class);

    private final Parser parser = new Parser();
    private ParseState state;

    private IncrementalParser() {
    }

    /**
     * Parses {@code text} from scratch.
     */
    public static IncrementalParser create(String text) {
        var incrementalParser = new IncrementalParser();
        incrementalParser.reparseFull(text);
        return incrementalParser;
    }

    public ParseState state() {
        return state;
    }

    public SyntaxTree tree() {
        return state.tree();
    }

    /**
     * Applies a single edit. {@code newText} must be the whole document after
     * exactly {@code edit}; statements of the previous tree that the edit cannot
     * have touched are reused.
     */
    public ParseState applyEdit(InputEdit edit, String newText) {
        Objects.requireNonNull(edit, "edit");
        var source = newText.getBytes(StandardCharsets.UTF_8);
        var expectedLength = state.tree().length() + edit.delta();
        if (source.length != expectedLength) {
            throw new IllegalArgumentException("edit " + edit + " does not turn a text of " + state.tree().length()
                    + " bytes into one of " + source.length + " bytes");
        }

        var hint = state.tree().edit(edit);
        var result = parser.parse(source, Optional.of(hint));
        LOG.debug("incremental parse reused {} of {} statements", result.reusedStatements(),
                result.tree().rootNode().children().size());
        state = new ParseState(newText, result.tree(), result.reusedStatements());
        return state;
    }

    /**
     * Parses {@code newText} without consulting the previous tree.
     */
    public ParseState reparseFull(String newText) {
        var result = parser.parse(newText.getBytes(StandardCharsets.UTF_8));
        state = new ParseState(newText, result.tree(), 0);
        return state;
    }

    public String debugString() {
        return state.tree().debugString();
    }
}
