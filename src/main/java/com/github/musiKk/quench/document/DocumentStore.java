package com.github.musiKk.quench.document;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.quench.analysis.Diagnostics;
import com.github.musiKk.quench.analysis.SemanticTokens;
import com.github.musiKk.quench.compiler.Compiler;
import com.github.musiKk.quench.parser.IncrementalParser;
import com.github.musiKk.quench.syntax.InputEdit;
import com.github.musiKk.quench.syntax.SyntaxNode;
import com.github.musiKk.quench.syntax.SyntaxTree;

import lombok.RequiredArgsConstructor;

/**
 * Open documents keyed by identity (usually a URI), each with its own
 * {@link IncrementalParser}.
 *
 * <p>Different documents may be used from different threads at the same time.
 * Calls concerning one document must not overlap.
 */
@RequiredArgsConstructor
public class DocumentStore {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentStore.class);

    private final Map<String, IncrementalParser> documents = new ConcurrentHashMap<>();
    private final Compiler compiler;

    public DocumentStore() {
        this(new Compiler());
    }

    /**
     * @throws AlreadyOpenException if {@code id} is already open
     */
    public void open(String id, String text) {
        documents.compute(id, (key, existing) -> {
            if (existing != null) {
                throw new AlreadyOpenException(id);
            }
            return IncrementalParser.create(text);
        });
        LOG.debug("opened {}", id);
    }

    /**
     * Replaces the whole text. Used when several edits arrive at once.
     */
    public void update(String id, String text) {
        get(id).reparseFull(text);
    }

    /**
     * Applies exactly one edit; {@code newText} is the full text after it.
     */
    public void update(String id, InputEdit edit, String newText) {
        get(id).applyEdit(edit, newText);
    }

    /**
     * @throws NotOpenException if {@code id} is not open, including a second close
     */
    public void close(String id) {
        if (documents.remove(id) == null) {
            throw new NotOpenException(id);
        }
        LOG.debug("closed {}", id);
    }

    public boolean isOpen(String id) {
        return documents.containsKey(id);
    }

    /**
     * The current root. Only valid until the next update or close of {@code id}.
     */
    public SyntaxNode treeRoot(String id) {
        return tree(id).rootNode();
    }

    public String debugString(String id) {
        return get(id).debugString();
    }

    public String compile(String id) {
        return compiler.compile(tree(id));
    }

    public List<Diagnostics.Diagnostic> diagnostics(String id) {
        return Diagnostics.of(tree(id));
    }

    public List<SemanticTokens.SemanticToken> semanticTokens(String id) {
        return SemanticTokens.of(tree(id));
    }

    private SyntaxTree tree(String id) {
        return get(id).tree();
    }

    private IncrementalParser get(String id) {
        var parser = documents.get(id);
        if (parser == null) {
            throw new NotOpenException(id);
        }
        return parser;
    }
}
