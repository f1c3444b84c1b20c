package org.hdlscore.compiler.frontend.score;

import org.hdlscore.compiler.frontend.score.arena.Arenas;
import org.hdlscore.compiler.frontend.score.id.NodeRef;
import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.frontend.semantics.Defs;
import org.hdlscore.compiler.frontend.semantics.Scope;

/**
 * The state shared by all queries of one session: arenas owning the artifacts, the memo
 * tables, the syntax table and the library registry. Not thread-safe.
 */
public final class Scoreboard {

    public static final String HIR = "hir";
    public static final String DEFINITIONS = "definitions";
    public static final String SCOPE = "scope";

    private final Arenas arenas = new Arenas();
    private final SyntaxTable syntax = new SyntaxTable();
    private final LibraryRegistry libraries = new LibraryRegistry();
    private final QueryTable<NodeRef, Object> hirTable;
    private final QueryTable<ScopeRef, Defs> defsTable;
    private final QueryTable<ScopeRef, Scope> scopeTable;
    private int nextId;

    public Scoreboard(ScoreboardListener listener, QueryTable.CycleReporter<Object> cycleReporter) {
        this.hirTable = new QueryTable<>(HIR, listener, cycleReporter);
        this.defsTable = new QueryTable<>(DEFINITIONS, listener, cycleReporter);
        this.scopeTable = new QueryTable<>(SCOPE, listener, cycleReporter);
    }

    /**
     * @return A fresh id, unique across all node kinds of this session.
     */
    public int allocateId() {
        return nextId++;
    }

    public Arenas arenas() {
        return arenas;
    }

    public SyntaxTable syntax() {
        return syntax;
    }

    public LibraryRegistry libraries() {
        return libraries;
    }

    public QueryTable<NodeRef, Object> hirTable() {
        return hirTable;
    }

    public QueryTable<ScopeRef, Defs> defsTable() {
        return defsTable;
    }

    public QueryTable<ScopeRef, Scope> scopeTable() {
        return scopeTable;
    }
}
