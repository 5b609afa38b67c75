package org.pragmatica.sifter.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Mutable cursor over command tokens with a snapshot stack for trial parsing.
 *
 * <p>A snapshot captures both the cursor and the token sequence, so {@link #rollback()}
 * also reverts tokens spliced in by {@link #insert(String)} or {@link #replace(String)}.
 */
public final class TokenStream {

    private List<String> tokens;
    private int pos;

    private final Deque<Snapshot> snapshots;

    private record Snapshot(int pos, List<String> tokens) {}

    private TokenStream(List<String> tokens) {
        this.tokens = new ArrayList<>(tokens);
        this.pos = 0;
        this.snapshots = new ArrayDeque<>();
    }

    public static TokenStream of(List<String> tokens) {
        return new TokenStream(tokens);
    }

    public static TokenStream of(String... tokens) {
        return new TokenStream(List.of(tokens));
    }

    // === Cursor ===

    public int pos() {
        return pos;
    }

    public boolean isEnd() {
        return pos >= tokens.size();
    }

    public int remaining() {
        return tokens.size() - pos;
    }

    /**
     * Token at the cursor, empty at the end of the stream.
     */
    public Optional<String> current() {
        return isEnd()
               ? Optional.empty()
               : Optional.of(tokens.get(pos));
    }

    /**
     * Token at the cursor, or {@code null} at the end of the stream.
     */
    public String peek() {
        return isEnd()
               ? null
               : tokens.get(pos);
    }

    /**
     * Return the token at the cursor and advance past it. No-op at the end.
     */
    public Optional<String> consume() {
        if (isEnd()) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(pos++));
    }

    // === Token mutation ===

    /**
     * Splice a new token in at the cursor. It becomes the current token.
     */
    public void insert(String token) {
        tokens.add(pos, token);
    }

    /**
     * Overwrite the token at the cursor. At the end of the stream the token is appended.
     */
    public void replace(String token) {
        if (isEnd()) {
            tokens.add(token);
        } else {
            tokens.set(pos, token);
        }
    }

    public List<String> tokens() {
        return List.copyOf(tokens);
    }

    // === Snapshots ===

    public void snapshot() {
        snapshots.push(new Snapshot(pos, new ArrayList<>(tokens)));
    }

    /**
     * Keep the current state and discard the most recent snapshot.
     */
    public void commit() {
        requireSnapshot("commit");
        snapshots.pop();
    }

    /**
     * Restore cursor and tokens from the most recent snapshot and discard it.
     */
    public void rollback() {
        requireSnapshot("rollback");
        var snapshot = snapshots.pop();
        pos = snapshot.pos();
        tokens = snapshot.tokens();
    }

    public int depth() {
        return snapshots.size();
    }

    private void requireSnapshot(String operation) {
        if (snapshots.isEmpty()) {
            throw new IllegalStateException(operation + " without a matching snapshot at token " + pos);
        }
    }
}
