package com.buildsync.reconcile;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Mints ids for fields the target does not know yet: a random UUID without separators, cut to
 * {@value #LENGTH} characters. These never look like the target's own numeric ids.
 * <p>
 * One instance serves one reconciliation run. It is seeded with the target's existing ids and re-draws
 * whenever a token collides with a reserved or already minted id. Not thread-safe.
 */
public final class IdentifierMinter {

    public static final int LENGTH = 21;

    private final Set<String> taken;
    private final Supplier<String> tokenSource;

    public IdentifierMinter(Collection<String> reservedIds) {
        this(reservedIds, IdentifierMinter::randomToken);
    }

    IdentifierMinter(Collection<String> reservedIds, Supplier<String> tokenSource) {
        this.taken = reservedIds != null ? new HashSet<>(reservedIds) : new HashSet<>();
        this.tokenSource = Objects.requireNonNull(tokenSource, "tokenSource");
    }

    public String mint() {
        String id = tokenSource.get();
        while (!taken.add(id)) {
            id = tokenSource.get();
        }
        return id;
    }

    static String randomToken() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, LENGTH);
    }
}
