package org.finos.legend.querybuild.scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of named scopes, partitioned by {@link ScopeType}.
 *
 * Lookups share a read lock and never block one another; registration takes
 * the write lock, so it is serialized against all other access. Scopes may
 * therefore be registered while requests are being compiled on other
 * threads. Registering a name twice replaces the earlier scope.
 *
 * One registry belongs to one compiler; there is no process-wide registry.
 */
public final class ScopeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ScopeRegistry.class);

    private final Map<ScopeType, Map<String, Scope>> scopes = new EnumMap<>(ScopeType.class);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ScopeRegistry() {
        for (ScopeType type : ScopeType.values()) {
            scopes.put(type, new HashMap<>());
        }
    }

    /**
     * Registers a scope, replacing any scope already registered under the
     * same type and name.
     *
     * @param type  The scope category
     * @param name  The scope name
     * @param scope The transform
     * @return this registry for fluent API
     */
    public ScopeRegistry register(ScopeType type, String name, Scope scope) {
        Objects.requireNonNull(type, "Scope type cannot be null");
        Objects.requireNonNull(name, "Scope name cannot be null");
        Objects.requireNonNull(scope, "Scope cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("Scope name cannot be blank");
        }

        lock.writeLock().lock();
        try {
            Scope previous = scopes.get(type).put(name, scope);
            if (previous != null) {
                logger.debug("Replaced {} scope '{}'", type, name);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return this;
    }

    /**
     * Looks up a scope.
     *
     * @param type The scope category
     * @param name The scope name
     * @return Optional containing the scope if registered under that type
     */
    public Optional<Scope> lookup(ScopeType type, String name) {
        if (type == null || name == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(scopes.get(type).get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return Number of scopes registered under the given type
     */
    public int size(ScopeType type) {
        lock.readLock().lock();
        try {
            return scopes.get(type).size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
