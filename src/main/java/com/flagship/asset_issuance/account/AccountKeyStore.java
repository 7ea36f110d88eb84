package com.flagship.asset_issuance.account;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide binding of roles to keypairs.
 *
 * Writers run under one lock. Account setup holds it for its whole
 * duration ({@link #withLock}), so two concurrent setups cannot both
 * generate and fund an account for the same unbound role: the second one
 * sees the keys bound by the first.
 *
 * Reads never take the lock. Setup keeps it across faucet calls, which can
 * take seconds, and issuance or balance lookups must not queue behind that.
 *
 * {@link #bind} is last-writer-wins. A role is rebound only by an explicit
 * call; nothing overwrites a binding implicitly. Keys are not persisted and
 * are lost when the process exits.
 */
@Component
public class AccountKeyStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Role, AccountKeys> keys = new ConcurrentHashMap<>();

    public Optional<AccountKeys> find(Role role) {
        return Optional.ofNullable(keys.get(role));
    }

    /**
     * Binds {@code accountKeys} to {@code role}, replacing any previous binding.
     */
    public void bind(Role role, AccountKeys accountKeys) {
        lock.lock();
        try {
            keys.put(role, accountKeys);
        } finally {
            lock.unlock();
        }
    }

    public boolean isBound(Role role) {
        return find(role).isPresent();
    }

    /**
     * Runs {@code action} while holding the store lock. Reentrant, so the
     * action may call {@link #find} and {@link #bind}.
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
