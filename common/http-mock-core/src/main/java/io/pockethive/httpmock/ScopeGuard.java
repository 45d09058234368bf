package io.pockethive.httpmock;

import io.pockethive.httpmock.model.VerificationReport;
import io.pockethive.httpmock.service.MockRule;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Handle of a rule mounted with {@link io.pockethive.httpmock.model.Scope#SCOPED}.
 * <p>
 * The rule stays mounted until {@link #release()} is called; releasing unmounts it and verifies its expectation
 * on the spot. Use it with try-with-resources to tie the rule to one phase of a test:
 * <pre>{@code
 * try (ScopeGuard guard = server.mountScoped(definition)) {
 *     client.call();
 * } // unmounted and verified here; throws ExpectationViolationException on a violation
 * }</pre>
 * A guard that is never released leaves its rule to the verification pass of {@link MockServer#stop()}.
 */
public final class ScopeGuard extends RuleHandle implements AutoCloseable {

    private final Lock lock = new ReentrantLock();
    private VerificationReport result;

    ScopeGuard(MockServer server, MockRule rule) {
        super(server, rule);
    }

    /**
     * Unmounts the rule and verifies it. Later calls return the first result and change nothing.
     */
    public VerificationReport release() {
        lock.lock();
        try {
            if (result == null) {
                server.unmount(rule.id());
                result = verify();
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public boolean isReleased() {
        lock.lock();
        try {
            return result != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the guard and throws {@link ExpectationViolationException} if the rule's expectation was violated.
     */
    @Override
    public void close() {
        release().assertSatisfied();
    }
}
