package io.pockethive.httpmock.service;

import io.pockethive.httpmock.model.ExpectationViolation;
import io.pockethive.httpmock.model.MockDefinition;
import io.pockethive.httpmock.model.RecordedRequest;
import io.pockethive.httpmock.model.Scope;
import io.pockethive.httpmock.model.VerificationReport;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered set of active rules.
 * <p>
 * Rules are kept in mount order and searched newest first, so a specific rule mounted after a broad one
 * overrides it. A single lock guards mutation, lookup and the counter increment that follows a match.
 */
public final class MountTable {

    private static final Logger log = LoggerFactory.getLogger(MountTable.class);

    private final List<MockRule> rules = new ArrayList<>();
    private final Lock lock = new ReentrantLock();
    private final AtomicLong idSequence = new AtomicLong();
    private final Clock clock;
    private final MatcherFailureListener failureListener;

    public MountTable() {
        this(Clock.systemUTC(), MatcherFailureListener.NONE);
    }

    public MountTable(Clock clock, MatcherFailureListener failureListener) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.failureListener = Objects.requireNonNull(failureListener, "failureListener");
    }

    /**
     * Appends a rule at the most-recently-mounted position and assigns its id.
     */
    public MockRule mount(MockDefinition definition, Scope scope) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(scope, "scope");
        MockRule rule = new MockRule("rule-" + idSequence.incrementAndGet(), definition, scope, clock.instant());
        lock.lock();
        try {
            rules.add(rule);
        } finally {
            lock.unlock();
        }
        log.debug("Mounted {} rule {} ({})", scope, rule.id(), rule.description());
        return rule;
    }

    /**
     * Removes the rule with the given id. Unknown ids are ignored.
     */
    public Optional<MockRule> unmount(String id) {
        Objects.requireNonNull(id, "id");
        lock.lock();
        try {
            Iterator<MockRule> iterator = rules.iterator();
            while (iterator.hasNext()) {
                MockRule rule = iterator.next();
                if (rule.id().equals(id)) {
                    iterator.remove();
                    log.debug("Unmounted rule {} after {} call(s)", id, rule.callCount());
                    return Optional.of(rule);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the most recently mounted rule matching the request without touching its counter.
     */
    public Optional<MockRule> select(RecordedRequest request) {
        Objects.requireNonNull(request, "request");
        lock.lock();
        try {
            return Optional.ofNullable(findMatch(request));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Selects the responding rule and increments its counter as one step, so concurrent requests can never
     * lose an increment or hit a rule that is being unmounted.
     */
    public Optional<MockRule> selectAndRecord(RecordedRequest request) {
        Objects.requireNonNull(request, "request");
        lock.lock();
        try {
            MockRule rule = findMatch(request);
            if (rule != null) {
                rule.recordCall();
            }
            return Optional.ofNullable(rule);
        } finally {
            lock.unlock();
        }
    }

    public Optional<MockRule> find(String id) {
        lock.lock();
        try {
            return rules.stream().filter(rule -> rule.id().equals(id)).findFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of the mounted rules in mount order.
     */
    public List<MockRule> rules() {
        lock.lock();
        try {
            return List.copyOf(rules);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return rules.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Verifies every mounted rule and collects all violations.
     */
    public VerificationReport verifyAll() {
        List<MockRule> snapshot = rules();
        List<ExpectationViolation> violations = new ArrayList<>();
        for (MockRule rule : snapshot) {
            rule.verify().ifPresent(violations::add);
        }
        return new VerificationReport(snapshot.size(), violations);
    }

    /**
     * Removes every rule. Returns what was mounted.
     */
    public List<MockRule> clear() {
        lock.lock();
        try {
            List<MockRule> removed = List.copyOf(rules);
            rules.clear();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private MockRule findMatch(RecordedRequest request) {
        for (int i = rules.size() - 1; i >= 0; i--) {
            MockRule rule = rules.get(i);
            if (evaluate(rule, request)) {
                return rule;
            }
        }
        return null;
    }

    private boolean evaluate(MockRule rule, RecordedRequest request) {
        try {
            return rule.definition().matcher().matches(request);
        } catch (Exception | AssertionError ex) {
            // Fail closed: a matcher that cannot inspect the request does not match it.
            log.debug("Matcher of rule {} failed on {}; treating as no match: {}", rule.id(), request, ex.toString());
            failureListener.onMatcherFailure(rule, request, ex);
            return false;
        }
    }

    /**
     * Callback for matcher evaluation errors, used for metrics.
     */
    @FunctionalInterface
    public interface MatcherFailureListener {

        MatcherFailureListener NONE = (rule, request, error) -> { };

        void onMatcherFailure(MockRule rule, RecordedRequest request, Throwable error);
    }
}
