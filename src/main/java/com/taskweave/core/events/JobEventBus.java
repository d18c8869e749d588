package com.taskweave.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for job progress events.
 * <p>
 * Supports per-job subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe; workers of the same wave publish
 * concurrently.
 */
@Service
public class JobEventBus {

    private static final Logger log = LoggerFactory.getLogger(JobEventBus.class);

    /** Per-job subscribers keyed by jobId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<JobEvent>>> jobSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<JobEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to its job's subscribers, then to global subscribers.
     */
    public void publish(JobEvent event) {
        log.debug("Publishing event: {} for job {}", event.eventType(), event.jobId());

        List<Consumer<JobEvent>> jobSubs = jobSubscribers.get(event.jobId());
        if (jobSubs != null) {
            for (Consumer<JobEvent> subscriber : jobSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<JobEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific job.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String jobId, Consumer<JobEvent> consumer) {
        jobSubscribers.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to job {}", jobId);
        return () -> jobSubscribers.computeIfPresent(jobId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribe to events from all jobs.
     */
    public Subscription subscribeAll(Consumer<JobEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<JobEvent> subscriber, JobEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
