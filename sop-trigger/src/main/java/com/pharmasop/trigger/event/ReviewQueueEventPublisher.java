package com.pharmasop.trigger.event;

import com.pharmasop.domain.audit.model.entity.AuditEntryEntity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * 复核队列发布器：需要人工复核的审计条目在提交后分发给进程内订阅者。
 */
@Slf4j
@Component
public class ReviewQueueEventPublisher {

    private final ConcurrentMap<String, Consumer<AuditEntryEntity>> subscribers = new ConcurrentHashMap<>();
    private final Counter publishCounter;

    public ReviewQueueEventPublisher() {
        this.publishCounter = Counter.builder("sop.audit.review_queue.publish.total").register(Metrics.globalRegistry);
    }

    public void publish(AuditEntryEntity entry) {
        if (entry == null || !Boolean.TRUE.equals(entry.getRequiresReview())) {
            return;
        }
        publishCounter.increment();
        log.info("REVIEW_QUEUE entryId={}, resourceType={}, resourceId={}, action={}, severity={}, actor={}",
                entry.getId(),
                entry.getResourceType(),
                entry.getResourceId(),
                entry.getAction() == null ? null : entry.getAction().getCode(),
                entry.getSeverity() == null ? null : entry.getSeverity().getCode(),
                entry.getActor());
        for (Map.Entry<String, Consumer<AuditEntryEntity>> subscriber : subscribers.entrySet()) {
            try {
                subscriber.getValue().accept(entry);
            } catch (Exception ex) {
                log.warn("Review queue dispatch failed. entryId={}, subscriberId={}, error={}",
                        entry.getId(), subscriber.getKey(), ex.getMessage());
            }
        }
    }

    public void subscribe(String subscriberId, Consumer<AuditEntryEntity> consumer) {
        if (subscriberId == null || consumer == null) {
            return;
        }
        subscribers.put(subscriberId, consumer);
    }

    public void unsubscribe(String subscriberId) {
        if (subscriberId == null) {
            return;
        }
        subscribers.remove(subscriberId);
    }
}
