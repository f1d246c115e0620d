package com.mar.agri.infrastructure.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Server-sent events for background training jobs.
 *
 * One emitter per job id, a small replay buffer so a client that subscribes after the job
 * started still sees earlier progress, and periodic heartbeats so idle proxies keep the stream open.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SseHub {
    private static final int REPLAY_LIMIT = 64;
    private static final long HEARTBEAT_SECS = 10;
    private static final long STREAM_TIMEOUT_MINUTES = 30;
    // finished jobs whose last events stay queryable; older ones are evicted
    static final int RETAINED_JOBS = 16;

    private final ObjectMapper objectMapper;

    private final Map<String, SseEmitter> emitters = new ConcurrentHashMap<>();
    private final Map<String, Deque<Event>> buffers = new ConcurrentHashMap<>();
    private final Deque<String> finished = new ArrayDeque<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @PostConstruct
    void startHeartbeat() {
        scheduler.scheduleAtFixedRate(this::heartbeatAll, HEARTBEAT_SECS, HEARTBEAT_SECS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
    }

    public SseEmitter connect(String jobId) {
        var emitter = new SseEmitter(Duration.ofMinutes(STREAM_TIMEOUT_MINUTES).toMillis());
        emitter.onTimeout(() -> emitters.remove(jobId));
        emitter.onCompletion(() -> emitters.remove(jobId));
        emitters.put(jobId, emitter);

        var buf = buffers.get(jobId);
        if (buf != null) {
            synchronized (buf) {
                for (var ev : buf) {
                    try {
                        emitter.send(SseEmitter.event().name(ev.name()).data(ev.data(), MediaType.APPLICATION_JSON));
                    } catch (IOException e) {
                        log.warn("SSE replay failed for {}: {}", jobId, e.getMessage());
                        break;
                    }
                }
            }
        }
        return emitter;
    }

    /** Payload of the most recent event for the job, or an empty JSON object. */
    public String getLast(String jobId) {
        var buf = buffers.get(jobId);
        if (buf == null) return "{}";
        synchronized (buf) {
            var last = buf.peekLast();
            return last != null ? last.data() : "{}";
        }
    }

    /** Serializes {@code payload} to JSON and publishes it under {@code eventType}. */
    public void publish(String jobId, String eventType, Object payload) {
        String data;
        try {
            data = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("SSE could not serialize {} event for {}: {}", eventType, jobId, e.getMessage());
            return;
        }
        emit(jobId, eventType, data);
    }

    public void emit(String jobId, String eventType, String data) {
        var buf = buffers.computeIfAbsent(jobId, k -> new ArrayDeque<>(REPLAY_LIMIT));
        synchronized (buf) {
            if (buf.size() == REPLAY_LIMIT) buf.removeFirst();
            buf.addLast(new Event(eventType, data));
        }

        var em = emitters.get(jobId);
        if (em == null) return;
        try {
            em.send(SseEmitter.event().name(eventType).data(data, MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            log.warn("SSE send failed for {}: {}", jobId, e.getMessage());
            emitters.remove(jobId);
        }
    }

    /**
     * Sends a final {@code done} event after a short delay so the last payload flushes first.
     * The replay buffer is kept so {@link #getLast} still answers once the stream is closed,
     * up to the {@value #RETAINED_JOBS} most recently finished jobs.
     */
    public void complete(String jobId) {
        retire(jobId);
        scheduler.schedule(() -> {
            var em = emitters.remove(jobId);
            if (em == null) return;
            try {
                em.send(SseEmitter.event().name("done").data("{}", MediaType.APPLICATION_JSON));
                em.complete();
            } catch (IOException | IllegalStateException e) {
                log.debug("SSE completion for {} failed: {}", jobId, e.getMessage());
                em.completeWithError(e);
            }
        }, 500, TimeUnit.MILLISECONDS);
    }

    private void retire(String jobId) {
        synchronized (finished) {
            finished.remove(jobId);
            finished.addLast(jobId);
            while (finished.size() > RETAINED_JOBS) {
                String evicted = finished.removeFirst();
                buffers.remove(evicted);
                log.debug("SSE evicted replay buffer for {}", evicted);
            }
        }
    }

    private void heartbeatAll() {
        emitters.forEach((jobId, em) -> {
            try {
                em.send(SseEmitter.event().name("heartbeat").data("{}", MediaType.APPLICATION_JSON));
            } catch (IOException e) {
                log.debug("SSE heartbeat failed for {}: {}", jobId, e.getMessage());
                emitters.remove(jobId);
            }
        });
    }

    private record Event(String name, String data) {}
}
