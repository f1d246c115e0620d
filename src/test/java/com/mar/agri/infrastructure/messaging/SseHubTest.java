package com.mar.agri.infrastructure.messaging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mar.agri.domain.model.TrainingProgress;

import static org.assertj.core.api.Assertions.assertThat;

class SseHubTest {

    private final SseHub hub = new SseHub(new ObjectMapper());

    @AfterEach
    void tearDown() {
        hub.shutdown();
    }

    @Test
    void lastPayloadIsKeptPerJob() {
        assertThat(hub.getLast("train-1")).isEqualTo("{}");

        hub.publish("train-1", "progress",
            new TrainingProgress(1, 2, "Onion", TrainingProgress.Status.TRAINED, "accuracy 97.00%"));
        hub.emit("train-2", "summary", "{\"trained\":0}");

        assertThat(hub.getLast("train-1")).contains("\"commodity\":\"Onion\"").contains("\"status\":\"TRAINED\"");
        assertThat(hub.getLast("train-2")).isEqualTo("{\"trained\":0}");
    }

    @Test
    void completedJobStillAnswersWithItsLastEvent() {
        hub.emit("train-3", "summary", "{\"trained\":5}");
        hub.complete("train-3");

        assertThat(hub.getLast("train-3")).isEqualTo("{\"trained\":5}");
    }

    @Test
    void onlyTheMostRecentFinishedJobsKeepTheirEvents() {
        for (int i = 0; i <= SseHub.RETAINED_JOBS; i++) {
            hub.emit("job-" + i, "summary", "{\"n\":" + i + "}");
            hub.complete("job-" + i);
        }

        assertThat(hub.getLast("job-0")).isEqualTo("{}");
        assertThat(hub.getLast("job-1")).isEqualTo("{\"n\":1}");
        assertThat(hub.getLast("job-" + SseHub.RETAINED_JOBS)).isEqualTo("{\"n\":" + SseHub.RETAINED_JOBS + "}");
    }

    @Test
    void runningJobsAreNeverEvicted() {
        hub.emit("running", "progress", "{\"index\":1}");
        for (int i = 0; i < SseHub.RETAINED_JOBS * 2; i++) {
            hub.emit("job-" + i, "summary", "{}");
            hub.complete("job-" + i);
        }

        assertThat(hub.getLast("running")).isEqualTo("{\"index\":1}");
    }

    @Test
    void connectReturnsAnEmitterForLateSubscribers() {
        hub.emit("train-4", "progress", "{\"index\":1}");
        assertThat(hub.connect("train-4")).isNotNull();
    }
}
