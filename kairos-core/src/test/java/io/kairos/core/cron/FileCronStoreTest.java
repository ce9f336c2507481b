package io.kairos.core.cron;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCronStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnEmptyDocumentWhenFileMissing() throws Exception {
        FileCronStore store = new FileCronStore(tempDir.resolve("missing/jobs.json"));

        CronStoreDocument document = store.load();

        assertThat(document.version()).isEqualTo(CronStoreDocument.CURRENT_VERSION);
        assertThat(document.jobs()).isEmpty();
    }

    @Test
    void shouldWriteCamelCaseDocumentWithTaggedSchedules() throws Exception {
        Path path = tempDir.resolve("cron/jobs.json");
        FileCronStore store = new FileCronStore(path);
        CronJob cron = new CronJob(
            "abcd1234",
            "digest",
            true,
            CronSchedule.cron("0 9 * * 1-5", "Europe/Berlin"),
            CronPayload.delivered("morning digest", "telegram", "42"),
            new CronJobState(1_000L, 500L, JobStatus.ERROR, "timeout"),
            100,
            200,
            false
        );
        CronJob once = new CronJob("ef567890", "once", false, CronSchedule.at(5_000), null, null, 100, 100, true);

        store.save(CronStoreDocument.of(List.of(cron, once)));

        JsonNode root = new ObjectMapper().readTree(Files.readString(path));
        assertThat(root.path("version").asInt()).isEqualTo(1);
        JsonNode first = root.path("jobs").get(0);
        assertThat(first.path("schedule").path("kind").asText()).isEqualTo("cron");
        assertThat(first.path("schedule").path("expr").asText()).isEqualTo("0 9 * * 1-5");
        assertThat(first.path("schedule").path("tz").asText()).isEqualTo("Europe/Berlin");
        assertThat(first.path("payload").path("kind").asText()).isEqualTo("agent_turn");
        assertThat(first.path("payload").path("deliver").asBoolean()).isTrue();
        assertThat(first.path("state").path("nextRunAtMs").asLong()).isEqualTo(1_000L);
        assertThat(first.path("state").path("lastStatus").asText()).isEqualTo("error");
        assertThat(first.path("state").path("lastError").asText()).isEqualTo("timeout");
        assertThat(first.path("createdAtMs").asLong()).isEqualTo(100);
        assertThat(first.path("updatedAtMs").asLong()).isEqualTo(200);
        JsonNode second = root.path("jobs").get(1);
        assertThat(second.path("schedule").path("kind").asText()).isEqualTo("at");
        assertThat(second.path("schedule").path("atMs").asLong()).isEqualTo(5_000);
        assertThat(second.path("deleteAfterRun").asBoolean()).isTrue();

        CronStoreDocument reloaded = store.load();
        assertThat(reloaded.jobs()).containsExactly(cron, once);
    }

    @Test
    void shouldReadLegacyStatusMarkers() throws Exception {
        Path path = tempDir.resolve("jobs.json");
        Files.writeString(path, """
            {
              "version": 1,
              "jobs": [
                {
                  "id": "1234abcd",
                  "name": "legacy",
                  "enabled": true,
                  "schedule": {"kind": "every", "everyMs": 60000},
                  "payload": {"kind": "system_event", "message": "tick"},
                  "state": {"nextRunAtMs": 10, "lastStatus": "none"},
                  "createdAtMs": 1,
                  "updatedAtMs": 2,
                  "deleteAfterRun": false
                }
              ]
            }
            """);

        CronJob job = new FileCronStore(path).load().jobs().get(0);

        assertThat(job.schedule()).isEqualTo(CronSchedule.every(60_000));
        assertThat(job.payload().kind()).isEqualTo(CronPayload.SYSTEM_EVENT);
        assertThat(job.state().lastStatus()).isNull();
        assertThat(job.state().nextRunAtMs()).isEqualTo(10L);
    }

    @Test
    void shouldLoadDocumentsThatSpellOutEveryOptionalField() throws Exception {
        Path path = tempDir.resolve("jobs.json");
        Files.writeString(path, """
            {
              "version": 1,
              "jobs": [
                {
                  "id": "0a1b2c3d",
                  "name": "hourly",
                  "enabled": true,
                  "schedule": {"kind": "every", "atMs": null, "everyMs": 3600000, "expr": null, "tz": null},
                  "payload": {"kind": "agent_turn", "message": "check mail", "deliver": false, "channel": null, "to": null},
                  "state": {"nextRunAtMs": 1700000000000, "lastRunAtMs": null, "lastStatus": null, "lastError": null},
                  "createdAtMs": 1699990000000,
                  "updatedAtMs": 1699990000000,
                  "deleteAfterRun": false
                },
                {
                  "id": "4e5f6a7b",
                  "name": "launch",
                  "enabled": true,
                  "schedule": {"kind": "at", "atMs": 1800000000000, "everyMs": null, "expr": null, "tz": null},
                  "payload": {"kind": "system_event", "message": "go", "deliver": true, "channel": "slack", "to": "ops"},
                  "state": {"nextRunAtMs": 1800000000000, "lastRunAtMs": null, "lastStatus": null, "lastError": null},
                  "createdAtMs": 1699990000000,
                  "updatedAtMs": 1699990000000,
                  "deleteAfterRun": true
                },
                {
                  "id": "8c9d0e1f",
                  "name": "weekday",
                  "enabled": false,
                  "schedule": {"kind": "cron", "atMs": null, "everyMs": null, "expr": "0 0 9 * * 2-6", "tz": null},
                  "payload": {"kind": "agent_turn", "message": "standup", "deliver": false, "channel": null, "to": null},
                  "state": {"nextRunAtMs": null, "lastRunAtMs": 1699000000000, "lastStatus": "ok", "lastError": null},
                  "createdAtMs": 1698000000000,
                  "updatedAtMs": 1699000000000,
                  "deleteAfterRun": false
                }
              ]
            }
            """);

        List<CronJob> jobs = new FileCronStore(path).load().jobs();

        assertThat(jobs).extracting(CronJob::id).containsExactly("0a1b2c3d", "4e5f6a7b", "8c9d0e1f");
        assertThat(jobs.get(0).schedule()).isEqualTo(CronSchedule.every(3_600_000));
        assertThat(jobs.get(0).payload().channel()).isNull();
        assertThat(jobs.get(1).schedule()).isEqualTo(CronSchedule.at(1_800_000_000_000L));
        assertThat(jobs.get(1).payload().to()).isEqualTo("ops");
        assertThat(jobs.get(2).schedule()).isEqualTo(CronSchedule.cron("0 0 9 * * 2-6"));
        assertThat(jobs.get(2).state().lastStatus()).isEqualTo(JobStatus.OK);
    }

    @Test
    void shouldFailOnMalformedDocument() throws Exception {
        Path path = tempDir.resolve("jobs.json");
        Files.writeString(path, "{\"version\": 1, \"jobs\": [ {\"id\": \"x\", \"schedule\": {\"kind\": \"weekly\"}} ]}");

        assertThatThrownBy(() -> new FileCronStore(path).load()).isInstanceOf(IOException.class);
    }
}
