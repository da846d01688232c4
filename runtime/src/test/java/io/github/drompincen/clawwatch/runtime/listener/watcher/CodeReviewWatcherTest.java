package io.github.drompincen.clawwatch.runtime.listener.watcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawwatch.protocol.event.EventSource;
import io.github.drompincen.clawwatch.protocol.event.ListenerEvent;
import io.github.drompincen.clawwatch.protocol.event.ListenerEventType;
import io.github.drompincen.clawwatch.runtime.exec.ProcessResult;
import io.github.drompincen.clawwatch.runtime.exec.ProcessRunner;
import io.github.drompincen.clawwatch.runtime.listener.WatermarkStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CodeReviewWatcherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T14:30:00Z"), ZoneOffset.UTC);

    private static final String PRS = """
            [
              {"number": 42, "title": "Fix login redirect", "url": "https://github.com/acme/web/pull/42",
               "body": "Closes #40", "author": {"login": "dana"}, "labels": [{"name": "clawwatch-review"}]},
              {"number": 17, "title": "Bump deps", "url": "https://github.com/acme/web/pull/17",
               "body": "", "author": {"login": "renovate"}, "labels": []}
            ]
            """;

    @Mock private ProcessRunner processRunner;

    @TempDir Path dir;

    private WatermarkStore store;
    private CodeReviewWatcher watcher;

    @BeforeEach
    void setUp() {
        store = new WatermarkStore(dir.resolve("state.json"), CLOCK);
        watcher = new CodeReviewWatcher(processRunner, new ObjectMapper(), CLOCK, "acme/web", "clawwatch-review");
    }

    @Test
    void newPullRequests_becomeReviewRequests_inNumberOrder() {
        output(PRS);

        List<ListenerEvent> events = watcher.poll(store);

        assertThat(events).extracting(ListenerEvent::rawId).containsExactly("17", "42");
        ListenerEvent pr = events.get(1);
        assertThat(pr.source()).isEqualTo(EventSource.CODE_REVIEW);
        assertThat(pr.type()).isEqualTo(ListenerEventType.CODE_REVIEW_REQUEST);
        assertThat(pr.subject()).isEqualTo("Review PR #42: Fix login redirect");
        assertThat(pr.sender()).isEqualTo("dana");
        assertThat(pr.metadata())
                .containsEntry("pr_number", 42L)
                .containsEntry("pr_url", "https://github.com/acme/web/pull/42")
                .containsEntry("pr_author", "dana")
                .containsEntry("repo", "acme/web")
                .containsEntry("pr_labels", List.of("clawwatch-review"));
    }

    @Test
    void secondPoll_skipsSeenNumbers() {
        output(PRS);
        watcher.poll(store);

        assertThat(watcher.poll(store)).isEmpty();
        assertThat(store.getLongList(CodeReviewWatcher.NAME, "seen_numbers")).containsExactly(17L, 42L);
    }

    @Test
    void seenList_isCappedToMostRecent() {
        List<Long> seen = new ArrayList<>();
        for (long n = 1; n <= CodeReviewWatcher.MAX_SEEN; n++) seen.add(n);
        store.set(CodeReviewWatcher.NAME, "seen_numbers", seen);
        output("[{\"number\": 501, \"title\": \"t\", \"author\": {\"login\": \"x\"}}]");

        watcher.poll(store);

        List<Long> stored = store.getLongList(CodeReviewWatcher.NAME, "seen_numbers");
        assertThat(stored).hasSize(CodeReviewWatcher.MAX_SEEN);
        assertThat(stored.get(0)).isEqualTo(2L);
        assertThat(stored.get(stored.size() - 1)).isEqualTo(501L);
    }

    @Test
    void ghFailure_yieldsNoEvents() {
        when(processRunner.run(anyList(), any(Duration.class)))
                .thenReturn(new ProcessResult(1, "", "could not resolve to a Repository", false));

        assertThat(watcher.poll(store)).isEmpty();
        assertThat(store.getAll(CodeReviewWatcher.NAME)).isEmpty();
    }

    @Test
    void garbageOutput_yieldsNoEvents() {
        output("not json at all");

        assertThat(watcher.poll(store)).isEmpty();
    }

    @Test
    void withoutRepo_isUnavailable_andNeverRunsGh() {
        CodeReviewWatcher unconfigured = new CodeReviewWatcher(processRunner, new ObjectMapper(), CLOCK, "", "x");

        assertThat(unconfigured.isAvailable()).isFalse();
        verify(processRunner, never()).run(anyList(), any(Duration.class));
    }

    private void output(String stdout) {
        when(processRunner.run(anyList(), any(Duration.class))).thenReturn(new ProcessResult(0, stdout, "", false));
    }
}
