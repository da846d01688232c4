package io.github.drompincen.clawwatch.runtime.listener.watcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawwatch.protocol.event.EventSource;
import io.github.drompincen.clawwatch.protocol.event.ListenerEvent;
import io.github.drompincen.clawwatch.protocol.event.ListenerEventType;
import io.github.drompincen.clawwatch.runtime.exec.Platform;
import io.github.drompincen.clawwatch.runtime.exec.ProcessResult;
import io.github.drompincen.clawwatch.runtime.exec.ProcessRunner;
import io.github.drompincen.clawwatch.runtime.listener.WatermarkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Watches open pull requests carrying a review label, using the {@code gh} CLI.
 */
public class CodeReviewWatcher implements Watcher {

    private static final Logger log = LoggerFactory.getLogger(CodeReviewWatcher.class);

    public static final String NAME = "code_review";
    static final int MAX_SEEN = 500;
    private static final Duration LIST_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration AUTH_TIMEOUT = Duration.ofSeconds(10);

    private final ProcessRunner processRunner;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String repo;
    private final String label;

    public CodeReviewWatcher(ProcessRunner processRunner, ObjectMapper mapper, Clock clock,
                             String repo, String label) {
        this.processRunner = processRunner;
        this.mapper = mapper;
        this.clock = clock;
        this.repo = repo;
        this.label = label;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        if (repo == null || repo.isBlank()) {
            return false;
        }
        if (!Platform.isOnPath("gh")) {
            return false;
        }
        return processRunner.run(List.of("gh", "auth", "status"), AUTH_TIMEOUT).exitCode() == 0;
    }

    @Override
    public List<ListenerEvent> poll(WatermarkStore store) {
        ProcessResult result = processRunner.run(List.of("gh", "pr", "list",
                "--repo", repo,
                "--label", label,
                "--state", "open",
                "--json", "number,title,url,body,author,labels"), LIST_TIMEOUT);
        if (!result.isSuccess() || result.stdout().isBlank()) {
            if (!result.isSuccess()) {
                log.warn("gh pr list failed (exit {}): {}", result.exitCode(), result.stderr());
            }
            return List.of();
        }

        JsonNode prs;
        try {
            prs = mapper.readTree(result.stdout());
        } catch (JsonProcessingException e) {
            log.warn("Unparsable gh output: {}", e.getOriginalMessage());
            return List.of();
        }
        if (prs == null || !prs.isArray()) {
            return List.of();
        }

        List<JsonNode> sorted = new ArrayList<>();
        prs.forEach(sorted::add);
        sorted.sort(Comparator.comparingLong(pr -> pr.path("number").asLong()));

        Set<Long> seen = new LinkedHashSet<>(store.getLongList(NAME, "seen_numbers"));
        List<ListenerEvent> events = new ArrayList<>();
        for (JsonNode pr : sorted) {
            long number = pr.path("number").asLong(0);
            if (number <= 0 || !seen.add(number)) continue;

            String title = pr.path("title").asText("");
            String author = pr.path("author").path("login").asText("");
            List<String> labels = new ArrayList<>();
            pr.path("labels").forEach(l -> labels.add(l.path("name").asText("")));

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("pr_number", number);
            metadata.put("pr_url", pr.path("url").asText(""));
            metadata.put("pr_title", title);
            metadata.put("pr_labels", labels);
            metadata.put("pr_author", author);
            metadata.put("repo", repo);

            events.add(new ListenerEvent(
                    EventSource.CODE_REVIEW,
                    ListenerEventType.CODE_REVIEW_REQUEST,
                    "Review PR #" + number + ": " + title,
                    author,
                    pr.path("body").asText(""),
                    clock.instant(),
                    String.valueOf(number),
                    metadata));
        }

        if (!events.isEmpty()) {
            List<Long> keep = new ArrayList<>(seen);
            if (keep.size() > MAX_SEEN) {
                keep = new ArrayList<>(keep.subList(keep.size() - MAX_SEEN, keep.size()));
            }
            store.set(NAME, "seen_numbers", keep);
            store.save();
            log.info("Code review: {} new pull request(s) in {}", events.size(), repo);
        }
        return events;
    }
}
