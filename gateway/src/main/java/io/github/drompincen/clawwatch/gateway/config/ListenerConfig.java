package io.github.drompincen.clawwatch.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawwatch.persistence.repository.ScheduledTaskRepository;
import io.github.drompincen.clawwatch.runtime.exec.AppleScriptRunner;
import io.github.drompincen.clawwatch.runtime.exec.ProcessRunner;
import io.github.drompincen.clawwatch.runtime.listener.EventListener;
import io.github.drompincen.clawwatch.runtime.listener.ListenerPollScheduler;
import io.github.drompincen.clawwatch.runtime.listener.WatermarkStore;
import io.github.drompincen.clawwatch.runtime.listener.watcher.CalendarWatcher;
import io.github.drompincen.clawwatch.runtime.listener.watcher.CodeReviewWatcher;
import io.github.drompincen.clawwatch.runtime.listener.watcher.MailWatcher;
import io.github.drompincen.clawwatch.runtime.listener.watcher.MessageWatcher;
import io.github.drompincen.clawwatch.runtime.listener.watcher.NotificationWatcher;
import io.github.drompincen.clawwatch.runtime.listener.watcher.Watcher;
import io.github.drompincen.clawwatch.runtime.router.AgentRunner;
import io.github.drompincen.clawwatch.runtime.router.ClassificationParser;
import io.github.drompincen.clawwatch.runtime.router.ClassifierBackend;
import io.github.drompincen.clawwatch.runtime.router.EventRouter;
import io.github.drompincen.clawwatch.runtime.router.KeywordClassifier;
import io.github.drompincen.clawwatch.runtime.scheduler.MongoTaskStore;
import io.github.drompincen.clawwatch.runtime.scheduler.TaskStore;
import io.github.drompincen.clawwatch.tools.CreateReminderTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;

@Configuration
@ConditionalOnProperty(prefix = "clawwatch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ListenerConfig {

    private static final Logger log = LoggerFactory.getLogger(ListenerConfig.class);

    @Bean
    Clock listenerClock(ListenerProperties properties) {
        return Clock.system(properties.resolveZone());
    }

    @Bean
    WatermarkStore watermarkStore(ListenerProperties properties, Clock listenerClock) {
        return new WatermarkStore(Path.of(properties.getStatePath()), listenerClock);
    }

    @Bean
    ProcessRunner processRunner() {
        return new ProcessRunner();
    }

    @Bean
    AppleScriptRunner appleScriptRunner(ProcessRunner processRunner) {
        return new AppleScriptRunner(processRunner);
    }

    @Bean
    CreateReminderTool createReminderTool(AppleScriptRunner appleScriptRunner) {
        CreateReminderTool tool = new CreateReminderTool();
        tool.setAppleScriptRunner(appleScriptRunner);
        return tool;
    }

    @Bean
    @ConditionalOnProperty(prefix = "clawwatch.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    TaskStore taskStore(ScheduledTaskRepository scheduledTaskRepository) {
        return new MongoTaskStore(scheduledTaskRepository);
    }

    @Bean
    EventRouter eventRouter(ObjectProvider<ClassifierBackend> classifierBackend,
                            ObjectProvider<AgentRunner> agentRunner,
                            ObjectProvider<TaskStore> taskStore,
                            CreateReminderTool createReminderTool,
                            ObjectMapper objectMapper,
                            ListenerProperties properties,
                            Clock listenerClock) {
        ClassifierBackend classifier = classifierBackend.getIfAvailable();
        if (classifier == null) {
            log.info("No classifier API key configured, events are classified by keywords");
        }
        return new EventRouter(
                classifier,
                new ClassificationParser(objectMapper),
                new KeywordClassifier(),
                createReminderTool,
                agentRunner.getIfAvailable(),
                taskStore.getIfAvailable(),
                properties.getReminders().getListName(),
                listenerClock);
    }

    @Bean
    EventListener eventListener(WatermarkStore watermarkStore, EventRouter eventRouter,
                                ProcessRunner processRunner, AppleScriptRunner appleScriptRunner,
                                ObjectMapper objectMapper, ListenerProperties properties, Clock listenerClock) {
        EventListener listener = new EventListener(watermarkStore, eventRouter);
        for (String name : properties.getWatchers()) {
            createWatcher(name, processRunner, appleScriptRunner, objectMapper, properties, listenerClock)
                    .ifPresent(listener::addWatcher);
        }
        log.info("Listener ready with watchers {}, polling every {}s",
                listener.getWatcherNames(), properties.getPollInterval());
        return listener;
    }

    @Bean
    ListenerPollScheduler listenerPollScheduler(EventListener eventListener) {
        return new ListenerPollScheduler(eventListener);
    }

    static Optional<Watcher> createWatcher(String name, ProcessRunner processRunner,
                                           AppleScriptRunner appleScriptRunner, ObjectMapper objectMapper,
                                           ListenerProperties properties, Clock clock) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case CalendarWatcher.NAME -> Optional.of(new CalendarWatcher(appleScriptRunner, clock,
                    ZoneId.systemDefault(), properties.getCalendar().getUpcomingMinutes()));
            case MailWatcher.NAME -> Optional.of(new MailWatcher(appleScriptRunner, clock, ZoneId.systemDefault(),
                    properties.getMail().getMailbox(), properties.getMail().getLimit()));
            case MessageWatcher.NAME -> Optional.of(new MessageWatcher(Path.of(properties.getMessages().getDbPath())));
            case NotificationWatcher.NAME -> Optional.of(new NotificationWatcher(processRunner, objectMapper, clock,
                    ZoneId.systemDefault()));
            case CodeReviewWatcher.NAME -> Optional.of(new CodeReviewWatcher(processRunner, objectMapper, clock,
                    properties.getCodeReview().getRepo(), properties.getCodeReview().getLabel()));
            default -> {
                log.warn("Unknown watcher '{}' in clawwatch.watchers, ignoring", name);
                yield Optional.empty();
            }
        };
    }
}
