package io.yasched.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.yasched.ActionHandler;
import io.yasched.Scheduler;
import io.yasched.actions.LogActionHandler;
import io.yasched.actions.PrintActionHandler;
import io.yasched.core.ActionHandlerRegistry;
import io.yasched.core.TaskDefinition;
import io.yasched.internal.PollingScheduler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot auto-configuration entrypoint for the scheduler.
 */
@AutoConfiguration
@ConditionalOnClass(Scheduler.class)
@EnableConfigurationProperties(YaschedProperties.class)
@ConditionalOnProperty(prefix = "yasched", name = "enabled", havingValue = "true", matchIfMissing = true)
public class YaschedConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock yaschedClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public PrintActionHandler printActionHandler() {
        return new PrintActionHandler();
    }

    @Bean
    @ConditionalOnMissingBean
    public LogActionHandler logActionHandler() {
        return new LogActionHandler();
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionHandlerRegistry actionHandlerRegistry(ObjectProvider<List<ActionHandler<?>>> handlersProvider,
                                                       ObjectProvider<ObjectMapper> objectMapperProvider) {
        List<ActionHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new ActionHandlerRegistry(handlers, objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    /**
     * Scheduler with the configured tasks registered. A bad task descriptor fails startup.
     */
    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(YaschedProperties props, ActionHandlerRegistry registry, Clock clock) {
        PollingScheduler scheduler = new PollingScheduler(registry, clock, props.getMatchWindow());
        for (YaschedProperties.Task task : props.getTasks()) {
            scheduler.register(toDefinition(task));
        }
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(Scheduler scheduler, YaschedProperties props) {
        return new SchedulerLifecycle(scheduler, props.getPollInterval(), props.isAutoStartup());
    }

    private static TaskDefinition toDefinition(YaschedProperties.Task task) {
        if (task.getName() == null || task.getName().isBlank()) {
            throw new IllegalArgumentException("yasched task is missing required field: 'name'");
        }
        if (task.getSchedule() == null) {
            throw new IllegalArgumentException("yasched task '" + task.getName() + "' is missing required field: 'schedule'");
        }
        if (task.getAction() == null) {
            throw new IllegalArgumentException("yasched task '" + task.getName() + "' is missing required field: 'action'");
        }
        Map<String, Object> parameters = task.getParameters() == null ? Map.of() : task.getParameters();
        return new TaskDefinition(
                task.getName(),
                task.getSchedule(),
                task.getAction(),
                task.getDescription(),
                task.isEnabled(),
                parameters
        );
    }
}
