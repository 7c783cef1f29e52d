package io.yasched.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the scheduler and the tasks it starts with.
 *
 * <pre>
 * yasched:
 *   poll-interval: 1s
 *   tasks:
 *     - name: example_task
 *       schedule: every 1 hour
 *       action: print
 *       parameters:
 *         message: Hello from yasched!
 * </pre>
 */
@ConfigurationProperties(prefix = "yasched")
public class YaschedProperties {
    private boolean enabled = true;
    private boolean autoStartup = true;
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration matchWindow = Duration.ofMinutes(1); // "at HH:MM" window
    private List<Task> tasks = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getMatchWindow() {
        return matchWindow;
    }

    public void setMatchWindow(Duration matchWindow) {
        this.matchWindow = matchWindow;
    }

    public List<Task> getTasks() {
        return tasks;
    }

    public void setTasks(List<Task> tasks) {
        this.tasks = tasks;
    }

    /**
     * One task descriptor.
     */
    public static class Task {
        private String name;
        private String schedule;
        private String action;
        private String description;
        private boolean enabled = true;
        private Map<String, Object> parameters = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public String getAction() {
            return action;
        }

        public void setAction(String action) {
            this.action = action;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, Object> getParameters() {
            return parameters;
        }

        public void setParameters(Map<String, Object> parameters) {
            this.parameters = parameters;
        }
    }
}
