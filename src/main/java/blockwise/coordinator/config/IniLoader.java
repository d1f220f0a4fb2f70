package blockwise.coordinator.config;

import blockwise.coordinator.model.Roi;
import blockwise.coordinator.model.Task;
import blockwise.coordinator.model.TaskConfig;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads scheduler and task settings from an INI file.
 * <p>
 * Sections:
 * <pre>
 * [scheduler]
 * max_workers = 8
 * max_retries = 1
 * db_url = jdbc:h2:file:./data/blockwise
 * progress_interval_ms = 2000
 *
 * [task.predict]
 * total_offset = 0
 * total_shape = 4096000
 * block_shape = 16384
 * context = 0
 * num_workers = 4
 * max_retries = 2
 * read_write_conflict = false
 * requires = upstream_id, other_id
 * </pre>
 * Shapes are comma-separated, one value per dimension.
 */
public final class IniLoader {

    private static final Logger log = LoggerFactory.getLogger(IniLoader.class);

    static final String SCHEDULER_SECTION = "scheduler";
    static final String TASK_PREFIX = "task.";

    private IniLoader() {
    }

    public static LoadedConfig load(File file) throws IOException {
        LoadedConfig loaded = parse(new Ini(file));
        log.info("Loaded {} task config(s) from {}", loaded.taskConfigs().size(), file);
        return loaded;
    }

    public static LoadedConfig load(Reader reader) throws IOException {
        return parse(new Ini(reader));
    }

    public static LoadedConfig parse(String text) {
        try {
            return load(new StringReader(text));
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable INI text", e);
        }
    }

    private static LoadedConfig parse(Ini ini) {
        SchedulerConfig scheduler = SchedulerConfig.defaults();
        Profile.Section s = ini.get(SCHEDULER_SECTION);
        if (s != null) {
            String workers = opt(s, "max_workers");
            if (workers != null) {
                scheduler.withMaxTotalWorkers(toInt(s, "max_workers", workers));
            }
            String defaultWorkers = opt(s, "num_workers");
            if (defaultWorkers != null) {
                scheduler.withDefaultNumWorkers(toInt(s, "num_workers", defaultWorkers));
            }
            String retries = opt(s, "max_retries");
            if (retries != null) {
                scheduler.withDefaultMaxRetries(toInt(s, "max_retries", retries));
            }
            String dbUrl = opt(s, "db_url");
            if (dbUrl != null) {
                scheduler.withDatabaseUrl(dbUrl);
            }
            String progressMs = opt(s, "progress_interval_ms");
            if (progressMs != null) {
                scheduler.withProgressInterval(Duration.ofMillis(toInt(s, "progress_interval_ms", progressMs)));
            }
        }

        Map<String, TaskSection> tasks = new LinkedHashMap<>();
        for (String name : ini.keySet()) {
            if (!name.startsWith(TASK_PREFIX)) {
                continue;
            }
            String taskId = name.substring(TASK_PREFIX.length()).trim();
            if (taskId.isEmpty()) {
                throw new IllegalArgumentException("Section [" + name + "] has no task id");
            }
            tasks.put(taskId, taskSection(taskId, ini.get(name), scheduler));
        }
        return new LoadedConfig(scheduler, tasks);
    }

    private static TaskSection taskSection(String taskId, Profile.Section s, SchedulerConfig scheduler) {
        String blockShape = opt(s, "block_shape");
        if (blockShape == null) {
            throw new IllegalArgumentException("[task." + taskId + "] is missing block_shape");
        }
        long[] shape = toLongs(s, "block_shape", blockShape);
        String context = opt(s, "context");

        TaskConfig config = TaskConfig.builder()
                .blockShape(shape)
                .context(context != null ? toLongs(s, "context", context) : new long[shape.length])
                .numWorkers(toInt(s, "num_workers", opt(s, "num_workers",
                        String.valueOf(scheduler.defaultNumWorkers()))))
                .maxRetries(toInt(s, "max_retries", opt(s, "max_retries",
                        String.valueOf(scheduler.defaultMaxRetries()))))
                .readWriteConflict(Boolean.parseBoolean(opt(s, "read_write_conflict", "false")))
                .build();

        Roi total = null;
        String totalShape = opt(s, "total_shape");
        if (totalShape != null) {
            long[] tshape = toLongs(s, "total_shape", totalShape);
            String totalOffset = opt(s, "total_offset");
            long[] toffset = totalOffset != null ? toLongs(s, "total_offset", totalOffset) : new long[tshape.length];
            total = Roi.of(toffset, tshape);
        }

        List<String> requires = new ArrayList<>();
        String req = opt(s, "requires");
        if (req != null) {
            for (String part : req.split(",")) {
                if (!part.isBlank()) {
                    requires.add(part.trim());
                }
            }
        }
        return new TaskSection(config, total, Collections.unmodifiableList(requires));
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) {
            return null;
        }
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }

    private static int toInt(Profile.Section s, String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("[" + s.getName() + "] " + key + " is not a number: " + value, e);
        }
    }

    private static long[] toLongs(Profile.Section s, String key, String value) {
        try {
            return Arrays.stream(value.split(","))
                    .map(String::trim)
                    .mapToLong(Long::parseLong)
                    .toArray();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("[" + s.getName() + "] " + key + " is not a shape: " + value, e);
        }
    }

    /** One {@code [task.<id>]} section. {@code totalRoi} is null when not given. */
    public record TaskSection(TaskConfig config, Roi totalRoi, List<String> requires) {
    }

    /**
     * Everything read from one INI file.
     */
    public static final class LoadedConfig {
        private final SchedulerConfig scheduler;
        private final Map<String, TaskSection> tasks;

        LoadedConfig(SchedulerConfig scheduler, Map<String, TaskSection> tasks) {
            this.scheduler = scheduler;
            this.tasks = Collections.unmodifiableMap(tasks);
        }

        public SchedulerConfig scheduler() {
            return scheduler;
        }

        public Map<String, TaskSection> taskSections() {
            return tasks;
        }

        public Map<String, TaskConfig> taskConfigs() {
            Map<String, TaskConfig> configs = new LinkedHashMap<>();
            tasks.forEach((id, section) -> configs.put(id, section.config()));
            return configs;
        }

        /**
         * Builder for a configured task with id, config, total region and
         * upstream ids filled in. The caller supplies the process function.
         */
        public Task.Builder taskBuilder(String taskId) {
            TaskSection section = tasks.get(taskId);
            if (section == null) {
                throw new IllegalArgumentException("No [task." + taskId + "] section");
            }
            Task.Builder builder = Task.builder()
                    .id(taskId)
                    .config(section.config())
                    .requires(section.requires().toArray(new String[0]));
            if (section.totalRoi() != null) {
                builder.totalRoi(section.totalRoi());
            }
            return builder;
        }
    }
}
