package io.pulse4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A recurring content-generation job driven by a cron expression.
 *
 * <p>Definitions are created and edited by external actors through the store; the orchestrator
 * only writes the run-state fields ({@code nextRun}, {@code lastRun}, {@code lastStatus},
 * {@code lastError} and the counters).
 */
public record ScheduledJob(

        // identity
        String id,
        String name,

        // schedule
        String cronExpression,
        String timezone,
        boolean active,

        // execution linkage
        String templateRef,
        String userContext,
        Map<String, Object> variables,

        // run state
        Instant nextRun,
        Instant lastRun,
        RunStatus lastStatus,
        String lastError,
        long totalRuns,
        long successCount,
        long errorCount
) {

    public ScheduledJob {
        Objects.requireNonNull(id, "id must not be null");
        variables = (variables == null || variables.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /**
     * Display name, falling back to the id.
     */
    public String displayName() {
        return (name == null || name.isBlank()) ? id : name;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
                .name(name)
                .cronExpression(cronExpression)
                .timezone(timezone)
                .active(active)
                .templateRef(templateRef)
                .userContext(userContext)
                .variables(variables)
                .nextRun(nextRun)
                .lastRun(lastRun)
                .lastStatus(lastStatus)
                .lastError(lastError)
                .totalRuns(totalRuns)
                .successCount(successCount)
                .errorCount(errorCount);
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String cronExpression;
        private String timezone = "UTC";
        private boolean active = true;
        private String templateRef;
        private String userContext;
        private Map<String, Object> variables;
        private Instant nextRun;
        private Instant lastRun;
        private RunStatus lastStatus;
        private String lastError;
        private long totalRuns;
        private long successCount;
        private long errorCount;

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder templateRef(String templateRef) {
            this.templateRef = templateRef;
            return this;
        }

        public Builder userContext(String userContext) {
            this.userContext = userContext;
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables = variables;
            return this;
        }

        public Builder nextRun(Instant nextRun) {
            this.nextRun = nextRun;
            return this;
        }

        public Builder lastRun(Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        public Builder lastStatus(RunStatus lastStatus) {
            this.lastStatus = lastStatus;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder totalRuns(long totalRuns) {
            this.totalRuns = totalRuns;
            return this;
        }

        public Builder successCount(long successCount) {
            this.successCount = successCount;
            return this;
        }

        public Builder errorCount(long errorCount) {
            this.errorCount = errorCount;
            return this;
        }

        public ScheduledJob build() {
            return new ScheduledJob(id, name, cronExpression, timezone, active, templateRef, userContext,
                    variables, nextRun, lastRun, lastStatus, lastError, totalRuns, successCount, errorCount);
        }
    }
}
