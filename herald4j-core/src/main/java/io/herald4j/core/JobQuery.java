package io.herald4j.core;

/**
 * JobQuery describes which stored records to match.
 *
 * <p>This is an API-layer object (NOT a MongoDB query). Every set field is an exact-match condition
 * and conditions are combined with AND. The store layer translates it into an actual database query.
 */
public final class JobQuery {

    private final String id;
    private final String destination;
    private final String scheduleName;
    private final Boolean completed;

    private JobQuery(String id, String destination, String scheduleName, Boolean completed) {
        this.id = blankToNull(id);
        this.destination = blankToNull(destination);
        this.scheduleName = blankToNull(scheduleName);
        this.completed = completed;
    }

    public String id() {
        return id;
    }

    public String destination() {
        return destination;
    }

    public String scheduleName() {
        return scheduleName;
    }

    /**
     * Null means "either".
     */
    public Boolean completed() {
        return completed;
    }

    public static JobQuery byId(String id) {
        return builder().id(id).build();
    }

    public static JobQuery pending() {
        return builder().completed(false).build();
    }

    public static JobQuery pendingIn(String destination) {
        return builder().destination(destination).completed(false).build();
    }

    public static JobQuery named(String destination, String scheduleName) {
        return builder().destination(destination).scheduleName(scheduleName).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "JobQuery{id=" + id + ", destination=" + destination + ", scheduleName=" + scheduleName
                + ", completed=" + completed + "}";
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    public static final class Builder {
        private String id;
        private String destination;
        private String scheduleName;
        private Boolean completed;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder destination(String destination) {
            this.destination = destination;
            return this;
        }

        public Builder scheduleName(String scheduleName) {
            this.scheduleName = scheduleName;
            return this;
        }

        public Builder completed(Boolean completed) {
            this.completed = completed;
            return this;
        }

        public JobQuery build() {
            JobQuery query = new JobQuery(id, destination, scheduleName, completed);
            if (query.id == null && query.destination == null && query.scheduleName == null && query.completed == null) {
                throw new IllegalStateException(
                        "JobQuery must contain at least one condition: id, destination, scheduleName, or completed"
                );
            }
            return query;
        }
    }
}
