package io.herald4j.core;

public enum TriggerType {
    INTERVAL {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    FIRE_AT {
        @Override
        public boolean isRecurring() {
            return false;
        }
    };

    public abstract boolean isRecurring();
}
