package io.remind4j.core;

public enum ScheduleKind {
    ONCE {
        @Override
        public boolean isRecurring() {
            return false;
        }
    },
    CRON {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    INTERVAL {
        @Override
        public boolean isRecurring() {
            return true;
        }
    };

    public abstract boolean isRecurring();
}
