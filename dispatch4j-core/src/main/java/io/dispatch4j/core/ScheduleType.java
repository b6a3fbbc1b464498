package io.dispatch4j.core;

public enum ScheduleType {
    INTERVAL {
        @Override
        public boolean isTimed() {
            return true;
        }
    },
    CRON {
        @Override
        public boolean isTimed() {
            return true;
        }
    },
    ONE_TIME {
        @Override
        public boolean isTimed() {
            return true;
        }
    },
    EVENT {
        @Override
        public boolean isTimed() {
            return false;
        }
    },
    DEPENDENCY {
        @Override
        public boolean isTimed() {
            return false;
        }
    };

    /**
     * Whether the scheduler's timer fires this type; the others only fire on events or completions.
     */
    public abstract boolean isTimed();
}
