package io.lapse4j.core;

public enum TaskStatus {
    PENDING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    RUNNING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    COMPLETED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    FAILED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    CANCELLED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();

    /**
     * Lower-case wire name ({@code "running"}, {@code "cancelled"}, ...).
     */
    public String wireName() {
        return name().toLowerCase();
    }
}
