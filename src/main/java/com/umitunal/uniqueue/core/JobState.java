package com.umitunal.uniqueue.core;

/**
 * Lifecycle states of a job.
 *
 * <pre>
 * PENDING -&gt; LEASED -&gt; SUCCEEDED | RETRYING | FAILED | PENDING (lease reclaimed)
 * RETRYING -&gt; PENDING (backoff elapsed)
 * PENDING | RETRYING -&gt; CANCELLED
 * </pre>
 */
public enum JobState {
    PENDING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    LEASED {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    RETRYING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    SUCCEEDED {
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
}
