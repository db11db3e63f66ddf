package com.example.podcast_backend.util;

public enum ExecutionTarget {
    /** Bounded executor inside this process. */
    INLINE,
    /** Dedicated worker host reached over authenticated HTTP. */
    REMOTE_WORKER,
    /** Durable task in the managed queue, delivered back to a worker endpoint. */
    MANAGED_QUEUE
}
