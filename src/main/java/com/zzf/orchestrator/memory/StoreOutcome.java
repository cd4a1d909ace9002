package com.zzf.orchestrator.memory;

import java.util.Optional;

/**
 * Typed result of a store operation.
 */
public final class StoreOutcome<T> {
    public enum Status {
        OK,
        NOT_FOUND,
        INVALID,
        CAPACITY_EXCEEDED,
        IO_ERROR
    }

    private final Status status;
    private final T value;
    private final String message;

    private StoreOutcome(Status status, T value, String message) {
        this.status = status;
        this.value = value;
        this.message = message;
    }

    public static <T> StoreOutcome<T> ok(T value) {
        return new StoreOutcome<>(Status.OK, value, null);
    }

    public static <T> StoreOutcome<T> notFound(String id) {
        return new StoreOutcome<>(Status.NOT_FOUND, null, "Memory not found: " + id);
    }

    public static <T> StoreOutcome<T> invalid(String message) {
        return new StoreOutcome<>(Status.INVALID, null, message);
    }

    public static <T> StoreOutcome<T> capacityExceeded(int maxEntries) {
        return new StoreOutcome<>(Status.CAPACITY_EXCEEDED, null, "Memory is full (max_entries=" + maxEntries + ")");
    }

    public static <T> StoreOutcome<T> ioError(String message) {
        return new StoreOutcome<>(Status.IO_ERROR, null, message);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "StoreOutcome{" + status + (message == null ? "" : ", " + message) + "}";
    }
}
