package com.ryuqq.spreadfork.core.model;

import java.util.UUID;

/**
 * 포크 체크포인트 식별자.
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class CheckpointId {

    private final String value;

    private CheckpointId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CheckpointId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("CheckpointId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("CheckpointId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    public static CheckpointId of(String value) {
        return new CheckpointId(value);
    }

    public static CheckpointId generate() {
        return new CheckpointId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CheckpointId that = (CheckpointId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CheckpointId{" + value + '}';
    }
}
