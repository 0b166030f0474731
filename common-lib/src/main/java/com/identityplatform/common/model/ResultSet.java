package com.identityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Results collected by the dispatcher for one orchestration request.
 *
 * <p>At most one {@link ServiceResult} per {@link ServiceId}. A missing entry means the call
 * had not returned when the overall deadline elapsed. Instances are immutable; they are
 * assembled through a {@link Builder} that concurrent completions write into.
 */
public final class ResultSet {

    private static final ResultSet EMPTY = new ResultSet(new EnumMap<>(ServiceId.class));

    private final Map<ServiceId, ServiceResult> results;

    private ResultSet(EnumMap<ServiceId, ServiceResult> results) {
        this.results = Collections.unmodifiableMap(results);
    }

    public static ResultSet empty() {
        return EMPTY;
    }

    public static ResultSet of(ServiceResult... results) {
        Builder builder = builder();
        for (ServiceResult result : results) {
            if (!builder.offer(result)) {
                throw new IllegalArgumentException("duplicate result for service " + result.serviceId());
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return the result for {@code serviceId}, or {@code null} when the service never answered */
    public ServiceResult get(ServiceId serviceId) {
        return results.get(serviceId);
    }

    public boolean contains(ServiceId serviceId) {
        return results.containsKey(serviceId);
    }

    public boolean isSuccessful(ServiceId serviceId) {
        ServiceResult result = results.get(serviceId);
        return result != null && result.isSuccess();
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public int successfulServices() {
        int count = 0;
        for (ServiceResult result : results.values()) {
            if (result.isSuccess()) count++;
        }
        return count;
    }

    @JsonValue
    public Map<ServiceId, ServiceResult> asMap() {
        return results;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultSet other)) return false;
        return results.equals(other.results);
    }

    @Override
    public int hashCode() {
        return results.hashCode();
    }

    @Override
    public String toString() {
        return "ResultSet" + results;
    }

    /**
     * Write-once slots, one per service, safe for concurrent completions.
     *
     * <p>The first result offered for a service wins. After {@link #build()} the builder is
     * frozen and late completions are rejected, so the built set never changes.
     */
    public static final class Builder {

        private final ConcurrentMap<ServiceId, ServiceResult> slots = new ConcurrentHashMap<>();
        private volatile boolean frozen;

        private Builder() {}

        /**
         * @return {@code true} if the result was stored; {@code false} if the slot was already
         *         taken or the builder is frozen
         */
        public boolean offer(ServiceResult result) {
            if (frozen) return false;
            return slots.putIfAbsent(result.serviceId(), result) == null;
        }

        public ResultSet build() {
            frozen = true;
            EnumMap<ServiceId, ServiceResult> copy = new EnumMap<>(ServiceId.class);
            copy.putAll(slots);
            return new ResultSet(copy);
        }
    }
}
