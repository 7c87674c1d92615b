package com.feedwatch.domain.model;

import java.util.Objects;

/**
 * Composite identity of one scheduled task: entity, credential and slot time.
 *
 * <p>{@link #toString()} renders the legacy textual id
 * {@code {entityId}-{credentialIndex}-{HH:MM[:SS]}} used in logs and the stats API.
 * Slots that collide on that id get an ordinal suffix, see {@link #of(String, TimeSlot, int)}.
 */
public record TaskKey(String entityId, int credentialIndex, String slot) {

    /** Slot label used for operator-initiated runs that bypass the clock. */
    public static final String MANUAL_SLOT = "manual";

    public TaskKey {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(slot, "slot");
    }

    public static TaskKey of(String entityId, TimeSlot timeSlot) {
        return new TaskKey(entityId, timeSlot.getCredentialIndex(), timeSlot.label());
    }

    /**
     * Key for a slot that shares its minute and credential with an earlier slot of the
     * same entity. The slot part becomes {@code HH:MM#ordinal}, ordinal being the slot's
     * position in the allocation.
     */
    public static TaskKey of(String entityId, TimeSlot timeSlot, int ordinal) {
        return new TaskKey(entityId, timeSlot.getCredentialIndex(), timeSlot.label() + "#" + ordinal);
    }

    public static TaskKey manual(String entityId, int credentialIndex) {
        return new TaskKey(entityId, credentialIndex, MANUAL_SLOT);
    }

    public boolean belongsTo(String candidateEntityId) {
        return entityId.equals(candidateEntityId);
    }

    @Override
    public String toString() {
        return entityId + "-" + credentialIndex + "-" + slot;
    }
}
