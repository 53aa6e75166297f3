package com.questrail.triggerware.subscription;

/**
 * Activation state of a {@link Subscription}.
 *
 * <pre>
 *   INACTIVE ──activate()────────→ ACTIVE ──deactivate()──────→ INACTIVE
 *   INACTIVE ──addToBatch()──────→ BATCH_MEMBER ──removeFromBatch()→ INACTIVE
 * </pre>
 */
public enum SubscriptionState
{
    INACTIVE,
    ACTIVE,
    BATCH_MEMBER
}
