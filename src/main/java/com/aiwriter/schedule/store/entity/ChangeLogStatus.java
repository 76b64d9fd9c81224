package com.aiwriter.schedule.store.entity;

/**
 * =====================================================================
 * ChangeLogStatus
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Lifecycle of a change-log row on its way to the change feed.
 *
 *   PENDING ──publish ok──▶ PUBLISHED
 *      │
 *      └──retries exhausted──▶ FAILED
 *
 * Only PENDING rows are picked up by the relay. PUBLISHED and FAILED are
 * terminal; a FAILED row needs an operator to reset it to PENDING.
 */
public enum ChangeLogStatus {
    PENDING,
    PUBLISHED,
    FAILED
}
