package com.studio.access.exception;

/**
 * Internal reason a presented secret was refused. Only logged; callers always see the
 * same "invalid or already used" answer.
 */
public enum RejectionReason {
    NOT_FOUND,
    OUTSIDE_WINDOW,
    INACTIVE,
    ALREADY_CONSUMED
}
