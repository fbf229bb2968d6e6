package com.questrail.netconn.internal.op;

/**
 * States of a suspended operation.
 *
 * <p>{@link #WAITING} is the only non-terminal state. Exactly one trigger
 * (data available, close, end, error or timer) moves an operation out of it.</p>
 */
public enum OperationState
{
    WAITING,
    TIMED_OUT,
    RESOLVED,
    REJECTED;

    public boolean isTerminal() {
        return this != WAITING;
    }
}
