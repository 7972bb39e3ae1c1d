package com.handcoach.common.range;

/** Which preflop table seeds a range: raise-first-in or flatting an open. */
public enum RangeRole {
    OPEN, CALL
}
