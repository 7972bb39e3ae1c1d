package com.handcoach.common.hand;

/**
 * Drawing potential of a hand that has not yet seen the river.
 *
 * @param flushDraw  four to a flush with at least one hole card of that suit
 * @param openEnded  eight-out straight draw (or double gutter)
 * @param gutshot    four-out straight draw
 * @param overcards  hole cards ranked above every board card
 */
public record DrawProfile(boolean flushDraw, boolean openEnded, boolean gutshot, int overcards) {

    public static final DrawProfile NONE = new DrawProfile(false, false, false, 0);

    public boolean isStrongDraw() {
        return flushDraw || openEnded;
    }

    public boolean isWeakDraw() {
        return gutshot || overcards >= 2;
    }

    /** Approximate clean outs, overlapping flush and straight outs counted once. */
    public int outs() {
        int outs = 0;
        if (flushDraw) outs += 9;
        if (openEnded) outs += flushDraw ? 6 : 8;
        else if (gutshot) outs += flushDraw ? 3 : 4;
        if (!flushDraw && !openEnded) outs += overcards * 3;
        return outs;
    }
}
