package io.stelli.core.criteria;

/** Which end of a rating range an edit targets. */
public enum RangeBound {
    MIN,
    MAX
}
