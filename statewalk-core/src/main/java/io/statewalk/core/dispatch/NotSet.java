package io.statewalk.core.dispatch;

/// Value reported by read tools for attributes that have no value yet.
public enum NotSet {
    NOT_SET
}
