package com.eventmirror.core.model;

/**
 * How an {@link EventFilter} compares event names.
 *
 * @since 1.0.0
 */
public enum NameMatch {

    /** Names must be equal. */
    EXACT,

    /** Event name contains the expected text. */
    CONTAINS,

    /** Event name starts with the expected text. */
    STARTS_WITH,

    /** Expected text is a regular expression found anywhere in the name. */
    REGEX
}
