package com.serge.community.domain;

/**
 * Content owned by exactly one account. Ownership decides edit rights.
 */
public interface Authored {
    Account getAuthor();
}
