package com.serge.community.domain;

public enum RoleName {
    ADMINISTRATOR,
    MODERATOR,
    LIBRARIAN
}
