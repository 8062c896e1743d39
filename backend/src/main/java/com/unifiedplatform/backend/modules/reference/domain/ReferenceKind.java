package com.unifiedplatform.backend.modules.reference.domain;

/**
 * Kinds of keys the lifecycle modules resolve against the reference directory.
 */
public enum ReferenceKind {
    /** Branch code such as {@code RU-01}. */
    BRANCH,
    /** Resource identity (UUID). */
    RESOURCE,
    /** User email or user identity (UUID). */
    USER
}
