package com.unifiedplatform.backend.modules.reference.application;

import com.unifiedplatform.backend.modules.reference.domain.ReferenceKind;

/**
 * Resolves external keys (branch codes, resource ids, user identifiers) the lifecycle modules refer to.
 */
public interface ReferenceValidator {

    boolean exists(ReferenceKind kind, String key);
}
