package com.globalnewsbrief.core.model;

import com.globalnewsbrief.core.validation.Violations;

/**
 * Transport envelope; serializes as {@code {"bulletin": {...}}}.
 */
public record BulletinWrapper(Bulletin bulletin) {
    public BulletinWrapper {
        Violations violations = new Violations();
        violations.required("bulletin", bulletin);
        violations.throwIfAny("BulletinWrapper");
    }
}
