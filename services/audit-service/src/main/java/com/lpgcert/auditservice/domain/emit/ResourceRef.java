package com.lpgcert.auditservice.domain.emit;

/**
 * Reference to the object a user activity concerns.
 *
 * @param type kind of object (e.g. "report", "customer")
 * @param id identifier of the object
 * @param name display name, nullable
 */
public record ResourceRef(String type, String id, String name) {

    public static ResourceRef of(String type, String id) {
        return new ResourceRef(type, id, null);
    }
}
