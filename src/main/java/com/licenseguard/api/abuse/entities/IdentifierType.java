package com.licenseguard.api.abuse.entities;

/**
 * Kind of identifier that a {@link DeviceCreationLimit} window counts device creations for.
 */
public enum IdentifierType {
    IP,
    USER,
}
