package org.operaton.fedlink.security;

public enum KeyPurpose {
    PRIVATE,
    PUBLIC
}
