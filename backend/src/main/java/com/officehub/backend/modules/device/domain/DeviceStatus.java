package com.officehub.backend.modules.device.domain;

/**
 * Derived availability of a device. Only device request transitions write it.
 */
public enum DeviceStatus {
    AVAILABLE,
    UNDER_REQUEST,
    BORROWED
}
