package com.licenseguard.api.license.exceptions;

/**
 * Thrown when a license is requested for a device that was never registered.
 */
public class DeviceNotFoundException extends Exception {

    public DeviceNotFoundException(String message) {
        super(message);
    }
}
