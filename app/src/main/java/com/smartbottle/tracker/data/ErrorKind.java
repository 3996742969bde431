package com.smartbottle.tracker.data;

/**
 * Failure categories reported by the transport, decoder, calibration and session layers.
 * The UI picks its remediation prompt from the kind, so keep them specific.
 */
public enum ErrorKind {
    /** Radio powered off or not supported on this host. */
    RADIO_UNAVAILABLE,
    /** Scan/connect permission not granted. */
    PERMISSION_DENIED,
    /** Scan window elapsed. Not fatal: the scan simply returns what it saw. */
    SCAN_TIMEOUT,
    CONNECT_TIMEOUT,
    /** Platform refused or dropped the link during setup. */
    CONNECT_FAILED,
    SERVICE_NOT_FOUND,
    CHARACTERISTIC_NOT_FOUND,
    WRITE_FAILED,
    /** Payload matched no known shape; dropped and counted. */
    UNPARSEABLE_PAYLOAD,
    /** Empty baseline is not greater than the full baseline. */
    CALIBRATION_INVALID,
    /** Reading arrived while no subject was bound. */
    NO_ACTIVE_SUBJECT,
    /** Connect attempt or calibration step aborted by disconnect or subject switch. */
    CANCELLED,
    /** Calibration persistence collaborator failed. */
    STORAGE_FAILED;

    public boolean isTransportFault() {
        switch (this) {
            case RADIO_UNAVAILABLE:
            case PERMISSION_DENIED:
            case CONNECT_TIMEOUT:
            case CONNECT_FAILED:
            case SERVICE_NOT_FOUND:
            case CHARACTERISTIC_NOT_FOUND:
            case WRITE_FAILED:
                return true;
            default:
                return false;
        }
    }
}
