package xyz.benanderson.offlinepay.scan;

public enum ScanState {
    IDLE, PROCESSING, TERMINAL
}
