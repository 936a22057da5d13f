package xyz.benanderson.offlinepay.scan;

public enum ScanMode {

    /** The session ends after the first accepted code. */
    SINGLE,
    /** The session keeps accepting distinct codes until closed. */
    CONTINUOUS

}
