package xyz.benanderson.offlinepay.scan;

/**
 * Displays an opaque payload as a scannable code.
 */
@FunctionalInterface
public interface CodeRenderer {

    void render(String payload);

}
