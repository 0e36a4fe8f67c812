package io.runconfig.search;

/**
 * Exception thrown when one variant name would be bound to two different configurations.
 *
 * <p>This indicates a defect in name assignment and is never recovered from.</p>
 */
public class NamingCollisionException extends RuntimeException {

    private final String variantName;

    public NamingCollisionException(String variantName) {
        super(String.format(
            "Variant name '%s' is already assigned to a different configuration", variantName));
        this.variantName = variantName;
    }

    public String getVariantName() {
        return variantName;
    }
}
