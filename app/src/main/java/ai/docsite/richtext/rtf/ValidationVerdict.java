package ai.docsite.richtext.rtf;

import java.util.Objects;
import java.util.Set;

/**
 * Outcome of a structural check on a control-word candidate.
 *
 * @param isValid balanced groups and enough structural signatures
 * @param confidence matched signatures as a percentage of all signatures
 * @param balanceDelta open minus close group markers; zero for balanced input
 * @param signatures the signatures found in the candidate
 */
public record ValidationVerdict(boolean isValid, int confidence, int balanceDelta, Set<StructuralSignature> signatures) {

    public ValidationVerdict {
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100");
        }
        signatures = Set.copyOf(Objects.requireNonNull(signatures, "signatures"));
    }

    public static ValidationVerdict empty() {
        return new ValidationVerdict(false, 0, 0, Set.of());
    }

    public boolean isBalanced() {
        return balanceDelta == 0;
    }
}
