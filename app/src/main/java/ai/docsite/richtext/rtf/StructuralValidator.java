package ai.docsite.richtext.rtf;

import java.util.EnumSet;
import java.util.Set;

/**
 * Checks group balance and structural marker density of a control-word candidate.
 */
public final class StructuralValidator {

    static final int MIN_SIGNATURES = 2;

    public ValidationVerdict validate(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return ValidationVerdict.empty();
        }
        BalanceScan scan = scanBalance(candidate);

        Set<StructuralSignature> found = EnumSet.noneOf(StructuralSignature.class);
        for (StructuralSignature signature : StructuralSignature.values()) {
            if (signature.matches(candidate)) {
                found.add(signature);
            }
        }
        int confidence = found.size() * 100 / StructuralSignature.values().length;
        boolean valid = scan.balanced() && found.size() >= MIN_SIGNATURES;
        return new ValidationVerdict(valid, confidence, scan.delta(), found);
    }

    /**
     * Single left-to-right scan. Escaped markers ({@code \{}, {@code \}}) and escaped backslashes do not count.
     */
    static BalanceScan scanBalance(String candidate) {
        int depth = 0;
        boolean wentNegative = false;
        for (int i = 0; i < candidate.length(); i++) {
            char ch = candidate.charAt(i);
            if (ch == '\\') {
                i++;
                continue;
            }
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth < 0) {
                    wentNegative = true;
                }
            }
        }
        return new BalanceScan(depth, wentNegative);
    }

    record BalanceScan(int delta, boolean wentNegative) {

        boolean balanced() {
            return delta == 0 && !wentNegative;
        }
    }
}
