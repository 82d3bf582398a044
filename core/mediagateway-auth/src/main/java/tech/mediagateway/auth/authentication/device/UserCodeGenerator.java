package tech.mediagateway.auth.authentication.device;

import jakarta.enterprise.context.ApplicationScoped;

import java.security.SecureRandom;
import java.util.Locale;

/**
 * Generates short user codes for the device flow.
 *
 * <p>Codes are 8 characters from a 20-letter consonant alphabet, shown as
 * {@code XXXX-XXXX}.
 */
@ApplicationScoped
public class UserCodeGenerator {

    static final String ALPHABET = "BCDFGHJKLMNPQRSTVWXZ";
    static final int LENGTH = 8;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    public String generate() {
        StringBuilder code = new StringBuilder(LENGTH + 1);
        for (int i = 0; i < LENGTH; i++) {
            if (i == LENGTH / 2) {
                code.append('-');
            }
            code.append(ALPHABET.charAt(SECURE_RANDOM.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }

    /**
     * Bring user input into canonical form: upper case, separators and whitespace
     * removed, hyphen re-inserted in the middle. Input that cannot be a user code
     * is returned cleaned but otherwise unchanged, and will simply not be found.
     */
    public String normalize(String input) {
        if (input == null) {
            return "";
        }
        String cleaned = input.toUpperCase(Locale.ROOT).replaceAll("[\\s-]", "");
        if (cleaned.length() != LENGTH) {
            return cleaned;
        }
        return cleaned.substring(0, LENGTH / 2) + "-" + cleaned.substring(LENGTH / 2);
    }
}
