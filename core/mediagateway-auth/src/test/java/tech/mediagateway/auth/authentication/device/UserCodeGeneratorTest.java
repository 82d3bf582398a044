package tech.mediagateway.auth.authentication.device;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class UserCodeGeneratorTest {

    private final UserCodeGenerator generator = new UserCodeGenerator();

    @Test
    @DisplayName("Generated codes should use the XXXX-XXXX consonant format")
    void generate_shouldUseConsonantFormat() {
        for (int i = 0; i < 200; i++) {
            assertThat(generator.generate()).matches("[BCDFGHJKLMNPQRSTVWXZ]{4}-[BCDFGHJKLMNPQRSTVWXZ]{4}");
        }
    }

    @Test
    @DisplayName("Generated codes should rarely repeat")
    void generate_shouldProduceMostlyUniqueCodes() {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            codes.add(generator.generate());
        }
        assertThat(codes.size()).isGreaterThan(990);
    }

    @Test
    @DisplayName("Normalize should accept lower case, spaces and a missing hyphen")
    void normalize_shouldCanonicalizeUserInput() {
        assertThat(generator.normalize("bcdf-ghjk")).isEqualTo("BCDF-GHJK");
        assertThat(generator.normalize(" bcdf ghjk ")).isEqualTo("BCDF-GHJK");
        assertThat(generator.normalize("BCDFGHJK")).isEqualTo("BCDF-GHJK");
    }

    @Test
    @DisplayName("Normalize should leave input of the wrong length unformatted")
    void normalize_shouldNotFormat_whenLengthWrong() {
        assertThat(generator.normalize("bcd-fg")).isEqualTo("BCDFG");
        assertThat(generator.normalize(null)).isEmpty();
    }
}
