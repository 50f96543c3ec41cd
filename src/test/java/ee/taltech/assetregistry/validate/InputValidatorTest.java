package ee.taltech.assetregistry.validate;

import ee.taltech.assetregistry.error.RegistryError;
import ee.taltech.assetregistry.error.RegistryException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputValidatorTest {

    private final InputValidator validator = new InputValidator();

    @Test
    void nameBoundaries() {
        assertThatCode(() -> validator.validateName("a")).doesNotThrowAnyException();
        assertThatCode(() -> validator.validateName("n".repeat(64))).doesNotThrowAnyException();

        assertRejected(() -> validator.validateName(""), RegistryError.INVALID_PARAMETERS);
        assertRejected(() -> validator.validateName("n".repeat(65)), RegistryError.INVALID_PARAMETERS);
        assertRejected(() -> validator.validateName(null), RegistryError.INVALID_PARAMETERS);
    }

    @Test
    void nameLengthIsCountedInBytes() {
        // 32 two-byte chars = 64 bytes
        assertThatCode(() -> validator.validateName("ä".repeat(32))).doesNotThrowAnyException();
        assertRejected(() -> validator.validateName("ä".repeat(33)), RegistryError.INVALID_PARAMETERS);
    }

    @Test
    void sizeBoundaries() {
        assertThatCode(() -> validator.validateSize(1)).doesNotThrowAnyException();
        assertThatCode(() -> validator.validateSize(999_999_999)).doesNotThrowAnyException();

        assertRejected(() -> validator.validateSize(0), RegistryError.CAPACITY_EXCEEDED);
        assertRejected(() -> validator.validateSize(1_000_000_000), RegistryError.CAPACITY_EXCEEDED);
        assertRejected(() -> validator.validateSize(-5), RegistryError.CAPACITY_EXCEEDED);
    }

    @Test
    void descriptionBoundaries() {
        assertThatCode(() -> validator.validateDescription("d")).doesNotThrowAnyException();
        assertThatCode(() -> validator.validateDescription("d".repeat(128))).doesNotThrowAnyException();

        assertRejected(() -> validator.validateDescription(""), RegistryError.INVALID_PARAMETERS);
        assertRejected(() -> validator.validateDescription("d".repeat(129)), RegistryError.INVALID_PARAMETERS);
    }

    @Test
    void tagListBoundaries() {
        assertThatCode(() -> validator.validateTags(List.of("a"))).doesNotThrowAnyException();
        assertThatCode(() -> validator.validateTags(Collections.nCopies(10, "t"))).doesNotThrowAnyException();

        assertRejected(() -> validator.validateTags(List.of()), RegistryError.FORMAT_VALIDATION);
        assertRejected(() -> validator.validateTags(Collections.nCopies(11, "t")), RegistryError.FORMAT_VALIDATION);
        assertRejected(() -> validator.validateTags(null), RegistryError.FORMAT_VALIDATION);
    }

    @Test
    void individualTagBoundaries() {
        assertThatCode(() -> validator.validateTags(List.of("t".repeat(32)))).doesNotThrowAnyException();

        assertRejected(() -> validator.validateTags(List.of("ok", "")), RegistryError.FORMAT_VALIDATION);
        assertRejected(() -> validator.validateTags(List.of("t".repeat(33))), RegistryError.FORMAT_VALIDATION);

        List<String> withNull = new ArrayList<>();
        withNull.add(null);
        assertRejected(() -> validator.validateTags(withNull), RegistryError.FORMAT_VALIDATION);
    }

    @Test
    void firstViolatedFieldWins() {
        // bad name and bad size: name is checked first
        assertRejected(() -> validator.validateAssetFields("", 0, "", List.of()), RegistryError.INVALID_PARAMETERS);
        // good name, bad size and tags
        assertRejected(() -> validator.validateAssetFields("n", 0, "d", List.of()), RegistryError.CAPACITY_EXCEEDED);
        // only tags wrong
        assertRejected(() -> validator.validateAssetFields("n", 1, "d", List.of()), RegistryError.FORMAT_VALIDATION);
    }

    @Test
    void principalFormat() {
        assertThatCode(() -> validator.validatePrincipal("SP2J6ZY48GV1EZ5V2V5RB9MP66SW86PYKKNRV9EJ7"))
                .doesNotThrowAnyException();

        assertRejected(() -> validator.validatePrincipal(null), RegistryError.INVALID_PARAMETERS);
        assertRejected(() -> validator.validatePrincipal("  "), RegistryError.INVALID_PARAMETERS);
        assertRejected(() -> validator.validatePrincipal("has space"), RegistryError.INVALID_PARAMETERS);
        assertRejected(() -> validator.validatePrincipal("p".repeat(129)), RegistryError.INVALID_PARAMETERS);
    }

    private static void assertRejected(Runnable call, RegistryError expected) {
        assertThatThrownBy(call::run)
                .isInstanceOf(RegistryException.class)
                .extracting(e -> ((RegistryException) e).error())
                .isEqualTo(expected);
    }
}
