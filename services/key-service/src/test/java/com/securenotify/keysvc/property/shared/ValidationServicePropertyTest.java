package com.securenotify.keysvc.property.shared;

import com.securenotify.keysvc.shared.validation.FieldError;
import com.securenotify.keysvc.shared.validation.ValidationService;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property-based tests for revocation input validation.
 */
@Tag("property")
class ValidationServicePropertyTest {

    private final ValidationService validationService = new ValidationService();

    @Property(tries = 100)
    @Label("Printable reasons of 10 to 1000 characters are accepted")
    void printableReasonsAccepted(@ForAll("validReasons") String reason) {
        assertThat(validationService.validateReason(reason).valid()).isTrue();
    }

    @Property(tries = 100)
    @Label("Reasons shorter than 10 characters after trimming are rejected")
    void shortReasonsRejected(@ForAll("shortReasons") String reason) {
        var result = validationService.validateReason("   " + reason + "   ");

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(FieldError::code).containsAnyOf("TOO_SHORT", "REQUIRED");
    }

    @Property(tries = 100)
    @Label("Control characters other than tab, LF and CR are rejected")
    void controlCharactersRejected(@ForAll("validReasons") String reason, @ForAll("controlChars") char control) {
        String tainted = reason.substring(0, 5) + control + reason.substring(5);

        var result = validationService.validateReason(tainted);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(FieldError::code).contains("INVALID_CHARACTERS");
    }

    @Property(tries = 50)
    @Label("Tab, LF and CR are allowed inside a reason")
    void whitespaceControlsAllowed(@ForAll("validReasons") String reason, @ForAll("allowedControls") char control) {
        String withControl = reason.substring(0, 5) + control + reason.substring(5);

        assertThat(validationService.validateReason(withControl).valid()).isTrue();
    }

    @Property(tries = 50)
    @Label("A lone surrogate is rejected, a surrogate pair is not")
    void loneSurrogateRejected(@ForAll("validReasons") String reason) {
        assertThat(validationService.containsInvalidCharacters(reason + '\uD83D')).isTrue();
        assertThat(validationService.containsInvalidCharacters('\uDE00' + reason)).isTrue();
        assertThat(validationService.containsInvalidCharacters(reason + "😀")).isFalse();
    }

    @Property(tries = 100)
    @Label("Expiry hours inside 1..8760 are accepted")
    void expiryInRangeAccepted(@ForAll @IntRange(min = 1, max = 8760) int hours) {
        assertThat(validationService.validateExpiryHours(hours).valid()).isTrue();
    }

    @Property(tries = 100)
    @Label("Expiry hours outside 1..8760 are rejected")
    void expiryOutOfRangeRejected(@ForAll("outOfRangeHours") int hours) {
        var result = validationService.validateExpiryHours(hours);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(FieldError::code).containsExactly("OUT_OF_RANGE");
    }

    @Property(tries = 50)
    @Label("A full request reports errors for every invalid field")
    void fullRequestCombinesErrors(@ForAll("shortReasons") String reason, @ForAll("outOfRangeHours") int hours) {
        var result = validationService.validateRevocationRequest(reason, hours);

        assertThat(result.valid()).isFalse();
        assertThat(result.hasErrorFor("reason")).isTrue();
        assertThat(result.hasErrorFor("confirmationHours")).isTrue();
    }

    @Property(tries = 50)
    @Label("A full request with valid fields passes")
    void fullRequestValid(@ForAll("validReasons") String reason, @ForAll @IntRange(min = 1, max = 8760) int hours) {
        var result = validationService.validateRevocationRequest(reason, hours);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Provide
    Arbitrary<String> validReasons() {
        return Arbitraries.strings()
                .withCharRange('a', 'z')
                .withCharRange('A', 'Z')
                .withChars(' ', '.', ',', '-')
                .ofMinLength(10)
                .ofMaxLength(200)
                .filter(s -> s.trim().length() >= 10);
    }

    @Provide
    Arbitrary<String> shortReasons() {
        return Arbitraries.strings().withCharRange('a', 'z').ofMaxLength(9);
    }

    @Provide
    Arbitrary<Character> controlChars() {
        return Arbitraries.oneOf(
                Arbitraries.chars().range('\u0000', '\u001F').filter(c -> c != '\t' && c != '\n' && c != '\r'),
                Arbitraries.just('\u007F'));
    }

    @Provide
    Arbitrary<Character> allowedControls() {
        return Arbitraries.of('\t', '\n', '\r');
    }

    @Provide
    Arbitrary<Integer> outOfRangeHours() {
        return Arbitraries.oneOf(
                Arbitraries.integers().between(-10_000, 0),
                Arbitraries.integers().between(8761, 100_000));
    }
}
